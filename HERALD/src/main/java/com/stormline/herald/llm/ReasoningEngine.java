package com.stormline.herald.llm;

import com.stormline.herald.domain.model.ConversationTurn;
import com.stormline.herald.tool.AgentTool;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * The language-model side of the agent loop.
 * Implementations must be safe for concurrent use by several executions.
 */
public interface ReasoningEngine {

    /**
     * Decide the next step of an execution.
     *
     * @param systemPrompt agent instructions
     * @param transcript working transcript: history, the user query, then tool rounds so far
     * @param tools tools the engine may request
     * @return a final answer or a single tool call
     */
    Mono<EngineDecision> decide(String systemPrompt, List<ConversationTurn> transcript, List<AgentTool> tools);
}
