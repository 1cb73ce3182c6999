package com.stormline.herald.agent;

import com.stormline.herald.domain.model.ConversationTurn;
import com.stormline.herald.domain.model.ExecutionResult;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * A tool-using agent specialization.
 */
public interface Agent {

    /**
     * Get the agent name.
     */
    String getName();

    /**
     * Produce the system-level instructions for the reasoning engine.
     */
    String buildPrompt();

    /**
     * Wire the prompt and bound tools into a ready-to-run loop.
     */
    AgentExecutionLoop bindLoop();

    /**
     * Execute a query against prior conversation turns.
     *
     * @param query the user query
     * @param history prior turns; not modified
     * @return the answer or a structured error; never an error signal
     */
    Mono<ExecutionResult> execute(String query, List<ConversationTurn> history);

    /**
     * Get the prompt and tool bindings, or null before initialization.
     */
    AgentSpec getSpec();
}
