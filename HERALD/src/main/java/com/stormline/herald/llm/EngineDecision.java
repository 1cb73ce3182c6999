package com.stormline.herald.llm;

import com.stormline.herald.domain.model.ToolCallRequest;

/**
 * What the reasoning engine decided for one round: answer, or call exactly one tool.
 */
public sealed interface EngineDecision permits EngineDecision.FinalAnswer, EngineDecision.ToolCall {

    record FinalAnswer(String text) implements EngineDecision {
    }

    record ToolCall(ToolCallRequest request) implements EngineDecision {
    }

    static EngineDecision finalAnswer(String text) {
        return new FinalAnswer(text);
    }

    static EngineDecision toolCall(ToolCallRequest request) {
        return new ToolCall(request);
    }
}
