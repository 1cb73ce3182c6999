package com.stormline.herald.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response object from LLM completions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LLMResponse {

    private String id;

    private String model;

    private String providerId;

    /**
     * Generated content.
     */
    private String content;

    /**
     * Tool calls requested by the model.
     */
    private List<LLMRequest.ToolCall> toolCalls;

    private FinishReason finishReason;

    private Usage usage;

    /**
     * Generation latency in milliseconds.
     */
    private Long latencyMs;

    /**
     * Reasons for completion finish.
     */
    public enum FinishReason {
        STOP,           // Natural completion
        LENGTH,         // Hit max tokens
        TOOL_CALLS,     // Model requested tool calls
        CONTENT_FILTER  // Blocked by content filter
    }

    /**
     * Token usage statistics.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Usage {
        private int promptTokens;
        private int completionTokens;
        private int totalTokens;
    }

    /**
     * Check if the response has tool calls.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public int getTotalTokens() {
        return usage != null ? usage.getTotalTokens() : 0;
    }

    /**
     * Create a simple text response.
     */
    public static LLMResponse text(String content, String model, String providerId) {
        return LLMResponse.builder()
                .content(content)
                .model(model)
                .providerId(providerId)
                .finishReason(FinishReason.STOP)
                .build();
    }

    /**
     * Create a tool calls response.
     */
    public static LLMResponse toolCalls(List<LLMRequest.ToolCall> calls, String model, String providerId) {
        return LLMResponse.builder()
                .toolCalls(calls)
                .model(model)
                .providerId(providerId)
                .finishReason(FinishReason.TOOL_CALLS)
                .build();
    }
}
