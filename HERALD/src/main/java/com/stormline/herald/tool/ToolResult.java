package com.stormline.herald.tool;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of a tool execution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolResult {

    public static final String NO_RESULT = "NO_RESULT";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String EXECUTION_ERROR = "EXECUTION_ERROR";

    /**
     * Name of the tool that was executed.
     */
    private String toolName;

    /**
     * Whether execution completed.
     */
    private boolean success;

    /**
     * Result as string (for LLM consumption).
     */
    private String output;

    /**
     * Failure category (for failed executions).
     */
    private String errorCode;

    /**
     * Error message (for failed executions).
     */
    private String errorMessage;

    /**
     * Execution duration.
     */
    private Duration duration;

    /**
     * When execution completed.
     */
    private Instant completedAt;

    /**
     * Create a success result with string output.
     */
    public static ToolResult success(String toolName, String output) {
        return ToolResult.builder()
                .toolName(toolName)
                .success(true)
                .output(output)
                .completedAt(Instant.now())
                .build();
    }

    /**
     * Create a failure result.
     */
    public static ToolResult failure(String toolName, String errorCode, String errorMessage) {
        return ToolResult.builder()
                .toolName(toolName)
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .completedAt(Instant.now())
                .build();
    }

    /**
     * Create a result for a tool that could not complete (no output was produced).
     */
    public static ToolResult noResult(String toolName, String errorMessage) {
        return failure(toolName, NO_RESULT, errorMessage);
    }

    /**
     * Get the output for LLM consumption.
     */
    public String getOutputForLLM() {
        if (success) {
            return output != null ? output : "";
        }
        return "Error: " + errorMessage;
    }
}
