package com.stormline.herald.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one agent execution: either an answer or an error, never both.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ExecutionResult {

    private final String answer;
    private final String error;
    private final ErrorType errorType;
    private final int rounds;

    private ExecutionResult(String answer, String error, ErrorType errorType, int rounds) {
        this.answer = answer;
        this.error = error;
        this.errorType = errorType;
        this.rounds = rounds;
    }

    public static ExecutionResult answer(String answer, int rounds) {
        return new ExecutionResult(answer == null ? "" : answer, null, null, rounds);
    }

    public static ExecutionResult error(ErrorType errorType, String error) {
        return new ExecutionResult(null, error, errorType, 0);
    }

    public static ExecutionResult error(ErrorType errorType, String error, int rounds) {
        return new ExecutionResult(null, error, errorType, rounds);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Failure categories reported by an execution.
     */
    public enum ErrorType {
        EMPTY_QUERY,
        UNKNOWN_TOOL,
        ROUND_LIMIT_EXCEEDED,
        LOOP_FAULT,
        NOT_INITIALIZED
    }
}
