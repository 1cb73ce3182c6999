package com.stormline.herald.agent;

import com.stormline.herald.domain.model.ExecutionResult.ErrorType;

/**
 * Failure raised inside the execution loop and converted to an error result at the execute boundary.
 */
public class AgentExecutionException extends RuntimeException {

    private final ErrorType errorType;
    private final int rounds;

    public AgentExecutionException(ErrorType errorType, String message, int rounds) {
        super(message);
        this.errorType = errorType;
        this.rounds = rounds;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public int getRounds() {
        return rounds;
    }
}
