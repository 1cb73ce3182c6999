package com.stormline.herald.agent;

import com.stormline.herald.domain.model.ExecutionResult.ErrorType;

public class RoundLimitExceededException extends AgentExecutionException {

    public RoundLimitExceededException(int maxRounds) {
        super(ErrorType.ROUND_LIMIT_EXCEEDED,
                "Round limit exceeded: no final answer after " + maxRounds + " rounds", maxRounds);
    }
}
