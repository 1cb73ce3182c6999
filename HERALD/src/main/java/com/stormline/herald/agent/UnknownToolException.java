package com.stormline.herald.agent;

import com.stormline.herald.domain.model.ExecutionResult.ErrorType;

public class UnknownToolException extends AgentExecutionException {

    private final String toolName;

    public UnknownToolException(String toolName, int rounds) {
        super(ErrorType.UNKNOWN_TOOL, "Unknown tool requested: " + toolName, rounds);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
