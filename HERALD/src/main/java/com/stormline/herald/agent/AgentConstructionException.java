package com.stormline.herald.agent;

/**
 * Thrown when an agent is built from an invalid engine or tool set.
 * This is the only agent failure raised to callers; execution failures are returned as results.
 */
public class AgentConstructionException extends RuntimeException {

    public AgentConstructionException(String message) {
        super(message);
    }

    public AgentConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
