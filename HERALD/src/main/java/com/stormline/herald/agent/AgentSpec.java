package com.stormline.herald.agent;

import com.stormline.herald.tool.ToolRegistry;

import java.util.Objects;

/**
 * Prompt and tool bindings of one agent, fixed for the agent's lifetime.
 */
public record AgentSpec(String systemPrompt, ToolRegistry tools) {

    public AgentSpec {
        Objects.requireNonNull(systemPrompt, "systemPrompt");
        Objects.requireNonNull(tools, "tools");
    }
}
