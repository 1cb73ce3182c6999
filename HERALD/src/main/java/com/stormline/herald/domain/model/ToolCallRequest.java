package com.stormline.herald.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single tool invocation requested by the reasoning engine.
 *
 * @param id engine-assigned call id, echoed back on the tool turn
 * @param name requested tool name
 * @param arguments parsed arguments, never null
 */
public record ToolCallRequest(
        String id,
        String name,
        Map<String, Object> arguments
) {
    public ToolCallRequest {
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    /**
     * Same tool with equal arguments; the call id is ignored.
     */
    public boolean sameInvocationAs(ToolCallRequest other) {
        return other != null
                && name != null
                && name.equals(other.name)
                && arguments.equals(other.arguments);
    }
}
