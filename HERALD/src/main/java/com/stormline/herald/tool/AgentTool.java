package com.stormline.herald.tool;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Interface for tools that agents can use.
 * Tools are named, described capabilities the reasoning engine may ask the loop to invoke.
 *
 * <p>Implementations must not signal errors across this boundary: transport and parse
 * failures are reported as a failed {@link ToolResult}.
 */
public interface AgentTool {

    /**
     * Get the tool name (unique within an agent's tool set, shown to the LLM).
     *
     * @return tool name
     */
    String getName();

    /**
     * Get the tool description (used by LLM to decide when to use).
     *
     * @return tool description
     */
    String getDescription();

    /**
     * Get the JSON Schema for tool parameters.
     *
     * @return parameter schema as map (JSON Schema format)
     */
    Map<String, Object> getParameterSchema();

    /**
     * Execute the tool with given parameters.
     *
     * @param parameters tool parameters
     * @return tool result
     */
    Mono<ToolResult> execute(Map<String, Object> parameters);

    /**
     * Validate parameters before execution.
     *
     * @param parameters the parameters to validate
     * @return validation result
     */
    default Mono<ValidationResult> validate(Map<String, Object> parameters) {
        return Mono.just(ValidationResult.success());
    }

    /**
     * Parameter validation result.
     */
    record ValidationResult(
            boolean valid,
            String message
    ) {
        public static ValidationResult success() {
            return new ValidationResult(true, null);
        }

        public static ValidationResult failure(String message) {
            return new ValidationResult(false, message);
        }
    }
}
