package com.stormline.herald.tool;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of tools bound to one agent.
 * Names are unique; lookup is by exact name as the LLM reports it.
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, AgentTool> tools;

    public ToolRegistry(List<? extends AgentTool> toolList) {
        Map<String, AgentTool> byName = new LinkedHashMap<>();
        for (AgentTool tool : toolList) {
            String name = tool.getName();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Tool name must not be blank: " + tool.getClass().getName());
            }
            if (byName.putIfAbsent(name, tool) != null) {
                throw new IllegalArgumentException("Duplicate tool name: " + name);
            }
            log.debug("Bound tool: {}", name);
        }
        this.tools = Collections.unmodifiableMap(byName);
    }

    /**
     * Get a tool by name.
     *
     * @param name the tool name
     * @return the tool or empty
     */
    public Optional<AgentTool> getTool(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    /**
     * Get all tools in binding order.
     */
    public List<AgentTool> getAllTools() {
        return List.copyOf(tools.values());
    }

    public Set<String> getToolNames() {
        return tools.keySet();
    }

    /**
     * Validate and execute a bound tool.
     * Error signals from the tool are converted into a failed result.
     *
     * @param tool the tool
     * @param parameters the parameters
     * @return the result, never an error signal
     */
    public Mono<ToolResult> execute(AgentTool tool, Map<String, Object> parameters) {
        String name = tool.getName();
        Instant startTime = Instant.now();

        return Mono.defer(() -> tool.validate(parameters))
                .flatMap(validation -> {
                    if (!validation.valid()) {
                        return Mono.just(ToolResult.failure(name, ToolResult.VALIDATION_ERROR, validation.message()));
                    }
                    return tool.execute(parameters);
                })
                .defaultIfEmpty(ToolResult.noResult(name, "Tool returned no result"))
                .onErrorResume(e -> {
                    log.error("Tool execution failed: {} - {}", name, e.getMessage());
                    return Mono.just(ToolResult.failure(name, ToolResult.EXECUTION_ERROR, e.getMessage()));
                })
                .doOnNext(result -> result.setDuration(Duration.between(startTime, Instant.now())));
    }

    public boolean hasTool(String name) {
        return tools.containsKey(name);
    }

    public int size() {
        return tools.size();
    }
}
