package com.stormline.herald.agent;

import com.stormline.herald.tool.AgentTool;
import com.stormline.herald.tool.ToolResult;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Tool stub that records its invocations.
 */
public class RecordingTool implements AgentTool {

    private final String name;
    private final Function<Map<String, Object>, Mono<ToolResult>> behavior;
    private final List<Map<String, Object>> invocations = new ArrayList<>();

    public RecordingTool(String name, Function<Map<String, Object>, Mono<ToolResult>> behavior) {
        this.name = name;
        this.behavior = behavior;
    }

    public static RecordingTool returning(String name, String output) {
        return new RecordingTool(name, params -> Mono.just(ToolResult.success(name, output)));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return "Test tool " + name;
    }

    @Override
    public Map<String, Object> getParameterSchema() {
        return Map.of("type", "object", "properties", Map.of());
    }

    @Override
    public Mono<ToolResult> execute(Map<String, Object> parameters) {
        invocations.add(parameters);
        return behavior.apply(parameters);
    }

    public List<Map<String, Object>> invocations() {
        return invocations;
    }
}
