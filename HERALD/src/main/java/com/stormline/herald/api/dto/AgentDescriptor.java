package com.stormline.herald.api.dto;

import com.stormline.herald.agent.Agent;
import com.stormline.herald.tool.AgentTool;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Public description of an agent and its bound tools.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentDescriptor {

    private String name;

    private List<ToolDescriptor> tools;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolDescriptor {
        private String name;
        private String description;
    }

    public static AgentDescriptor from(Agent agent) {
        List<ToolDescriptor> tools = agent.getSpec() == null
                ? List.of()
                : agent.getSpec().tools().getAllTools().stream()
                        .map(AgentDescriptor::describe)
                        .toList();
        return AgentDescriptor.builder()
                .name(agent.getName())
                .tools(tools)
                .build();
    }

    private static ToolDescriptor describe(AgentTool tool) {
        return new ToolDescriptor(tool.getName(), tool.getDescription());
    }
}
