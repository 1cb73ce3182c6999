package com.stormline.herald.api.v1;

import com.stormline.herald.agent.Agent;
import com.stormline.herald.api.dto.AgentDescriptor;
import com.stormline.herald.api.dto.ExecuteRequest;
import com.stormline.herald.api.dto.ExecuteResponse;
import com.stormline.herald.agent.ConversationHistory;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for agent execution.
 */
@RestController
@RequestMapping("/api/v1/agents")
@Tag(name = "Agents", description = "Agent execution operations")
@Slf4j
public class AgentController {

    private final Map<String, Agent> agents;

    public AgentController(List<Agent> agents) {
        Map<String, Agent> byName = new LinkedHashMap<>();
        for (Agent agent : agents) {
            byName.put(agent.getName(), agent);
        }
        this.agents = byName;
    }

    @GetMapping
    @Operation(summary = "List agents", description = "List all agents with their tools")
    @ApiResponse(responseCode = "200", description = "Agents retrieved")
    public Flux<AgentDescriptor> listAgents() {
        return Flux.fromIterable(agents.values())
                .map(AgentDescriptor::from);
    }

    @GetMapping("/{name}")
    @Operation(summary = "Get agent", description = "Describe an agent and its tools")
    @ApiResponse(responseCode = "200", description = "Agent found")
    @ApiResponse(responseCode = "404", description = "Agent not found")
    public Mono<ResponseEntity<AgentDescriptor>> getAgent(
            @Parameter(description = "Agent name") @PathVariable String name) {

        Agent agent = agents.get(name);
        if (agent == null) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        return Mono.just(ResponseEntity.ok(AgentDescriptor.from(agent)));
    }

    @PostMapping("/{name}/execute")
    @Operation(summary = "Execute agent", description = "Run a query through the agent's tool loop")
    @ApiResponse(responseCode = "200", description = "Execution finished with an answer or an error")
    @ApiResponse(responseCode = "404", description = "Agent not found")
    public Mono<ResponseEntity<ExecuteResponse>> execute(
            @Parameter(description = "Agent name") @PathVariable String name,
            @Valid @RequestBody ExecuteRequest request) {

        Agent agent = agents.get(name);
        if (agent == null) {
            return Mono.just(ResponseEntity.notFound().build());
        }

        log.info("Executing agent {}", name);
        return agent.execute(request.getQuery(), ConversationHistory.fromJson(request.getHistory()))
                .map(result -> {
                    if (!result.isSuccess()) {
                        log.info("Agent {} execution failed: {}", name, result.getErrorType());
                    }
                    return ResponseEntity.ok(ExecuteResponse.from(result));
                });
    }
}
