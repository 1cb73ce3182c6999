package com.stormline.herald.agent;

import com.stormline.herald.domain.model.ConversationTurn;
import com.stormline.herald.domain.model.ExecutionResult;
import com.stormline.herald.domain.model.ExecutionResult.ErrorType;
import com.stormline.herald.llm.ReasoningEngine;
import com.stormline.herald.tool.AgentTool;
import com.stormline.herald.tool.ToolRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for agents sharing the standard execution loop.
 *
 * <p>The engine and tool set are checked before anything else happens.
 * Subclasses call {@link #initialize()} once their own state is ready, which
 * builds the prompt and binds the loop. An agent that was never initialized
 * answers every execution with a {@code NOT_INITIALIZED} error.
 */
@Slf4j
public abstract class BaseAgent implements Agent {

    private final ReasoningEngine engine;
    private final ToolRegistry toolRegistry;
    private final int maxRounds;
    private final MeterRegistry meterRegistry;

    private volatile AgentSpec spec;
    private volatile AgentExecutionLoop loop;

    protected BaseAgent(Object engine, List<?> tools, int maxRounds, MeterRegistry meterRegistry) {
        if (!(engine instanceof ReasoningEngine reasoningEngine)) {
            throw new AgentConstructionException("Reasoning engine must implement " + ReasoningEngine.class.getSimpleName()
                    + ", got " + describe(engine));
        }
        if (tools == null) {
            throw new AgentConstructionException("Tool list must not be null");
        }
        List<AgentTool> checked = new ArrayList<>(tools.size());
        for (Object tool : tools) {
            if (!(tool instanceof AgentTool agentTool)) {
                throw new AgentConstructionException("Tool must implement " + AgentTool.class.getSimpleName()
                        + ", got " + describe(tool));
            }
            checked.add(agentTool);
        }
        try {
            this.toolRegistry = new ToolRegistry(checked);
        } catch (IllegalArgumentException e) {
            throw new AgentConstructionException("Invalid tool set: " + e.getMessage(), e);
        }
        if (maxRounds < 1) {
            throw new AgentConstructionException("maxRounds must be at least 1, got " + maxRounds);
        }
        this.engine = reasoningEngine;
        this.maxRounds = maxRounds;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Build the prompt and bind the loop. Called once from the concrete constructor.
     */
    protected final void initialize() {
        this.spec = new AgentSpec(buildPrompt(), toolRegistry);
        this.loop = bindLoop();
        log.info("Agent {} initialized with tools {}", getName(), toolRegistry.getToolNames());
    }

    @Override
    public AgentExecutionLoop bindLoop() {
        if (spec == null) {
            throw new IllegalStateException("Agent prompt is not built");
        }
        return new AgentExecutionLoop(engine, spec, maxRounds, meterRegistry);
    }

    @Override
    public Mono<ExecutionResult> execute(String query, List<ConversationTurn> history) {
        AgentExecutionLoop current = loop;
        if (current == null) {
            return Mono.just(ExecutionResult.error(ErrorType.NOT_INITIALIZED,
                    "Agent " + getName() + " is not initialized"));
        }
        return current.run(query, history);
    }

    @Override
    public AgentSpec getSpec() {
        return spec;
    }

    protected ToolRegistry getToolRegistry() {
        return toolRegistry;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
