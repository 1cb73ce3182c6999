package com.stormline.herald.agent;

import com.stormline.herald.domain.model.ConversationTurn;
import com.stormline.herald.domain.model.ExecutionResult;
import com.stormline.herald.domain.model.ExecutionResult.ErrorType;
import com.stormline.herald.domain.model.ToolCallRequest;
import com.stormline.herald.llm.EngineDecision;
import com.stormline.herald.llm.ReasoningEngine;
import com.stormline.herald.tool.AgentTool;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Drives a reasoning engine through sequential tool rounds until it produces a final answer.
 *
 * <p>Each round:
 * <ol>
 *   <li>Ask the engine for a decision over the working transcript</li>
 *   <li>On a final answer, stop</li>
 *   <li>On a tool call, resolve the tool, invoke it and append the request and result turns</li>
 * </ol>
 * The caller's history is copied into a per-call transcript and never modified.
 * {@link #run} always completes with a result, never with an error signal.
 */
@Slf4j
public class AgentExecutionLoop {

    static final String EMPTY_QUERY_MESSAGE = "Empty query provided";
    static final String LOOP_FAULT_PREFIX = "Unable to process the query: ";

    private final ReasoningEngine engine;
    private final AgentSpec spec;
    private final int maxRounds;
    private final MeterRegistry meterRegistry;
    private final Timer executionTimer;

    public AgentExecutionLoop(ReasoningEngine engine, AgentSpec spec, int maxRounds, MeterRegistry meterRegistry) {
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be at least 1");
        }
        this.engine = engine;
        this.spec = spec;
        this.maxRounds = maxRounds;
        this.meterRegistry = meterRegistry;
        this.executionTimer = Timer.builder("herald.agent.execution.latency")
                .register(meterRegistry);
    }

    /**
     * Run one execution.
     *
     * @param query the user query
     * @param history prior turns, read-only
     * @return the answer or a structured error
     */
    public Mono<ExecutionResult> run(String query, List<ConversationTurn> history) {
        return Mono.defer(() -> {
            Timer.Sample sample = Timer.start(meterRegistry);

            return Mono.defer(() -> start(query, history))
                    .onErrorResume(this::toErrorResult)
                    .doOnNext(result -> {
                        sample.stop(executionTimer);
                        String outcome = result.isSuccess() ? "success" : result.getErrorType().name().toLowerCase(Locale.ROOT);
                        meterRegistry.counter("herald.agent.executions", "outcome", outcome).increment();
                    });
        });
    }

    private Mono<ExecutionResult> start(String query, List<ConversationTurn> history) {
        if (query == null || query.isBlank()) {
            log.warn("Rejected empty query");
            return Mono.just(ExecutionResult.error(ErrorType.EMPTY_QUERY, EMPTY_QUERY_MESSAGE));
        }

        List<ConversationTurn> transcript = new ArrayList<>(ConversationHistory.normalize(history));
        transcript.add(ConversationTurn.user(query.strip()));
        log.debug("Starting execution with {} prior turns", transcript.size() - 1);

        return executeLoop(transcript, new ScratchPad(), 0);
    }

    private Mono<ExecutionResult> executeLoop(List<ConversationTurn> transcript, ScratchPad scratchPad, int round) {
        if (round >= maxRounds) {
            log.warn("No final answer after {} rounds ({} tool calls)", maxRounds, scratchPad.size());
            return Mono.error(new RoundLimitExceededException(maxRounds));
        }

        return engine.decide(spec.systemPrompt(), List.copyOf(transcript), spec.tools().getAllTools())
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("reasoning engine returned no decision")))
                .flatMap(decision -> {
                    if (decision instanceof EngineDecision.FinalAnswer answer) {
                        log.debug("Final answer after {} rounds", round + 1);
                        return Mono.just(ExecutionResult.answer(answer.text(), round + 1));
                    }
                    if (!(decision instanceof EngineDecision.ToolCall toolCall)) {
                        return Mono.error(new IllegalStateException("unsupported engine decision: " + decision));
                    }

                    ToolCallRequest request = toolCall.request();
                    return invokeTool(request, scratchPad, round)
                            .flatMap(output -> {
                                transcript.add(ConversationTurn.toolRequest(request));
                                transcript.add(ConversationTurn.toolResult(request, output));
                                return executeLoop(transcript, scratchPad, round + 1);
                            });
                });
    }

    private Mono<String> invokeTool(ToolCallRequest request, ScratchPad scratchPad, int round) {
        Optional<AgentTool> tool = spec.tools().getTool(request.name());
        if (tool.isEmpty()) {
            log.warn("Engine requested unknown tool '{}', bound tools: {}", request.name(), spec.tools().getToolNames());
            return Mono.error(new UnknownToolException(request.name(), round + 1));
        }

        Optional<ScratchPad.ToolExchange> previous = scratchPad.findCompletedInvocation(request);
        if (previous.isPresent()) {
            log.info("Tool {} already answered {}, replaying recorded result", request.name(), request.arguments());
            return Mono.just(scratchPad.record(request, previous.get().result()).output());
        }

        log.info("Invoking tool {} with {}", request.name(), request.arguments());
        return spec.tools().execute(tool.get(), request.arguments())
                .map(result -> {
                    if (!result.isSuccess()) {
                        log.warn("Tool {} did not complete: {}", request.name(), result.getErrorMessage());
                    }
                    return scratchPad.record(request, result).output();
                });
    }

    private Mono<ExecutionResult> toErrorResult(Throwable error) {
        if (error instanceof AgentExecutionException executionError) {
            return Mono.just(ExecutionResult.error(
                    executionError.getErrorType(), executionError.getMessage(), executionError.getRounds()));
        }
        log.error("Execution failed", error);
        return Mono.just(ExecutionResult.error(ErrorType.LOOP_FAULT, LOOP_FAULT_PREFIX + error.getMessage()));
    }
}
