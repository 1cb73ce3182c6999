package com.stormline.herald.llm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.stormline.herald.config.HeraldProperties;
import com.stormline.herald.llm.LLMProvider;
import com.stormline.herald.llm.LLMRequest;
import com.stormline.herald.llm.LLMResponse;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Azure OpenAI chat-completions provider with function calling.
 * Requests are addressed to a deployment rather than a model name.
 */
@Component
@Slf4j
public class AzureOpenAIProvider implements LLMProvider {

    private static final String PROVIDER_ID = "azure-openai";
    static final String API_KEY_HEADER = "api-key";
    static final String CHAT_COMPLETIONS_PATH =
            "/openai/deployments/{deployment}/chat/completions?api-version={apiVersion}";

    private final WebClient webClient;
    private final HeraldProperties.LLMProperties.AzureOpenAIProperties config;
    private final Timer llmCallTimer;
    private final Counter llmCallCounter;
    private final Counter llmErrorCounter;

    public AzureOpenAIProvider(
            HeraldProperties heraldProperties,
            WebClient.Builder webClientBuilder,
            MeterRegistry meterRegistry) {
        this.config = heraldProperties.getLlm().getAzure();

        WebClient.Builder builder = webClientBuilder.clone()
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (config.getEndpoint() != null) {
            builder.baseUrl(config.getEndpoint());
        }
        if (config.getApiKey() != null) {
            builder.defaultHeader(API_KEY_HEADER, config.getApiKey());
        }
        this.webClient = builder.build();

        this.llmCallTimer = Timer.builder("herald.llm.call.latency")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
        this.llmCallCounter = Counter.builder("herald.llm.calls")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
        this.llmErrorCounter = Counter.builder("herald.llm.errors")
                .tag("provider", PROVIDER_ID)
                .register(meterRegistry);
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public boolean supportsTools() {
        return true;
    }

    @Override
    public String getDefaultModel() {
        return config.getDeployment();
    }

    @Override
    @CircuitBreaker(name = "azure-openai")
    @Retry(name = "llm")
    public Mono<LLMResponse> complete(LLMRequest request) {
        if (config.getEndpoint() == null || config.getEndpoint().isBlank()
                || config.getDeployment() == null || config.getDeployment().isBlank()) {
            return Mono.error(new IllegalStateException("Azure OpenAI endpoint or deployment is not configured"));
        }

        llmCallCounter.increment();
        long startTime = System.currentTimeMillis();

        Map<String, Object> body = buildRequestBody(request);

        return webClient.post()
                .uri(CHAT_COMPLETIONS_PATH, config.getDeployment(), config.getApiVersion())
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(config.getTimeout())
                .map(json -> parseResponse(json, startTime))
                .doOnSuccess(response -> {
                    long duration = System.currentTimeMillis() - startTime;
                    llmCallTimer.record(Duration.ofMillis(duration));
                    log.debug("Azure OpenAI completion: {}ms, {} tokens", duration,
                            response.getTotalTokens());
                })
                .doOnError(e -> {
                    llmErrorCounter.increment();
                    log.error("Azure OpenAI completion error: {}", e.getMessage());
                });
    }

    Map<String, Object> buildRequestBody(LLMRequest request) {
        Map<String, Object> body = new HashMap<>();

        List<Map<String, Object>> messages = request.getMessages().stream()
                .map(this::convertMessage)
                .collect(Collectors.toList());
        body.put("messages", messages);

        if (request.getTemperature() != null) {
            body.put("temperature", request.getTemperature());
        }
        body.put("max_tokens", request.getMaxTokens() != null ? request.getMaxTokens() : config.getMaxTokens());

        if (request.getTools() != null && !request.getTools().isEmpty()) {
            List<Map<String, Object>> tools = request.getTools().stream()
                    .map(this::convertTool)
                    .collect(Collectors.toList());
            body.put("tools", tools);
            body.put("parallel_tool_calls", request.isParallelToolCalls());
            if (request.getToolChoice() != null) {
                body.put("tool_choice", request.getToolChoice());
            }
        }

        return body;
    }

    private Map<String, Object> convertMessage(LLMRequest.Message message) {
        Map<String, Object> msg = new HashMap<>();
        msg.put("role", message.getRole());

        // assistant messages carrying tool calls must still send a content key
        msg.put("content", message.getContent());

        if (message.getName() != null) {
            msg.put("name", message.getName());
        }

        if (message.getToolCallId() != null) {
            msg.put("tool_call_id", message.getToolCallId());
        }

        if (message.getToolCalls() != null && !message.getToolCalls().isEmpty()) {
            List<Map<String, Object>> toolCalls = message.getToolCalls().stream()
                    .map(tc -> {
                        Map<String, Object> call = new HashMap<>();
                        call.put("id", tc.getId());
                        call.put("type", "function");
                        call.put("function", Map.of(
                                "name", tc.getFunction().getName(),
                                "arguments", tc.getFunction().getArguments()
                        ));
                        return call;
                    })
                    .collect(Collectors.toList());
            msg.put("tool_calls", toolCalls);
        }

        return msg;
    }

    private Map<String, Object> convertTool(LLMRequest.Tool tool) {
        Map<String, Object> function = new HashMap<>();
        function.put("name", tool.getFunction().getName());
        function.put("description", tool.getFunction().getDescription());
        function.put("parameters", tool.getFunction().getParameters());
        return Map.of("type", "function", "function", function);
    }

    LLMResponse parseResponse(JsonNode json, long startTime) {
        JsonNode choices = json.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new IllegalStateException("Azure OpenAI response contained no choices");
        }
        JsonNode choice = choices.get(0);
        JsonNode message = choice.path("message");

        String content = message.hasNonNull("content")
                ? message.get("content").asText()
                : null;

        List<LLMRequest.ToolCall> toolCalls = null;
        if (message.hasNonNull("tool_calls")) {
            toolCalls = new ArrayList<>();
            for (JsonNode tc : message.get("tool_calls")) {
                toolCalls.add(LLMRequest.ToolCall.builder()
                        .id(tc.hasNonNull("id") ? tc.get("id").asText() : null)
                        .type("function")
                        .function(LLMRequest.FunctionCall.builder()
                                .name(tc.path("function").path("name").asText())
                                .arguments(tc.path("function").path("arguments").asText(null))
                                .build())
                        .build());
            }
        }

        LLMResponse.FinishReason finishReason = parseFinishReason(choice.path("finish_reason").asText(""));

        LLMResponse.Usage usage = null;
        if (json.hasNonNull("usage")) {
            JsonNode usageNode = json.get("usage");
            usage = LLMResponse.Usage.builder()
                    .promptTokens(usageNode.path("prompt_tokens").asInt())
                    .completionTokens(usageNode.path("completion_tokens").asInt())
                    .totalTokens(usageNode.path("total_tokens").asInt())
                    .build();
        }

        return LLMResponse.builder()
                .id(json.path("id").asText(null))
                .model(json.path("model").asText(null))
                .providerId(PROVIDER_ID)
                .content(content)
                .toolCalls(toolCalls)
                .finishReason(finishReason)
                .usage(usage)
                .latencyMs(System.currentTimeMillis() - startTime)
                .build();
    }

    private LLMResponse.FinishReason parseFinishReason(String reason) {
        return switch (reason) {
            case "length" -> LLMResponse.FinishReason.LENGTH;
            case "tool_calls" -> LLMResponse.FinishReason.TOOL_CALLS;
            case "content_filter" -> LLMResponse.FinishReason.CONTENT_FILTER;
            default -> LLMResponse.FinishReason.STOP;
        };
    }
}
