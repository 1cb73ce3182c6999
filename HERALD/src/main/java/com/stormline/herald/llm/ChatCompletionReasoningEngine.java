package com.stormline.herald.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stormline.herald.config.HeraldProperties;
import com.stormline.herald.domain.model.ConversationTurn;
import com.stormline.herald.domain.model.ToolCallRequest;
import com.stormline.herald.tool.AgentTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Reasoning engine backed by a chat-completion {@link LLMProvider} with function calling.
 */
@Component
@Slf4j
public class ChatCompletionReasoningEngine implements ReasoningEngine {

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final LLMProvider provider;
    private final ObjectMapper objectMapper;
    private final HeraldProperties.LLMProperties.AzureOpenAIProperties config;

    public ChatCompletionReasoningEngine(
            LLMProvider provider,
            ObjectMapper objectMapper,
            HeraldProperties heraldProperties) {
        this.provider = provider;
        this.objectMapper = objectMapper;
        this.config = heraldProperties.getLlm().getAzure();
    }

    @Override
    public Mono<EngineDecision> decide(String systemPrompt, List<ConversationTurn> transcript, List<AgentTool> tools) {
        return Mono.defer(() -> {
                    if (!tools.isEmpty() && !provider.supportsTools()) {
                        return Mono.error(new IllegalStateException(
                                "LLM provider " + provider.getProviderId() + " does not support tool calling"));
                    }
                    return provider.complete(buildRequest(systemPrompt, transcript, tools));
                })
                .map(this::toDecision);
    }

    LLMRequest buildRequest(String systemPrompt, List<ConversationTurn> transcript, List<AgentTool> tools) {
        List<LLMRequest.Message> messages = new ArrayList<>();
        messages.add(LLMRequest.systemMessage(systemPrompt));
        for (ConversationTurn turn : transcript) {
            messages.add(toMessage(turn));
        }

        List<LLMRequest.Tool> llmTools = tools.stream()
                .map(this::toLLMTool)
                .toList();

        return LLMRequest.builder()
                .model(provider.getDefaultModel())
                .messages(messages)
                .tools(llmTools.isEmpty() ? null : llmTools)
                .toolChoice(llmTools.isEmpty() ? null : "auto")
                .parallelToolCalls(false)
                .temperature(config.getTemperature())
                .maxTokens(config.getMaxTokens())
                .build();
    }

    private LLMRequest.Message toMessage(ConversationTurn turn) {
        switch (turn.role()) {
            case USER:
                return LLMRequest.userMessage(turn.content());
            case ASSISTANT:
                if (turn.isToolRequest()) {
                    return LLMRequest.assistantMessage(List.of(toLLMToolCall(turn.toolCall())));
                }
                return LLMRequest.assistantMessage(turn.content());
            case TOOL:
            default:
                // Tool turns replayed from caller history have no call to attach to.
                if (turn.toolCallId() == null) {
                    return LLMRequest.assistantMessage(turn.content());
                }
                return LLMRequest.toolMessage(turn.toolCallId(), turn.toolName(), turn.content());
        }
    }

    private LLMRequest.ToolCall toLLMToolCall(ToolCallRequest call) {
        return LLMRequest.ToolCall.builder()
                .id(call.id())
                .type("function")
                .function(LLMRequest.FunctionCall.builder()
                        .name(call.name())
                        .arguments(writeArguments(call.arguments()))
                        .build())
                .build();
    }

    private LLMRequest.Tool toLLMTool(AgentTool tool) {
        return LLMRequest.Tool.builder()
                .type("function")
                .function(LLMRequest.Function.builder()
                        .name(tool.getName())
                        .description(tool.getDescription())
                        .parameters(tool.getParameterSchema())
                        .build())
                .build();
    }

    EngineDecision toDecision(LLMResponse response) {
        if (response.getFinishReason() == LLMResponse.FinishReason.LENGTH
                || response.getFinishReason() == LLMResponse.FinishReason.CONTENT_FILTER) {
            log.warn("Completion from {} ended with {}", response.getProviderId(), response.getFinishReason());
        }
        if (!response.hasToolCalls()) {
            return EngineDecision.finalAnswer(response.getContent() != null ? response.getContent() : "");
        }

        List<LLMRequest.ToolCall> toolCalls = response.getToolCalls();
        if (toolCalls.size() > 1) {
            log.warn("Engine requested {} tool calls in one round; only the first is executed", toolCalls.size());
        }
        LLMRequest.ToolCall first = toolCalls.get(0);
        String id = first.getId() != null ? first.getId() : "call_" + UUID.randomUUID().toString().substring(0, 8);
        return EngineDecision.toolCall(new ToolCallRequest(
                id,
                first.getFunction().getName(),
                parseToolArguments(first.getFunction().getArguments())
        ));
    }

    private Map<String, Object> parseToolArguments(String argsJson) {
        if (argsJson == null || argsJson.isBlank()) {
            return new HashMap<>();
        }
        try {
            return objectMapper.readValue(argsJson, ARGUMENTS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse tool arguments: {}", e.getMessage());
            return new HashMap<>();
        }
    }

    private String writeArguments(Map<String, Object> arguments) {
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Tool arguments are not serializable", e);
        }
    }
}
