package com.stormline.herald.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stormline.herald.agent.RecordingTool;
import com.stormline.herald.config.HeraldProperties;
import com.stormline.herald.domain.model.ConversationTurn;
import com.stormline.herald.domain.model.ToolCallRequest;
import com.stormline.herald.tool.AgentTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ChatCompletionReasoningEngine}.
 */
@ExtendWith(MockitoExtension.class)
class ChatCompletionReasoningEngineTest {

    @Mock
    private LLMProvider provider;

    private ChatCompletionReasoningEngine engine;
    private final List<AgentTool> tools = List.of(RecordingTool.returning("get_weather_alert_by_code", "x"));

    @BeforeEach
    void setUp() {
        HeraldProperties properties = new HeraldProperties();
        properties.getLlm().getAzure().setMaxTokens(512);
        engine = new ChatCompletionReasoningEngine(provider, new ObjectMapper(), properties);
        lenient().when(provider.supportsTools()).thenReturn(true);
    }

    private static LLMRequest.ToolCall toolCall(String id, String name, String arguments) {
        return LLMRequest.ToolCall.builder()
                .id(id)
                .type("function")
                .function(LLMRequest.FunctionCall.builder().name(name).arguments(arguments).build())
                .build();
    }

    @Nested
    @DisplayName("Request mapping")
    class RequestTests {

        @Test
        @DisplayName("should send the system prompt, transcript and tool definitions")
        void mapsTranscript() {
            when(provider.getDefaultModel()).thenReturn("gpt-4o-weather");
            when(provider.complete(any())).thenReturn(Mono.just(LLMResponse.text("ok", "gpt-4o", "azure-openai")));
            ToolCallRequest call = new ToolCallRequest("call_1", "get_weather_alert_by_code", Map.of("code", "CA"));
            List<ConversationTurn> transcript = List.of(
                    ConversationTurn.user("California alerts?"),
                    ConversationTurn.toolRequest(call),
                    ConversationTurn.toolResult(call, "No alerts found for the given state."));

            StepVerifier.create(engine.decide("SYSTEM", transcript, tools))
                    .expectNextCount(1)
                    .verifyComplete();

            ArgumentCaptor<LLMRequest> captor = ArgumentCaptor.forClass(LLMRequest.class);
            verify(provider).complete(captor.capture());
            LLMRequest request = captor.getValue();

            assertThat(request.getModel()).isEqualTo("gpt-4o-weather");
            assertThat(request.getToolChoice()).isEqualTo("auto");
            assertThat(request.isParallelToolCalls()).isFalse();
            assertThat(request.getTemperature()).isEqualTo(0.0);
            assertThat(request.getMaxTokens()).isEqualTo(512);

            List<LLMRequest.Message> messages = request.getMessages();
            assertThat(messages).extracting(LLMRequest.Message::getRole)
                    .containsExactly("system", "user", "assistant", "tool");
            assertThat(messages.get(0).getContent()).isEqualTo("SYSTEM");
            assertThat(messages.get(2).getToolCalls()).hasSize(1);
            assertThat(messages.get(2).getToolCalls().get(0).getFunction().getArguments())
                    .isEqualTo("{\"code\":\"CA\"}");
            assertThat(messages.get(3).getToolCallId()).isEqualTo("call_1");
            assertThat(messages.get(3).getName()).isEqualTo("get_weather_alert_by_code");

            assertThat(request.getTools()).hasSize(1);
            assertThat(request.getTools().get(0).getFunction().getName()).isEqualTo("get_weather_alert_by_code");
        }

        @Test
        @DisplayName("should send history tool turns without a call id as assistant text")
        void mapsDetachedToolTurn() {
            ConversationTurn detached = new ConversationTurn(
                    ConversationTurn.Role.TOOL, "Event: Fog", null, null, null);

            LLMRequest request = engine.buildRequest("SYSTEM", List.of(detached), List.of());

            assertThat(request.getMessages().get(1).getRole()).isEqualTo("assistant");
            assertThat(request.getTools()).isNull();
            assertThat(request.getToolChoice()).isNull();
        }
    }

    @Nested
    @DisplayName("Response mapping")
    class ResponseTests {

        @Test
        @DisplayName("should map text content to a final answer")
        void textIsFinalAnswer() {
            when(provider.complete(any())).thenReturn(Mono.just(
                    LLMResponse.text("No alerts for Vermont.", "gpt-4o", "azure-openai")));

            StepVerifier.create(engine.decide("SYSTEM", List.of(ConversationTurn.user("VT?")), tools))
                    .expectNext(EngineDecision.finalAnswer("No alerts for Vermont."))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should map a tool call with parsed arguments")
        void toolCallIsParsed() {
            when(provider.complete(any())).thenReturn(Mono.just(LLMResponse.toolCalls(
                    List.of(toolCall("call_9", "get_weather_alert_by_code", "{\"code\":\"TX\"}")),
                    "gpt-4o", "azure-openai")));

            StepVerifier.create(engine.decide("SYSTEM", List.of(ConversationTurn.user("Texas?")), tools))
                    .expectNext(EngineDecision.toolCall(
                            new ToolCallRequest("call_9", "get_weather_alert_by_code", Map.of("code", "TX"))))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should keep only the first of several tool calls")
        void narrowsToFirstCall() {
            EngineDecision decision = engine.toDecision(LLMResponse.toolCalls(List.of(
                    toolCall("a", "get_weather_alert_by_code", "{\"code\":\"NY\"}"),
                    toolCall("b", "get_weather_alert_by_code", "{\"code\":\"NJ\"}")), "gpt-4o", "azure-openai"));

            assertThat(decision).isInstanceOf(EngineDecision.ToolCall.class);
            ToolCallRequest request = ((EngineDecision.ToolCall) decision).request();
            assertThat(request.id()).isEqualTo("a");
            assertThat(request.arguments()).containsEntry("code", "NY");
        }

        @Test
        @DisplayName("should treat malformed arguments as empty and generate a missing call id")
        void malformedArguments() {
            EngineDecision decision = engine.toDecision(LLMResponse.toolCalls(
                    List.of(toolCall(null, "get_weather_alert_by_code", "{code: CA")), "gpt-4o", "azure-openai"));

            ToolCallRequest request = ((EngineDecision.ToolCall) decision).request();
            assertThat(request.arguments()).isEmpty();
            assertThat(request.id()).startsWith("call_");
        }

        @Test
        @DisplayName("should propagate provider errors")
        void propagatesErrors() {
            when(provider.complete(any())).thenReturn(Mono.error(new IllegalStateException("429 Too Many Requests")));

            StepVerifier.create(engine.decide("SYSTEM", List.of(ConversationTurn.user("Texas?")), tools))
                    .expectErrorMessage("429 Too Many Requests")
                    .verify();
        }

        @Test
        @DisplayName("should fail before calling a provider without tool support")
        void rejectsProviderWithoutTools() {
            when(provider.supportsTools()).thenReturn(false);
            when(provider.getProviderId()).thenReturn("local-llm");

            StepVerifier.create(engine.decide("SYSTEM", List.of(ConversationTurn.user("Texas?")), tools))
                    .expectErrorMessage("LLM provider local-llm does not support tool calling")
                    .verify();

            verify(provider, never()).complete(any());
        }
    }
}
