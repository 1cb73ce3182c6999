package com.stormline.herald.api.v1;

import com.stormline.herald.agent.Agent;
import com.stormline.herald.agent.AgentSpec;
import com.stormline.herald.agent.RecordingTool;
import com.stormline.herald.api.ApiExceptionHandler;
import com.stormline.herald.domain.model.ConversationTurn;
import com.stormline.herald.domain.model.ExecutionResult;
import com.stormline.herald.domain.model.ExecutionResult.ErrorType;
import com.stormline.herald.tool.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Web layer tests for {@link AgentController}.
 */
@ExtendWith(MockitoExtension.class)
class AgentControllerTest {

    @Mock
    private Agent agent;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        when(agent.getName()).thenReturn("weather");
        webTestClient = WebTestClient.bindToController(new AgentController(List.of(agent)))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Nested
    @DisplayName("Execute")
    class ExecuteTests {

        @Test
        @DisplayName("should return the answer")
        void returnsAnswer() {
            when(agent.execute(eq("Alerts for California?"), anyList()))
                    .thenReturn(Mono.just(ExecutionResult.answer("Heat advisory in CA.", 2)));

            webTestClient.post()
                    .uri("/api/v1/agents/weather/execute")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"query\": \"Alerts for California?\", \"history\": []}")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.answer").isEqualTo("Heat advisory in CA.")
                    .jsonPath("$.error").doesNotExist();
        }

        @Test
        @DisplayName("should return execution errors with 200")
        void returnsErrorInBody() {
            when(agent.execute(any(), anyList()))
                    .thenReturn(Mono.just(ExecutionResult.error(ErrorType.EMPTY_QUERY, "Empty query provided")));

            webTestClient.post()
                    .uri("/api/v1/agents/weather/execute")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"query\": \"  \"}")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Empty query provided")
                    .jsonPath("$.errorType").isEqualTo("EMPTY_QUERY")
                    .jsonPath("$.answer").doesNotExist();
        }

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("should pass parsed history and replace a malformed one with empty")
        void parsesHistory() {
            when(agent.execute(any(), anyList()))
                    .thenReturn(Mono.just(ExecutionResult.answer("ok", 1)));

            webTestClient.post()
                    .uri("/api/v1/agents/weather/execute")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"query\": \"q1\", \"history\": [{\"role\": \"user\", \"content\": \"hi\"}]}")
                    .exchange()
                    .expectStatus().isOk();
            webTestClient.post()
                    .uri("/api/v1/agents/weather/execute")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"query\": \"q2\", \"history\": \"not a list\"}")
                    .exchange()
                    .expectStatus().isOk();

            ArgumentCaptor<List<ConversationTurn>> history = ArgumentCaptor.forClass(List.class);
            verify(agent, times(2)).execute(any(), history.capture());
            assertThat(history.getAllValues().get(0)).containsExactly(ConversationTurn.user("hi"));
            assertThat(history.getAllValues().get(1)).isEmpty();
        }

        @Test
        @DisplayName("should reject a malformed body with 400")
        void rejectsMalformedBody() {
            webTestClient.post()
                    .uri("/api/v1/agents/weather/execute")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"query\": ")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").exists();

            verify(agent, never()).execute(any(), anyList());
        }

        @Test
        @DisplayName("should return 404 for an unknown agent")
        void unknownAgent() {
            webTestClient.post()
                    .uri("/api/v1/agents/traffic/execute")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"query\": \"q\"}")
                    .exchange()
                    .expectStatus().isNotFound();
        }
    }

    @Test
    @DisplayName("should describe the agent and its tools")
    void describesAgent() {
        when(agent.getSpec()).thenReturn(new AgentSpec("prompt",
                new ToolRegistry(List.of(RecordingTool.returning("get_weather_alert_by_code", "x")))));

        webTestClient.get()
                .uri("/api/v1/agents/weather")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.name").isEqualTo("weather")
                .jsonPath("$.tools[0].name").isEqualTo("get_weather_alert_by_code")
                .jsonPath("$.tools[0].description").isEqualTo("Test tool get_weather_alert_by_code");
    }
}
