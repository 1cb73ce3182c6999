package com.stormline.herald.tool.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.stormline.herald.client.WeatherAlertClient;
import com.stormline.herald.tool.AgentTool;
import com.stormline.herald.tool.ToolResult;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Built-in tool for active weather alerts of a US state.
 *
 * <p>Outcomes of {@link #getAlertsByCode(String)}:
 * <ul>
 *   <li>formatted alert blocks joined by {@value #ALERT_SEPARATOR}</li>
 *   <li>{@value #NO_ALERTS} when the service answered without features</li>
 *   <li>empty when the service could not be reached or answered with an unreadable body</li>
 * </ul>
 */
@Component
@Slf4j
public class WeatherAlertTool implements AgentTool {

    public static final String TOOL_NAME = "get_weather_alert_by_code";
    public static final String NO_ALERTS = "No alerts found for the given state.";
    public static final String ALERT_SEPARATOR = "\n---\n";

    private static final String CODE_PARAM = "code";

    private static final Map<String, Object> PARAMETER_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    CODE_PARAM, Map.of(
                            "type", "string",
                            "description", "The state code to get the weather alerts for. Eg: \"CA\" for California, \"NY\" for New York."
                    )
            ),
            "required", List.of(CODE_PARAM)
    );

    private final WeatherAlertClient weatherAlertClient;
    private final MeterRegistry meterRegistry;

    public WeatherAlertTool(WeatherAlertClient weatherAlertClient, MeterRegistry meterRegistry) {
        this.weatherAlertClient = weatherAlertClient;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public String getName() {
        return TOOL_NAME;
    }

    @Override
    public String getDescription() {
        return "Get active weather alerts by US state code. " +
               "Pass the 2-letter uppercase code, e.g. \"CA\" for California or \"NY\" for New York.";
    }

    @Override
    public Map<String, Object> getParameterSchema() {
        return PARAMETER_SCHEMA;
    }

    @Override
    public Mono<ValidationResult> validate(Map<String, Object> parameters) {
        Object code = parameters == null ? null : parameters.get(CODE_PARAM);
        if (!(code instanceof String) || ((String) code).isBlank()) {
            return Mono.just(ValidationResult.failure("Parameter 'code' is required and must be a string"));
        }
        return Mono.just(ValidationResult.success());
    }

    @Override
    public Mono<ToolResult> execute(Map<String, Object> parameters) {
        String code = ((String) parameters.get(CODE_PARAM)).trim();

        return getAlertsByCode(code)
                .map(output -> {
                    meterRegistry.counter("herald.tool.calls", "tool", TOOL_NAME, "outcome", "completed").increment();
                    return ToolResult.success(TOOL_NAME, output);
                })
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    meterRegistry.counter("herald.tool.calls", "tool", TOOL_NAME, "outcome", "no_result").increment();
                    return ToolResult.noResult(TOOL_NAME,
                            "Unable to fetch weather alerts for " + code + "; the alert service could not be reached.");
                }));
    }

    /**
     * Fetch and format active alerts for a state code.
     *
     * @param code the region code, not validated here
     * @return formatted alerts or the no-alerts sentinel; empty if the lookup could not complete
     */
    public Mono<String> getAlertsByCode(String code) {
        log.info("Fetching weather alerts for state code: {}", code);

        return weatherAlertClient.getActiveAlerts(code)
                .map(WeatherAlertTool::formatAlerts)
                .onErrorResume(e -> {
                    log.error("Weather alert lookup failed for {}: {}", code, e.getMessage());
                    return Mono.empty();
                });
    }

    static String formatAlerts(JsonNode collection) {
        JsonNode features = collection == null ? null : collection.get("features");
        if (features == null || !features.isArray() || features.isEmpty()) {
            log.info("No alerts found for the given state.");
            return NO_ALERTS;
        }

        List<String> alerts = new ArrayList<>();
        for (JsonNode feature : features) {
            alerts.add(formatAlert(feature));
        }
        return String.join(ALERT_SEPARATOR, alerts);
    }

    static String formatAlert(JsonNode feature) {
        JsonNode props = feature == null ? null : feature.get("properties");
        return String.format(
                "Event: %s\n" +
                "Description: %s\n" +
                "Severity: %s\n" +
                "Area: %s\n" +
                "Instructions: %s",
                text(props, "event", "Unknown"),
                text(props, "description", "No description available"),
                text(props, "severity", "Unknown"),
                text(props, "areaDesc", "Unknown"),
                text(props, "instruction", "No instructions available")
        );
    }

    private static String text(JsonNode props, String field, String fallback) {
        if (props == null) {
            return fallback;
        }
        JsonNode value = props.get(field);
        return value == null || value.isNull() ? fallback : value.asText();
    }
}
