package com.stormline.herald.agent.impl;

import com.stormline.herald.agent.BaseAgent;
import com.stormline.herald.llm.ReasoningEngine;
import com.stormline.herald.tool.builtin.WeatherAlertTool;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Collections;

/**
 * Agent answering US weather alert questions with the weather alert tool.
 * The engine extracts the state code from free text; this class only supplies the prompt.
 */
public class WeatherAgent extends BaseAgent {

    public static final String NAME = "weather";

    private static final String SYSTEM_PROMPT_TEMPLATE = """
        You are a weather assistant that provides weather alerts for specific US states
        using the %1$s tool.

        For every user query:
        1. Identify any US state name or 2-letter code in the input.
        2. If a state name is provided (e.g., California), convert it to
           its UPPERCASE 2-letter code (e.g., CA).
        3. Call the appropriate tool.
        4. Return the tool's output or an appropriate error message
           if no state is identified or the tool fails.

        Example:
        User: "What is the weather alert for California?"
        Assistant: Let me check the weather alerts for CA.
            [Calls %1$s with "CA"]

        Available tools: %2$s
        """;

    public WeatherAgent(
            ReasoningEngine engine,
            WeatherAlertTool weatherAlertTool,
            int maxRounds,
            MeterRegistry meterRegistry) {
        super(engine, Collections.singletonList(weatherAlertTool), maxRounds, meterRegistry);
        initialize();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String buildPrompt() {
        return SYSTEM_PROMPT_TEMPLATE.formatted(
                WeatherAlertTool.TOOL_NAME,
                String.join(", ", getToolRegistry().getToolNames()));
    }
}
