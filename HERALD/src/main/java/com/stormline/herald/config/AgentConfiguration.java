package com.stormline.herald.config;

import com.stormline.herald.agent.impl.WeatherAgent;
import com.stormline.herald.llm.ReasoningEngine;
import com.stormline.herald.tool.builtin.WeatherAlertTool;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Agent wiring. Agents are plain objects built once from the engine, their tools and the round cap.
 */
@Configuration
public class AgentConfiguration {

    @Bean
    public WeatherAgent weatherAgent(
            ReasoningEngine reasoningEngine,
            WeatherAlertTool weatherAlertTool,
            HeraldProperties heraldProperties,
            MeterRegistry meterRegistry) {
        return new WeatherAgent(
                reasoningEngine,
                weatherAlertTool,
                heraldProperties.getAgent().getMaxRounds(),
                meterRegistry);
    }
}
