package com.stormline.herald.health;

import com.stormline.herald.agent.Agent;
import com.stormline.herald.config.HeraldProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Health indicator for HERALD service.
 * Reports the configured upstreams and whether the reasoning engine can be reached at all.
 */
@Component
public class HeraldHealthIndicator implements ReactiveHealthIndicator {

    private final HeraldProperties heraldProperties;
    private final List<Agent> agents;

    public HeraldHealthIndicator(HeraldProperties heraldProperties, List<Agent> agents) {
        this.heraldProperties = heraldProperties;
        this.agents = agents;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromSupplier(() -> {
            HeraldProperties.LLMProperties.AzureOpenAIProperties azure = heraldProperties.getLlm().getAzure();
            boolean llmConfigured = hasText(azure.getEndpoint()) && hasText(azure.getDeployment());

            Health.Builder builder = llmConfigured ? Health.up() : Health.unknown();
            builder.withDetail("llm.configured", llmConfigured);
            if (hasText(azure.getDeployment())) {
                builder.withDetail("llm.deployment", azure.getDeployment());
            }
            builder.withDetail("weather.baseUrl", heraldProperties.getWeather().getBaseUrl());
            builder.withDetail("agent.maxRounds", heraldProperties.getAgent().getMaxRounds());
            builder.withDetail("agents", agents.stream().map(Agent::getName).toList());
            return builder.build();
        });
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
