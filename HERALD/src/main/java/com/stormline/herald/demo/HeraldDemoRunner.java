package com.stormline.herald.demo;

import com.stormline.herald.agent.Agent;
import com.stormline.herald.config.HeraldProperties;
import com.stormline.herald.domain.model.ExecutionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Runs the configured demo query against the weather agent at startup and logs the outcome.
 */
@Component
@ConditionalOnProperty(prefix = "herald.demo", name = "enabled", havingValue = "true")
@Slf4j
public class HeraldDemoRunner implements CommandLineRunner {

    private static final Duration DEMO_TIMEOUT = Duration.ofMinutes(2);

    private final Agent weatherAgent;
    private final HeraldProperties heraldProperties;

    public HeraldDemoRunner(Agent weatherAgent, HeraldProperties heraldProperties) {
        this.weatherAgent = weatherAgent;
        this.heraldProperties = heraldProperties;
    }

    @Override
    public void run(String... args) {
        String query = heraldProperties.getDemo().getQuery();
        log.info("Running demo query: {}", query);

        ExecutionResult result = weatherAgent.execute(query, List.of()).block(DEMO_TIMEOUT);
        if (result == null) {
            log.warn("Demo query produced no result");
        } else if (result.isSuccess()) {
            log.info("Demo answer: {}", result.getAnswer());
        } else {
            log.warn("Demo failed ({}): {}", result.getErrorType(), result.getError());
        }
    }
}
