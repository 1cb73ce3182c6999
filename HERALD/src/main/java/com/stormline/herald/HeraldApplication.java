package com.stormline.herald;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * HERALD - tool-calling agent service for the STORMLINE ecosystem.
 *
 * <p>HERALD provides:
 * <ul>
 *   <li>Agent Contract - prompt and tool bindings validated at construction</li>
 *   <li>Execution Loop - engine decision, single tool invocation, repeat until a final answer</li>
 *   <li>LLM Abstraction - reasoning engine over an Azure OpenAI chat-completion provider</li>
 *   <li>Weather Agent - active weather alerts for a US state via the weather.gov alerts API</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties
public class HeraldApplication {

    public static void main(String[] args) {
        SpringApplication.run(HeraldApplication.class, args);
    }
}
