package com.stormline.herald.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Configuration properties for HERALD service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "herald")
public class HeraldProperties {

    private LLMProperties llm = new LLMProperties();
    private WeatherProperties weather = new WeatherProperties();
    private AgentProperties agent = new AgentProperties();
    private DemoProperties demo = new DemoProperties();

    @Data
    public static class LLMProperties {
        private AzureOpenAIProperties azure = new AzureOpenAIProperties();

        @Data
        public static class AzureOpenAIProperties {
            private String endpoint;
            private String apiKey;
            private String deployment;
            private String apiVersion = "2024-06-01";
            private double temperature = 0.0;
            private int maxTokens = 1024;
            private Duration timeout = Duration.ofSeconds(60);
        }
    }

    @Data
    public static class WeatherProperties {
        private String baseUrl = "https://api.weather.gov";
        private String userAgent = "weather-app/1.0";
        private Duration timeout = Duration.ofSeconds(10);
        /**
         * Largest alerts payload decoded in memory.
         */
        private DataSize maxResponseSize = DataSize.ofMegabytes(16);
    }

    @Data
    public static class AgentProperties {
        private int maxRounds = 10;
    }

    @Data
    public static class DemoProperties {
        private boolean enabled = false;
        private String query = "What is the weather alert for California?";
    }
}
