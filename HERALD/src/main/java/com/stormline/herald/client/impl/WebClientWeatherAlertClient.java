package com.stormline.herald.client.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.stormline.herald.client.WeatherAlertClient;
import com.stormline.herald.config.HeraldProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * WebClient-based implementation of WeatherAlertClient.
 */
@Component
@Slf4j
public class WebClientWeatherAlertClient implements WeatherAlertClient {

    static final String GEO_JSON = "application/geo+json";
    private static final String ACTIVE_ALERTS_PATH = "/alerts/active/area/{area}";

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientWeatherAlertClient(HeraldProperties heraldProperties, WebClient.Builder webClientBuilder) {
        HeraldProperties.WeatherProperties config = heraldProperties.getWeather();
        this.timeout = config.getTimeout();
        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, config.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, GEO_JSON)
                .codecs(configurer -> configurer.defaultCodecs()
                        .maxInMemorySize((int) config.getMaxResponseSize().toBytes()))
                .build();
        log.info("Weather alert client targeting {}", config.getBaseUrl());
    }

    @Override
    public Mono<JsonNode> getActiveAlerts(String area) {
        return webClient.get()
                .uri(ACTIVE_ALERTS_PATH, area)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .doOnSuccess(body -> log.debug("Fetched active alerts for area {}", area))
                .doOnError(e -> log.error("Failed to fetch active alerts for area {}: {}", area, e.getMessage()));
    }
}
