package com.stormline.herald.client;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Client for the weather.gov active alerts API.
 */
public interface WeatherAlertClient {

    /**
     * Fetch active alerts for an area.
     * Requests {@code GET <base>/alerts/active/area/<area>} with a {@code User-Agent}
     * and {@code Accept: application/geo+json}.
     *
     * @param area region code, forwarded as-is (normally a 2-letter US state code)
     * @return the GeoJSON feature collection; errors on non-2xx status, timeout or an unreadable body
     */
    Mono<JsonNode> getActiveAlerts(String area);
}
