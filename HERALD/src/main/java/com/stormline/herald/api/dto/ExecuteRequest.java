package com.stormline.herald.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for executing an agent.
 *
 * <p>A blank query is accepted here and reported by the agent itself.
 * {@code history} is kept as raw JSON so a malformed value degrades to an empty history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteRequest {

    @Size(max = 10000, message = "Query must be less than 10000 characters")
    private String query;

    private JsonNode history;
}
