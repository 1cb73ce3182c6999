package com.stormline.herald.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.stormline.herald.domain.model.ExecutionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for an agent execution: {@code answer} or {@code error}, never both.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecuteResponse {

    private String answer;

    private String error;

    private ExecutionResult.ErrorType errorType;

    public static ExecuteResponse from(ExecutionResult result) {
        if (result.isSuccess()) {
            return ExecuteResponse.builder().answer(result.getAnswer()).build();
        }
        return ExecuteResponse.builder()
                .error(result.getError())
                .errorType(result.getErrorType())
                .build();
    }
}
