package com.querypilot.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request DTO for asking a question.
 *
 * JSON fields (snake_case):
 * - query: question in natural language
 * - session_id: optional conversation id; a new conversation starts when absent
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AskRequest {

    @NotBlank(message = "Query text is required")
    private String query;

    private String sessionId;
}
