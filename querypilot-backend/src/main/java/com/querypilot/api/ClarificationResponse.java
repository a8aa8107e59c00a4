package com.querypilot.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Returned instead of an answer when the question is too vague to generate a statement for.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ClarificationResponse {

    /**
     * Always "clarification".
     */
    private String status;
    private String queryId;
    private String sessionId;
    private String intent;
    private double confidence;
    private List<String> questions;
    private String traceId;
}
