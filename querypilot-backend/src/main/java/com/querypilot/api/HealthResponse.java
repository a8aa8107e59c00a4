package com.querypilot.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Service health: UP when the circuit is closed and the schema could be read, DEGRADED otherwise.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HealthResponse {
    private String status;
    private String circuitState;
    private int consecutiveFailures;
    private Instant lastFailureAt;
    private String schemaVersion;
    private int activeSessions;
    private String traceId;
}
