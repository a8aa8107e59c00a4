package com.querypilot.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Conversation history for display, oldest turn first.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionHistoryResponse {

    private String sessionId;
    private Instant lastActivity;
    private List<Turn> turns;
    private String traceId;

    @Data
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Turn {
        private String queryId;
        private String question;
        private String intent;
        private Instant askedAt;
        private String sql;
        private String answer;
        private long rowCount;
        private boolean cacheHit;
    }
}
