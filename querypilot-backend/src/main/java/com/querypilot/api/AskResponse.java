package com.querypilot.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Answered question: the synthesized answer, the statement that produced it and the rows.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AskResponse {

    /**
     * Always "answered".
     */
    private String status;
    private String queryId;
    private String sessionId;
    private String answer;
    private String sql;
    private List<String> columns;
    private List<Map<String, Object>> rows;
    private long rowCount;

    /**
     * False when rows were cut off; the warnings then say why.
     */
    private boolean complete;
    private Long estimatedTotalRows;
    private List<String> warnings;
    private boolean cacheHit;
    private long latencyMs;
    private Map<String, Long> stageTimingsMs;
    private String traceId;
}
