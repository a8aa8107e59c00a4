package com.querypilot.orchestration;

import com.querypilot.model.ExecutionResult;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns an execution result into a short plain-text answer.
 */
public class AnswerSynthesizer {

    private static final int PREVIEW_COLUMNS = 4;

    public String synthesize(ExecutionResult result) {
        List<Map<String, Object>> rows = result.rows();
        if (rows.isEmpty()) {
            return "No matching records were found.";
        }

        StringBuilder answer = new StringBuilder();
        if (rows.size() == 1 && result.columns().size() == 1) {
            String column = result.columns().get(0);
            answer.append("The answer is ").append(format(rows.get(0).get(column)))
                    .append(" (").append(column).append(").");
        } else if (rows.size() == 1) {
            answer.append("Found 1 record: ").append(preview(result.columns(), rows.get(0))).append('.');
        } else {
            answer.append("Found ").append(rows.size()).append(" records");
            if (!result.complete() && result.estimatedTotalRows() != null) {
                answer.append(" out of about ").append(result.estimatedTotalRows());
            }
            answer.append(". First record: ").append(preview(result.columns(), rows.get(0))).append('.');
        }
        for (String warning : result.warnings()) {
            answer.append(' ').append(warning).append('.');
        }
        return answer.toString();
    }

    private static String preview(List<String> columns, Map<String, Object> row) {
        String shown = columns.stream()
                .limit(PREVIEW_COLUMNS)
                .map(c -> c + "=" + format(row.get(c)))
                .collect(Collectors.joining(", "));
        return columns.size() > PREVIEW_COLUMNS ? shown + ", ..." : shown;
    }

    private static String format(Object value) {
        return value == null ? "null" : value.toString();
    }
}
