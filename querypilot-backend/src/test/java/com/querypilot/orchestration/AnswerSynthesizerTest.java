package com.querypilot.orchestration;

import com.querypilot.model.ExecutionResult;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AnswerSynthesizerTest {

    private final AnswerSynthesizer synthesizer = new AnswerSynthesizer();

    @Test
    void emptyResultSaysNothingWasFound() {
        ExecutionResult result = ExecutionResult.complete(List.of("id"), List.of(), 3);

        assertThat(synthesizer.synthesize(result)).isEqualTo("No matching records were found.");
    }

    @Test
    void singleValueIsStatedWithItsColumn() {
        ExecutionResult result = ExecutionResult.complete(List.of("admitted"), List.of(Map.of("admitted", 2L)), 3);

        assertThat(synthesizer.synthesize(result)).isEqualTo("The answer is 2 (admitted).");
    }

    @Test
    void singleRowListsItsValues() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", 7);
        row.put("name", "Ada");
        row.put("ward", null);
        ExecutionResult result = ExecutionResult.complete(List.of("id", "name", "ward"), List.of(row), 3);

        assertThat(synthesizer.synthesize(result)).isEqualTo("Found 1 record: id=7, name=Ada, ward=null.");
    }

    @Test
    void wideRowsArePreviewed() {
        Map<String, Object> row = new LinkedHashMap<>();
        List<String> columns = List.of("a", "b", "c", "d", "e");
        columns.forEach(c -> row.put(c, c.toUpperCase()));
        ExecutionResult result = ExecutionResult.complete(columns, List.of(row), 3);

        assertThat(synthesizer.synthesize(result)).isEqualTo("Found 1 record: a=A, b=B, c=C, d=D, ....");
    }

    @Test
    void truncatedResultMentionsEstimateAndWarning() {
        List<Map<String, Object>> rows = List.of(Map.of("id", 1), Map.of("id", 2));
        ExecutionResult result = ExecutionResult.truncated(List.of("id"), rows, 3, 80L,
                "Showing the first 2 rows of about 80");

        assertThat(synthesizer.synthesize(result))
                .isEqualTo("Found 2 records out of about 80. First record: id=1. Showing the first 2 rows of about 80.");
    }

    @Test
    void completeMultiRowResultOmitsEstimate() {
        List<Map<String, Object>> rows = List.of(Map.of("id", 1), Map.of("id", 2), Map.of("id", 3));
        ExecutionResult result = ExecutionResult.complete(List.of("id"), rows, 3);

        assertThat(synthesizer.synthesize(result)).isEqualTo("Found 3 records. First record: id=1.");
    }
}
