package com.querypilot.validation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.querypilot.model.Severity;
import com.querypilot.model.ValidationIssue;
import com.querypilot.schema.TestSchemas;
import com.querypilot.sql.StatementAnalyzer;

class ComplexityCheckTest {

    private final StatementAnalyzer analyzer = new StatementAnalyzer();

    private LayerResult check(ComplexityCheck layer, String sql) {
        return layer.check(new ValidationInput(sql, analyzer.analyze(sql), TestSchemas.hospital(), null));
    }

    @Test
    void exceedingCeilingsOnlyWarns() {
        LayerResult result = check(new ComplexityCheck(1, 3, 0),
                "SELECT p.name FROM patients p JOIN encounters e ON e.patient_id = p.id "
                        + "JOIN doctors d ON d.id = e.doctor_id "
                        + "UNION SELECT name FROM doctors");

        assertThat(result.issues())
                .extracting(ValidationIssue::severity)
                .containsOnly(Severity.WARNING)
                .hasSize(2);
        assertThat(result.issues().get(0).message()).contains("joins 2 times");
    }

    @Test
    void withinCeilingsIsClean() {
        LayerResult result = check(new ComplexityCheck(4, 3, 3), "SELECT COUNT(*) FROM patients");

        assertThat(result.issues()).isEmpty();
    }
}
