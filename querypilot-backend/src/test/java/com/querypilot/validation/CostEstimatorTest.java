package com.querypilot.validation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.querypilot.model.RiskLevel;
import com.querypilot.schema.SchemaSnapshot;
import com.querypilot.schema.TestSchemas;
import com.querypilot.sql.StatementAnalyzer;

class CostEstimatorTest {

    private final CostEstimator estimator = new CostEstimator(1_000_000);
    private final StatementAnalyzer analyzer = new StatementAnalyzer();
    private final SchemaSnapshot schema = TestSchemas.hospital();

    private CostEstimate estimate(String sql) {
        return estimator.estimate(analyzer.analyze(sql), schema);
    }

    @ParameterizedTest
    @CsvSource({"0, LOW", "2, LOW", "3, MEDIUM", "4, MEDIUM", "5, HIGH", "6, HIGH", "7, VERY_HIGH", "12, VERY_HIGH"})
    void scoreBoundaries(int score, RiskLevel expected) {
        assertThat(CostEstimator.classify(score)).isEqualTo(expected);
    }

    @Test
    void fullScanOfLargeTableIsVeryHigh() {
        CostEstimate estimate = estimate("SELECT * FROM lab_results");

        assertThat(estimate.score()).isEqualTo(7);
        assertThat(estimate.risk()).isEqualTo(RiskLevel.VERY_HIGH);
        assertThat(estimate.reasons()).contains("no filter", "no row limit");
    }

    @Test
    void filteredAndBoundedReadOfLargeTableIsMedium() {
        CostEstimate estimate = estimate("SELECT * FROM lab_results WHERE patient_id = 7 LIMIT 100");

        assertThat(estimate.score()).isEqualTo(4);
        assertThat(estimate.risk()).isEqualTo(RiskLevel.MEDIUM);
    }

    @Test
    void singleRowAggregateNeedsNoLimit() {
        CostEstimate estimate = estimate("SELECT COUNT(*) FROM patients WHERE ward = 'A'");

        assertThat(estimate.score()).isZero();
        assertThat(estimate.risk()).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void joinsAndSubqueriesAddToScore() {
        CostEstimate estimate = estimate("SELECT d.name, COUNT(*) FROM doctors d JOIN encounters e ON e.doctor_id = d.id "
                + "WHERE e.patient_id IN (SELECT id FROM patients WHERE ward = 'A') GROUP BY d.name LIMIT 10");

        // encounters is medium sized, one join, one subquery
        assertThat(estimate.score()).isEqualTo(3);
        assertThat(estimate.risk()).isEqualTo(RiskLevel.MEDIUM);
    }
}
