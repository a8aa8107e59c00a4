package com.querypilot.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.querypilot.model.ErrorClass;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

class JdbcStatementExecutorTest {

    private HikariDataSource dataSource;

    @BeforeEach
    void createDatabase() throws SQLException {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        config.setMaximumPoolSize(2);
        dataSource = new HikariDataSource(config);
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE patients (id INT PRIMARY KEY, name VARCHAR(50), admitted_at DATE)");
            for (int i = 1; i <= 25; i++) {
                stmt.execute("INSERT INTO patients VALUES (" + i + ", 'patient " + i + "', DATE '2026-03-01')");
            }
        }
    }

    @AfterEach
    void closeDatabase() {
        dataSource.close();
    }

    @Test
    void readsInBatches() throws StatementExecutionException {
        JdbcStatementExecutor executor = new JdbcStatementExecutor(dataSource, 10, 100, Duration.ofSeconds(5));

        try (ResultCursor cursor = executor.open("SELECT id, name, admitted_at FROM patients ORDER BY id",
                Duration.ofSeconds(5))) {
            List<Map<String, Object>> first = cursor.next(10);

            assertThat(cursor.columns()).containsExactly("ID", "NAME", "ADMITTED_AT");
            assertThat(first).hasSize(10);
            assertThat(first.get(0)).containsEntry("ID", 1).containsEntry("ADMITTED_AT", "2026-03-01");
            assertThat(cursor.exhausted()).isFalse();

            assertThat(cursor.next(100)).hasSize(15);
            assertThat(cursor.exhausted()).isTrue();
            assertThat(cursor.next(10)).isEmpty();
        }
    }

    @Test
    void rowCeilingIsHardCapPlusOne() throws StatementExecutionException {
        JdbcStatementExecutor executor = new JdbcStatementExecutor(dataSource, 10, 5, Duration.ofSeconds(5));

        try (ResultCursor cursor = executor.open("SELECT id FROM patients", Duration.ofSeconds(5))) {
            assertThat(cursor.next(100)).hasSize(6);
        }
    }

    @Test
    void unknownTableIsAStatementError() {
        JdbcStatementExecutor executor = new JdbcStatementExecutor(dataSource, 10, 100, Duration.ofSeconds(5));

        assertThatThrownBy(() -> executor.open("SELECT * FROM wards", Duration.ofSeconds(5)))
                .isInstanceOfSatisfying(StatementExecutionException.class,
                        e -> assertThat(e.getErrorClass()).isEqualTo(ErrorClass.STATEMENT));
    }

    @Test
    void estimatesRowCountWithBoundedCount() {
        JdbcStatementExecutor executor = new JdbcStatementExecutor(dataSource, 10, 100, Duration.ofSeconds(5));

        assertThat(executor.estimateRowCount("SELECT id FROM patients WHERE id > 5", Duration.ofSeconds(5)))
                .hasValue(20);
        assertThat(executor.estimateRowCount("SELECT * FROM wards", Duration.ofSeconds(5))).isEmpty();
    }

    @Test
    void connectionsReturnToThePool() throws StatementExecutionException {
        JdbcStatementExecutor executor = new JdbcStatementExecutor(dataSource, 10, 100, Duration.ofSeconds(5));

        for (int i = 0; i < 5; i++) {
            try (ResultCursor cursor = executor.open("SELECT id FROM patients", Duration.ofSeconds(5))) {
                cursor.next(1);
            }
        }

        assertThat(dataSource.getHikariPoolMXBean().getActiveConnections()).isZero();
    }
}
