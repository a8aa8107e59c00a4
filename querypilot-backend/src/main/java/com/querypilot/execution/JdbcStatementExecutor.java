package com.querypilot.execution;

import com.querypilot.model.ErrorClass;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Runs validated statements on a pooled, read-only connection.
 *
 * <p>Each cursor owns its connection until closed. Statements run with a JDBC query timeout, a row ceiling of
 * hard cap + 1 and a fetch size of one batch; on PostgreSQL a transaction-local lock timeout is set as well.
 */
@Slf4j
public class JdbcStatementExecutor implements StatementExecutor {

    private final DataSource dataSource;
    private final int fetchSize;
    private final int maxRows;
    private final Duration lockTimeout;

    public JdbcStatementExecutor(DataSource dataSource, int fetchSize, int hardCap, Duration lockTimeout) {
        this.dataSource = dataSource;
        this.fetchSize = fetchSize;
        this.maxRows = hardCap + 1;
        this.lockTimeout = lockTimeout;
    }

    @Override
    public ResultCursor open(String sql, Duration timeout) throws StatementExecutionException {
        Connection conn = null;
        Statement stmt = null;
        try {
            conn = dataSource.getConnection();
            conn.setReadOnly(true);
            conn.setAutoCommit(false);
            applyLockTimeout(conn);

            stmt = conn.createStatement(ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
            stmt.setQueryTimeout(toSeconds(timeout));
            stmt.setMaxRows(maxRows);
            stmt.setFetchSize(fetchSize);
            ResultSet rs = stmt.executeQuery(sql);
            return new JdbcCursor(conn, stmt, rs);
        } catch (SQLException e) {
            closeQuietly(stmt, conn);
            ErrorClass errorClass = TransientErrorClassifier.classify(e);
            log.warn("Statement execution failed (error_class={}, sql_state={}, vendor_code={})",
                    errorClass, e.getSQLState(), e.getErrorCode());
            throw new StatementExecutionException(errorClass, e.getMessage(), e);
        }
    }

    @Override
    public OptionalLong estimateRowCount(String sql, Duration timeout) {
        String countSql = "SELECT COUNT(*) FROM (" + sql + ") q";
        try (Connection conn = dataSource.getConnection()) {
            conn.setReadOnly(true);
            try (Statement stmt = conn.createStatement()) {
                stmt.setQueryTimeout(toSeconds(timeout));
                try (ResultSet rs = stmt.executeQuery(countSql)) {
                    if (rs.next()) {
                        return OptionalLong.of(rs.getLong(1));
                    }
                }
            }
        } catch (SQLException e) {
            log.info("Row-count estimate skipped (sql_state={}, reason={})", e.getSQLState(), e.getMessage());
        }
        return OptionalLong.empty();
    }

    private void applyLockTimeout(Connection conn) throws SQLException {
        String product = conn.getMetaData().getDatabaseProductName();
        if (product != null && product.toLowerCase(Locale.ROOT).contains("postgres")) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("SET LOCAL lock_timeout = '" + lockTimeout.toMillis() + "ms'");
            }
        }
    }

    private static int toSeconds(Duration timeout) {
        long millis = Math.max(timeout.toMillis(), 1);
        return (int) Math.min(Integer.MAX_VALUE, (millis + 999) / 1000);
    }

    private static void closeQuietly(Statement stmt, Connection conn) {
        try {
            if (stmt != null) {
                stmt.close();
            }
        } catch (SQLException e) {
            log.debug("Failed to close statement: {}", e.getMessage());
        }
        if (conn != null) {
            try {
                conn.rollback();
            } catch (SQLException e) {
                log.debug("Failed to end read-only transaction: {}", e.getMessage());
            }
            try {
                conn.close();
            } catch (SQLException e) {
                log.debug("Failed to return connection: {}", e.getMessage());
            }
        }
    }

    private static final class JdbcCursor implements ResultCursor {

        private final Connection conn;
        private final Statement stmt;
        private final ResultSet rs;
        private final List<String> columns;
        private boolean exhausted;

        private JdbcCursor(Connection conn, Statement stmt, ResultSet rs) throws SQLException {
            this.conn = conn;
            this.stmt = stmt;
            this.rs = rs;
            ResultSetMetaData md = rs.getMetaData();
            List<String> names = new ArrayList<>(md.getColumnCount());
            for (int i = 1; i <= md.getColumnCount(); i++) {
                names.add(md.getColumnLabel(i));
            }
            this.columns = List.copyOf(names);
        }

        @Override
        public List<String> columns() {
            return columns;
        }

        @Override
        public List<Map<String, Object>> next(int limit) throws StatementExecutionException {
            List<Map<String, Object>> rows = new ArrayList<>();
            try {
                while (!exhausted && rows.size() < limit) {
                    if (!rs.next()) {
                        exhausted = true;
                        break;
                    }
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 0; i < columns.size(); i++) {
                        row.put(columns.get(i), JdbcValues.read(rs, i + 1));
                    }
                    rows.add(row);
                }
                return rows;
            } catch (SQLException e) {
                throw new StatementExecutionException(TransientErrorClassifier.classify(e), e.getMessage(), e);
            }
        }

        @Override
        public boolean exhausted() {
            return exhausted;
        }

        @Override
        public void close() {
            try {
                rs.close();
            } catch (SQLException e) {
                log.debug("Failed to close result set: {}", e.getMessage());
            }
            closeQuietly(stmt, conn);
        }
    }
}
