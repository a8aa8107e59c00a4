package com.querypilot.execution;

import com.querypilot.model.ErrorClass;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Maps JDBC failures to an {@link ErrorClass} using exception type and SQLSTATE.
 */
public final class TransientErrorClassifier {

    /** Deadlock, serialization failure, lock not available, too many connections, H2 lock timeout. */
    private static final Set<String> TRANSIENT_STATES = Set.of("40001", "40P01", "55P03", "53300", "HYT00");
    /** Query cancelled by statement timeout. */
    private static final Set<String> TIMEOUT_STATES = Set.of("57014", "HY008");

    private TransientErrorClassifier() {
    }

    public static ErrorClass classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql) {
                return classify(sql);
            }
            if (t instanceof InterruptedException) {
                return ErrorClass.TIMEOUT;
            }
        }
        return ErrorClass.FATAL;
    }

    public static ErrorClass classify(SQLException e) {
        String state = e.getSQLState();
        if (e instanceof SQLTimeoutException || (state != null && TIMEOUT_STATES.contains(state))) {
            return ErrorClass.TIMEOUT;
        }
        if (state != null && TRANSIENT_STATES.contains(state)) {
            return ErrorClass.TRANSIENT;
        }
        if (state != null && state.startsWith("08")) {
            // connection exception class
            return ErrorClass.TRANSIENT;
        }
        if (e instanceof SQLTransientException || e instanceof SQLRecoverableException
                || e instanceof SQLNonTransientConnectionException) {
            return ErrorClass.TRANSIENT;
        }
        if (e instanceof SQLSyntaxErrorException) {
            return ErrorClass.STATEMENT;
        }
        if (state != null && (state.startsWith("42") || state.startsWith("22") || state.startsWith("28")
                || state.startsWith("0A") || state.startsWith("25"))) {
            return ErrorClass.STATEMENT;
        }
        return ErrorClass.FATAL;
    }
}
