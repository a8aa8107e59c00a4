package com.querypilot.execution;

import com.querypilot.model.ErrorClass;
import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;

/**
 * Keeps statement-level and timeout failures from evicting pooled connections.
 *
 * <p>Generated statements regularly fail with syntax or unknown-object errors; those say nothing about the
 * connection itself.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }
        ErrorClass errorClass = TransientErrorClassifier.classify(sqlException);
        if (errorClass == ErrorClass.STATEMENT || errorClass == ErrorClass.TIMEOUT) {
            return Override.DO_NOT_EVICT;
        }
        return Override.CONTINUE_EVICT;
    }
}
