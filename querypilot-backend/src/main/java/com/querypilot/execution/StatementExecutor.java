package com.querypilot.execution;

import java.time.Duration;
import java.util.OptionalLong;

/**
 * Datastore executor consumed by {@link ExecutionGuard}.
 */
public interface StatementExecutor {

    /**
     * Run a read-only statement and open a cursor over its rows.
     *
     * @param statement validated statement text
     * @param timeout statement-level timeout
     * @return open cursor, to be closed by the caller
     * @throws StatementExecutionException classified failure
     */
    ResultCursor open(String statement, Duration timeout) throws StatementExecutionException;

    /**
     * Bounded-cost estimate of how many rows the statement returns, empty when the estimate could not be made
     * in time.
     */
    OptionalLong estimateRowCount(String statement, Duration timeout);
}
