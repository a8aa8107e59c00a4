package com.querypilot.execution;

import java.util.List;
import java.util.Map;

/**
 * Forward-only view over an open result. Closing it returns the connection to the pool.
 */
public interface ResultCursor extends AutoCloseable {

    List<String> columns();

    /**
     * Read up to {@code maxRows} further rows.
     */
    List<Map<String, Object>> next(int maxRows) throws StatementExecutionException;

    /**
     * True once the underlying result has no more rows.
     */
    boolean exhausted();

    @Override
    void close();
}
