package com.querypilot.execution;

import com.querypilot.model.ErrorClass;

/**
 * Datastore failure already classified for the retry and circuit policy.
 */
public class StatementExecutionException extends Exception {

    private final ErrorClass errorClass;

    public StatementExecutionException(ErrorClass errorClass, String message, Throwable cause) {
        super(message, cause);
        this.errorClass = errorClass;
    }

    public ErrorClass getErrorClass() {
        return errorClass;
    }
}
