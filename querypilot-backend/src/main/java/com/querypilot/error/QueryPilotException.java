package com.querypilot.error;

import java.util.List;

/**
 * Pipeline failure carrying a stable {@link ErrorKind} and remediation suggestions.
 */
public class QueryPilotException extends RuntimeException {

    private final ErrorKind kind;
    private final List<String> suggestions;

    /**
     * Create a new exception.
     *
     * @param kind error kind
     * @param message error message
     */
    public QueryPilotException(ErrorKind kind, String message) {
        this(kind, message, List.of(), null);
    }

    /**
     * Create a new exception with suggestions.
     *
     * @param kind error kind
     * @param message error message
     * @param suggestions remediation suggestions
     */
    public QueryPilotException(ErrorKind kind, String message, List<String> suggestions) {
        this(kind, message, suggestions, null);
    }

    /**
     * Create a new exception wrapping a cause.
     *
     * @param kind error kind
     * @param message error message
     * @param suggestions remediation suggestions
     * @param cause underlying cause
     */
    public QueryPilotException(ErrorKind kind, String message, List<String> suggestions, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }
}
