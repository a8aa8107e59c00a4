package com.querypilot.generation;

import com.querypilot.error.ErrorKind;
import com.querypilot.model.GeneratedStatement;
import com.querypilot.model.ValidationResult;

import java.util.List;

/**
 * Result of the generation loop: a validated statement, or a failure with a stable kind and suggestions.
 */
public record GenerationOutcome(
        GeneratedStatement statement,
        ValidationResult validation,
        ErrorKind errorKind,
        String message,
        List<String> suggestions,
        int attempts
) {

    public GenerationOutcome {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static GenerationOutcome success(GeneratedStatement statement, ValidationResult validation) {
        return new GenerationOutcome(statement, validation, null, null, List.of(), statement.attempt());
    }

    public static GenerationOutcome failure(ErrorKind kind, String message, List<String> suggestions, int attempts) {
        return new GenerationOutcome(null, null, kind, message, suggestions, attempts);
    }

    public boolean succeeded() {
        return statement != null;
    }
}
