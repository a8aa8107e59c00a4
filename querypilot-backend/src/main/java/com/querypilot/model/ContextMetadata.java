package com.querypilot.model;

import java.util.Set;

/**
 * Typed payload attached to a {@link ContextElement}, one variant per {@link ContextKind}.
 */
public sealed interface ContextMetadata {

    ContextKind kind();

    record TableMetadata(String table, long rowCount, String description) implements ContextMetadata {
        @Override
        public ContextKind kind() {
            return ContextKind.TABLE;
        }
    }

    record ColumnMetadata(String table, String column, String dataType) implements ContextMetadata {
        @Override
        public ContextKind kind() {
            return ContextKind.COLUMN;
        }
    }

    record RelationshipMetadata(String fromTable, String fromColumn, String toTable, String toColumn)
            implements ContextMetadata {
        @Override
        public ContextKind kind() {
            return ContextKind.RELATIONSHIP;
        }
    }

    record ExampleMetadata(String question, String statement, QueryIntent intent) implements ContextMetadata {
        @Override
        public ContextKind kind() {
            return ContextKind.EXAMPLE;
        }
    }

    record RuleMetadata(String name, Set<QueryIntent> intents) implements ContextMetadata {
        public RuleMetadata {
            intents = intents == null ? Set.of() : Set.copyOf(intents);
        }

        @Override
        public ContextKind kind() {
            return ContextKind.RULE;
        }

        /**
         * Rules without an intent restriction apply to every question.
         */
        public boolean appliesTo(QueryIntent intent) {
            return intents.isEmpty() || intents.contains(intent);
        }
    }
}
