package com.querypilot.sql;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Structural facts about a statement used for complexity tiers, validation and cost estimation.
 *
 * @param parsed whether the SQL parser accepted the statement (otherwise facts come from pattern matching)
 * @param aliases lower-cased alias or table name mapped to the referenced table
 */
public record StatementStructure(
        String firstKeyword,
        boolean parsed,
        List<String> tables,
        Map<String, String> aliases,
        List<ColumnRef> qualifiedColumns,
        int joinCount,
        int subqueryCount,
        int maxSubqueryDepth,
        int unionCount,
        boolean hasWindow,
        boolean hasWhere,
        boolean hasLimit,
        boolean hasAggregate,
        boolean hasGroupBy
) {

    public StatementStructure {
        tables = List.copyOf(tables);
        aliases = Map.copyOf(aliases);
        qualifiedColumns = List.copyOf(qualifiedColumns);
    }

    public Optional<String> resolveQualifier(String qualifier) {
        return Optional.ofNullable(aliases.get(qualifier.toLowerCase(Locale.ROOT)));
    }
}
