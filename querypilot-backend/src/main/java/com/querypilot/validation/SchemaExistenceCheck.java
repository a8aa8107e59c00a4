package com.querypilot.validation;

import com.querypilot.model.ValidationIssue;
import com.querypilot.schema.NameSimilarity;
import com.querypilot.schema.SchemaSnapshot;
import com.querypilot.schema.TableInfo;
import com.querypilot.sql.ColumnRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Layer 3: every referenced table and qualified column must exist in the schema snapshot.
 */
public class SchemaExistenceCheck implements ValidationLayer {

    public static final String RULE_ID = "schema_existence";
    public static final String OUTSIDE_CONTEXT_RULE_ID = "table_outside_context";

    private static final int MAX_SUGGESTIONS = 5;

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public LayerResult check(ValidationInput input) {
        SchemaSnapshot schema = input.schema();
        List<ValidationIssue> issues = new ArrayList<>();

        for (String table : input.structure().tables()) {
            if (!schema.hasTable(table)) {
                List<String> suggestions = NameSimilarity.rank(table, schema.tableNames(), MAX_SUGGESTIONS);
                if (suggestions.isEmpty() && input.context() != null) {
                    // nothing looks alike: offer the tables retrieved for this question instead
                    suggestions = input.context().tableNames().stream().limit(MAX_SUGGESTIONS).toList();
                }
                issues.add(ValidationIssue.error(RULE_ID, "Table '" + table + "' does not exist", suggestions));
            }
        }

        for (ColumnRef ref : input.structure().qualifiedColumns()) {
            Optional<String> owner = input.structure().resolveQualifier(ref.qualifier());
            if (owner.isEmpty()) {
                continue;
            }
            Optional<TableInfo> table = schema.table(owner.get());
            if (table.isPresent() && !table.get().hasColumn(ref.column())) {
                List<String> suggestions = NameSimilarity.rank(ref.column(), table.get().columnNames(), MAX_SUGGESTIONS);
                issues.add(ValidationIssue.error(RULE_ID,
                        "Column '" + ref.column() + "' does not exist in table '" + table.get().name() + "'",
                        suggestions));
            }
        }

        if (input.context() != null && !input.context().isEmpty()) {
            Set<String> retrieved = input.context().tableNames().stream()
                    .map(name -> name.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toSet());
            for (String table : input.structure().tables()) {
                if (schema.hasTable(table) && !retrieved.contains(table.toLowerCase(Locale.ROOT))) {
                    issues.add(ValidationIssue.info(OUTSIDE_CONTEXT_RULE_ID,
                            "Table '" + table + "' was not part of the retrieved context"));
                }
            }
        }
        return LayerResult.of(issues);
    }
}
