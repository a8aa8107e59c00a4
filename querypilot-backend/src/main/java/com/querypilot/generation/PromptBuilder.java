package com.querypilot.generation;

import com.querypilot.model.ContextElement;
import com.querypilot.model.ContextKind;
import com.querypilot.model.ContextMetadata;
import com.querypilot.model.RetrievalContext;
import com.querypilot.session.ConversationTurn;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the generation prompt: role, schema, rules, examples, recent turns, the question and, on retries,
 * a correction section naming what was wrong with the previous statement.
 */
public class PromptBuilder {

    private final String dialect;

    public PromptBuilder(String dialect) {
        this.dialect = dialect;
    }

    public String build(String question, RetrievalContext context, List<ConversationTurn> recentTurns, String correction) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are an expert SQL developer. Write one correct, efficient, read-only ")
                .append(dialect).append(" query that answers the user's question.\n\n");

        sb.append("### Database Schema\n");
        String schema = formatSchema(context);
        sb.append(schema.isEmpty() ? "(no schema context available; use only tables you are sure exist)\n" : schema);

        List<ContextElement> rules = context.ofKind(ContextKind.RULE);
        if (!rules.isEmpty()) {
            sb.append("\n### Rules\n");
            rules.forEach(rule -> sb.append("- ").append(rule.content()).append('\n'));
        }

        List<ContextElement> examples = context.ofKind(ContextKind.EXAMPLE);
        if (!examples.isEmpty()) {
            sb.append("\n### Examples\n");
            for (ContextElement example : examples) {
                ContextMetadata.ExampleMetadata meta = (ContextMetadata.ExampleMetadata) example.metadata();
                sb.append("Question: ").append(meta.question()).append('\n')
                        .append("SQL: ").append(meta.statement()).append("\n\n");
            }
        }

        if (recentTurns != null && !recentTurns.isEmpty()) {
            sb.append("\n### Recent Conversation\n");
            for (ConversationTurn turn : recentTurns) {
                sb.append("Question: ").append(turn.query().rawText()).append('\n');
                if (turn.response() != null && turn.response().statement() != null) {
                    sb.append("SQL: ").append(turn.response().statement()).append('\n');
                }
            }
        }

        sb.append("\n### Instructions\n")
                .append("1. Return ONLY the SQL query, without explanations or markdown.\n")
                .append("2. Use only SELECT (or WITH ... SELECT); never modify data.\n")
                .append("3. Use only the tables and columns listed above.\n")
                .append("4. If the question cannot be answered with the given schema, return \"")
                .append(StatementExtractor.NO_SQL).append("\".\n");

        if (correction != null && !correction.isBlank()) {
            sb.append("\n### Correction\n")
                    .append("Your previous query was rejected: ").append(correction).append('\n')
                    .append("Write a corrected query.\n");
        }

        sb.append("\n### User Question\n").append(question).append("\n\n### SQL Query\n");
        return sb.toString();
    }

    /**
     * Tables with their columns, then relationships.
     */
    private static String formatSchema(RetrievalContext context) {
        Map<String, StringBuilder> tables = new LinkedHashMap<>();
        for (ContextElement element : context.ofKind(ContextKind.TABLE)) {
            ContextMetadata.TableMetadata table = (ContextMetadata.TableMetadata) element.metadata();
            StringBuilder sb = new StringBuilder("- Table: ").append(table.table());
            if (table.description() != null && !table.description().isBlank()) {
                sb.append(" -- ").append(table.description());
            }
            tables.put(table.table().toLowerCase(Locale.ROOT), sb.append('\n'));
        }
        for (ContextElement element : context.ofKind(ContextKind.COLUMN)) {
            ContextMetadata.ColumnMetadata column = (ContextMetadata.ColumnMetadata) element.metadata();
            tables.computeIfAbsent(column.table().toLowerCase(Locale.ROOT),
                            t -> new StringBuilder("- Table: ").append(column.table()).append('\n'))
                    .append("  - ").append(column.column()).append(" (").append(column.dataType()).append(")\n");
        }
        StringBuilder out = new StringBuilder();
        tables.values().forEach(out::append);
        for (ContextElement element : context.ofKind(ContextKind.RELATIONSHIP)) {
            ContextMetadata.RelationshipMetadata rel = (ContextMetadata.RelationshipMetadata) element.metadata();
            out.append("- Join: ").append(rel.fromTable()).append('.').append(rel.fromColumn())
                    .append(" = ").append(rel.toTable()).append('.').append(rel.toColumn()).append('\n');
        }
        return out.toString();
    }
}
