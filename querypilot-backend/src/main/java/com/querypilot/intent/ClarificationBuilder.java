package com.querypilot.intent;

import com.querypilot.model.EntityType;
import com.querypilot.model.Query;
import com.querypilot.model.QueryIntent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

/**
 * Questions to ask back when a query is too vague to generate a statement for.
 */
public class ClarificationBuilder {

    private static final int EXAMPLE_TABLES = 3;

    private final Supplier<Collection<String>> tableNames;

    public ClarificationBuilder(Supplier<Collection<String>> tableNames) {
        this.tableNames = tableNames;
    }

    public List<String> questionsFor(Query query) {
        List<String> questions = new ArrayList<>();
        if (!query.hasEntity(EntityType.DATE)) {
            questions.add("Which time period should this cover, for example yesterday, last month or a date range?");
        }
        if (!query.hasEntity(EntityType.TABLE_HINT)) {
            List<String> examples = tableNames.get().stream().limit(EXAMPLE_TABLES).toList();
            questions.add(examples.isEmpty()
                    ? "Which records are you asking about?"
                    : "Which records are you asking about, for example " + String.join(", ", examples) + "?");
        }
        if (!query.hasEntity(EntityType.METRIC) && query.intent() != QueryIntent.COUNT
                && query.intent() != QueryIntent.LOOKUP) {
            questions.add("What would you like to know: a count, a total, an average or a list of records?");
        }
        if (questions.isEmpty()) {
            questions.add("Could you rephrase the question with a little more detail?");
        }
        return questions;
    }
}
