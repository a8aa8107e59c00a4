package com.querypilot.intent;

import com.querypilot.model.EntityType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Comparison phrases mapped to operators: "more than" becomes {@code >}, "at most" becomes {@code <=}.
 */
public class ComparatorExtractor implements EntityExtractor {

    private static final Map<Pattern, String> OPERATORS = new LinkedHashMap<>();

    static {
        OPERATORS.put(Pattern.compile("\\bat\\s+least\\b|\\bno\\s+(?:less|fewer)\\s+than\\b|>="), ">=");
        OPERATORS.put(Pattern.compile("\\bat\\s+most\\b|\\bno\\s+more\\s+than\\b|\\bup\\s+to\\b|<="), "<=");
        OPERATORS.put(Pattern.compile(
                "\\b(?:more|greater|higher|larger|longer|older)\\s+than\\b|\\b(?:over|above|exceeding)\\s+\\d|(?<![<>=!])>(?!=)"), ">");
        OPERATORS.put(Pattern.compile(
                "\\b(?:less|fewer|lower|smaller|shorter|younger)\\s+than\\b|\\b(?:under|below)\\s+\\d|(?<![<>=!])<(?![=>])"), "<");
        OPERATORS.put(Pattern.compile("\\bnot\\s+equal(?:\\s+to)?\\b|\\bother\\s+than\\b|!=|<>"), "!=");
        OPERATORS.put(Pattern.compile("\\bequal(?:s|\\s+to)?\\b|\\bexactly\\b|(?<![<>=!])=(?!=)"), "=");
        OPERATORS.put(Pattern.compile("\\bbetween\\b"), "between");
    }

    @Override
    public EntityType type() {
        return EntityType.COMPARATOR;
    }

    @Override
    public List<String> extract(String normalizedText) {
        Set<String> found = new LinkedHashSet<>();
        OPERATORS.forEach((pattern, operator) -> {
            if (pattern.matcher(normalizedText).find()) {
                found.add(operator);
            }
        });
        return new ArrayList<>(found);
    }
}
