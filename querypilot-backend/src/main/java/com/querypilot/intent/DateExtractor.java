package com.querypilot.intent;

import com.querypilot.model.EntityType;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Relative and absolute date expressions: "yesterday", "last 7 days", "since 2024-01-01", "in march 2023".
 */
public class DateExtractor extends PatternExtractor {

    private static final String MONTH = "(?:january|february|march|april|may|june|july|august|september|october"
            + "|november|december|jan|feb|mar|apr|jun|jul|aug|sep|sept|oct|nov|dec)";
    private static final String UNIT = "(?:day|week|month|quarter|year|hour)s?";

    static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("\\b(?:between\\s+\\d{4}-\\d{2}-\\d{2}\\s+and\\s+\\d{4}-\\d{2}-\\d{2})"),
            Pattern.compile("\\b(?:since|before|after|from|until|on)\\s+\\d{4}-\\d{2}-\\d{2}\\b"),
            Pattern.compile("\\b\\d{4}-\\d{2}-\\d{2}\\b"),
            Pattern.compile("\\b(?:today|yesterday|tonight|tomorrow)\\b"),
            Pattern.compile("\\b(?:last|past|previous|this|next|current)\\s+(?:\\d+\\s+)?" + UNIT + "\\b"),
            Pattern.compile("\\b(?:in\\s+the\\s+)?(?:last|past)\\s+\\d+\\s+" + UNIT + "\\b"),
            Pattern.compile("\\b\\d+\\s+" + UNIT + "\\s+ago\\b"),
            Pattern.compile("\\b(?:year|month|quarter|week)\\s+to\\s+date\\b|\\b(?:ytd|mtd|qtd)\\b"),
            Pattern.compile("\\b(?:in|during|since|before|after|of)\\s+" + MONTH + "(?:\\s+\\d{4})?\\b"),
            Pattern.compile("\\b(?:in|during|since|before|after|for)\\s+(?:19|20)\\d{2}\\b"),
            Pattern.compile("\\bq[1-4](?:\\s+(?:19|20)\\d{2})?\\b")
    );

    @Override
    public EntityType type() {
        return EntityType.DATE;
    }

    @Override
    public List<String> extract(String normalizedText) {
        return collect(normalizedText, PATTERNS);
    }
}
