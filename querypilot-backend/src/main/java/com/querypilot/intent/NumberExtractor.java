package com.querypilot.intent;

import com.querypilot.model.EntityType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numeric literals that are not part of a date expression.
 */
public class NumberExtractor implements EntityExtractor {

    private static final Pattern NUMBER = Pattern.compile("(?<![\\w.-])-?\\d+(?:\\.\\d+)?%?(?![\\w-])");

    @Override
    public EntityType type() {
        return EntityType.NUMBER;
    }

    @Override
    public List<String> extract(String normalizedText) {
        String text = normalizedText;
        for (Pattern date : DateExtractor.PATTERNS) {
            text = date.matcher(text).replaceAll(" ");
        }
        Set<String> numbers = new LinkedHashSet<>();
        Matcher m = NUMBER.matcher(text);
        while (m.find()) {
            numbers.add(m.group());
        }
        return new ArrayList<>(numbers);
    }
}
