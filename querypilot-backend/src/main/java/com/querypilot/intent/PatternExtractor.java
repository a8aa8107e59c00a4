package com.querypilot.intent;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base for extractors that are a list of patterns applied in order.
 */
abstract class PatternExtractor implements EntityExtractor {

    /**
     * Collect every match of each pattern, keeping first-seen order.
     */
    protected static List<String> collect(String text, List<Pattern> patterns) {
        Set<String> found = new LinkedHashSet<>();
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                found.add(m.group().trim());
            }
        }
        return new ArrayList<>(found);
    }
}
