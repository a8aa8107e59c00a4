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
 * Which measure the question asks for: count, sum, average, max, min or ratio.
 */
public class MetricExtractor implements EntityExtractor {

    private static final Map<String, Pattern> METRICS = new LinkedHashMap<>();

    static {
        METRICS.put("count", Pattern.compile("\\bhow\\s+many\\b|\\bnumber\\s+of\\b|\\bcount\\b"));
        METRICS.put("average", Pattern.compile("\\baverage\\b|\\bavg\\b|\\bmean\\b"));
        METRICS.put("sum", Pattern.compile("\\btotal\\b|\\bsum\\b|\\bhow\\s+much\\b"));
        METRICS.put("max", Pattern.compile("\\bmaximum\\b|\\bmax\\b|\\bhighest\\b|\\bmost\\b|\\blargest\\b|\\blongest\\b"));
        METRICS.put("min", Pattern.compile("\\bminimum\\b|\\bmin\\b|\\blowest\\b|\\bleast\\b|\\bsmallest\\b|\\bshortest\\b"));
        METRICS.put("ratio", Pattern.compile("\\brate\\b|\\bratio\\b|\\bpercent(?:age)?\\b|\\bshare\\b|%"));
    }

    @Override
    public EntityType type() {
        return EntityType.METRIC;
    }

    @Override
    public List<String> extract(String normalizedText) {
        Set<String> found = new LinkedHashSet<>();
        METRICS.forEach((metric, pattern) -> {
            if (pattern.matcher(normalizedText).find()) {
                found.add(metric);
            }
        });
        return new ArrayList<>(found);
    }
}
