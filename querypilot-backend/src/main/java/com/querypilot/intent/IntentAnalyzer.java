package com.querypilot.intent;

import com.querypilot.model.EntityType;
import com.querypilot.model.Query;
import com.querypilot.model.QueryIntent;
import com.querypilot.util.TextNormalizer;

import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Classifies a question into a {@link QueryIntent} and extracts its entities.
 *
 * <p>The result depends only on the text and the given history. Confidence starts from the strength of the
 * matched intent pattern and rises with each entity that narrows the question: a date range, a table scope,
 * a comparison or number, and an explicit question form.
 */
public class IntentAnalyzer {

    static final double DATE_BONUS = 0.10d;
    static final double SCOPE_BONUS = 0.10d;
    static final double FILTER_BONUS = 0.05d;
    static final double QUESTION_BONUS = 0.05d;
    static final double FOLLOW_UP_BASE = 0.60d;
    static final double UNKNOWN_BASE = 0.30d;
    static final double MAX_CONFIDENCE = 0.99d;

    private static final Map<QueryIntent, IntentPattern> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put(QueryIntent.COUNT, new IntentPattern(0.70d,
                "\\bhow\\s+many\\b|\\bnumber\\s+of\\b|\\bcount\\b|\\bhow\\s+often\\b"));
        PATTERNS.put(QueryIntent.TOP_N, new IntentPattern(0.70d,
                "\\btop\\s+\\d+\\b|\\btop\\b|\\b(?:highest|lowest|most|least|largest|smallest|best|worst)\\b"));
        PATTERNS.put(QueryIntent.TREND, new IntentPattern(0.70d,
                "\\btrend\\b|\\bover\\s+time\\b|\\b(?:by|per|each)\\s+(?:day|week|month|quarter|year)\\b"
                        + "|\\b(?:daily|weekly|monthly|quarterly|yearly|annually)\\b|\\bgrowth\\b|\\bchanged?\\s+over\\b"));
        PATTERNS.put(QueryIntent.COMPARISON, new IntentPattern(0.70d,
                "\\bcompare[ds]?\\b|\\bcomparison\\b|\\bversus\\b|\\bvs\\b|\\bdifference\\s+between\\b"));
        PATTERNS.put(QueryIntent.AGGREGATE, new IntentPattern(0.70d,
                "\\baverage\\b|\\bavg\\b|\\bmean\\b|\\bsum\\b|\\btotal\\b|\\bmedian\\b|\\bminimum\\b|\\bmaximum\\b"
                        + "|\\bhow\\s+much\\b|\\b(?:rate|ratio|percentage)\\b"));
        PATTERNS.put(QueryIntent.LOOKUP, new IntentPattern(0.60d,
                "^(?:what|who|which|when|where)\\s+(?:is|was|are|were)\\b|\\bdetails?\\s+(?:of|for|about)\\b"
                        + "|\\blook\\s*up\\b|\\bwith\\s+(?:id|number|code)\\b"));
        PATTERNS.put(QueryIntent.LIST, new IntentPattern(0.55d,
                "\\bshow\\b|\\blist\\b|\\bdisplay\\b|\\bgive\\s+me\\b|\\bget\\b|\\bfind\\b|\\bwhich\\b|\\ball\\b"));
    }

    private static final Pattern FOLLOW_UP = Pattern.compile(
            "\\b(?:those|them|these|they|same|it|that\\s+one|what\\s+about|how\\s+about|and\\s+for)\\b");
    private static final Pattern QUESTION_START = Pattern.compile(
            "^(?:how|what|which|who|when|where|is|are|was|were|do|does|did)\\b");

    private final List<EntityExtractor> extractors;
    private final Clock clock;

    public IntentAnalyzer(List<EntityExtractor> extractors, Clock clock) {
        this.extractors = List.copyOf(extractors);
        this.clock = clock;
    }

    /**
     * Analyze one question.
     *
     * @param queryId id assigned to the request
     * @param sessionId owning session
     * @param rawText question as typed
     * @param history earlier queries of the session, oldest first
     * @return analysis with the immutable {@link Query}
     */
    public IntentAnalysis analyze(String queryId, String sessionId, String rawText, List<Query> history) {
        String text = TextNormalizer.normalize(rawText);

        Map<EntityType, List<String>> entities = new EnumMap<>(EntityType.class);
        for (EntityExtractor extractor : extractors) {
            List<String> found = extractor.extract(text);
            if (!found.isEmpty()) {
                entities.merge(extractor.type(), found, (a, b) -> a);
            }
        }

        QueryIntent intent = QueryIntent.UNKNOWN;
        double base = UNKNOWN_BASE;
        for (Map.Entry<QueryIntent, IntentPattern> entry : PATTERNS.entrySet()) {
            if (entry.getValue().pattern().matcher(text).find()) {
                intent = entry.getKey();
                base = entry.getValue().strength();
                break;
            }
        }

        Query previous = history == null || history.isEmpty() ? null : history.get(history.size() - 1);
        boolean followUp = previous != null && FOLLOW_UP.matcher(text).find();
        if (followUp) {
            for (Map.Entry<EntityType, List<String>> inherited : previous.entities().entrySet()) {
                entities.putIfAbsent(inherited.getKey(), inherited.getValue());
            }
            if (intent == QueryIntent.UNKNOWN || intent == QueryIntent.LIST) {
                if (previous.intent() != QueryIntent.UNKNOWN) {
                    intent = previous.intent();
                    base = Math.max(base, FOLLOW_UP_BASE);
                }
            }
        }

        double confidence = base;
        if (entities.containsKey(EntityType.DATE)) {
            confidence += DATE_BONUS;
        }
        if (entities.containsKey(EntityType.TABLE_HINT)) {
            confidence += SCOPE_BONUS;
        }
        if (entities.containsKey(EntityType.COMPARATOR) || entities.containsKey(EntityType.NUMBER)) {
            confidence += FILTER_BONUS;
        }
        if (rawText.trim().endsWith("?") || QUESTION_START.matcher(text).find()) {
            confidence += QUESTION_BONUS;
        }
        confidence = Math.min(MAX_CONFIDENCE, confidence);

        Query query = new Query(queryId, sessionId, rawText, text, clock.instant(), intent, confidence, entities);
        return new IntentAnalysis(query, followUp);
    }

    private record IntentPattern(double strength, Pattern pattern) {
        IntentPattern(double strength, String regex) {
            this(strength, Pattern.compile(regex));
        }
    }
}
