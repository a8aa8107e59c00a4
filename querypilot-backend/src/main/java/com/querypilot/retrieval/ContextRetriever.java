package com.querypilot.retrieval;

import com.querypilot.config.QueryPilotProperties;
import com.querypilot.model.ContextElement;
import com.querypilot.model.ContextKind;
import com.querypilot.model.ContextMetadata;
import com.querypilot.model.EntityType;
import com.querypilot.model.Query;
import com.querypilot.model.QueryIntent;
import com.querypilot.model.RetrievalContext;
import com.querypilot.schema.ColumnInfo;
import com.querypilot.schema.ForeignKey;
import com.querypilot.schema.SchemaProvider;
import com.querypilot.schema.SchemaSnapshot;
import com.querypilot.schema.TableInfo;
import com.querypilot.util.Deadline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assembles a ranked, token-bounded {@link RetrievalContext} for one query.
 *
 * <p>Steps: embed the question, search with a dynamic top-K, drop weak hits, pick tables starting from the
 * best one and walking foreign keys to other candidates, attach columns and relationships of the picked
 * tables, add intent-matched examples and rules, and fill the token budget in descending score order.
 * When the embedding or vector search fails the query proceeds with an empty context.
 */
@Slf4j
public class ContextRetriever {

    private static final Set<ContextKind> SCHEMA_KINDS = EnumSet.of(ContextKind.TABLE, ContextKind.COLUMN,
            ContextKind.RELATIONSHIP);
    private static final Set<ContextKind> KNOWLEDGE_KINDS = EnumSet.of(ContextKind.EXAMPLE, ContextKind.RULE);

    private static final Pattern JOIN_HINT = Pattern.compile(
            "\\b(?:per|each|across|together\\s+with|along\\s+with|with\\s+their|and\\s+their|broken\\s+down"
                    + "|grouped\\s+by|by\\s+(?!the\\b)\\w+|join(?:ed)?)\\b");
    private static final Pattern CLAUSE = Pattern.compile("\\b(?:and|or|but|where|which|who|whose|that)\\b|,");
    private static final int SIMPLE_MAX_WORDS = 10;

    /** Score given to tables named in the question but missing from the hits. */
    private static final double HINTED_TABLE_SCORE = 0.6d;
    /** Column and relationship hits vouch for their tables at a discount. */
    private static final double INDIRECT_TABLE_FACTOR = 0.9d;
    private static final double DATE_COLUMN_FACTOR = 0.95d;

    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final SchemaProvider schemaProvider;
    private final SchemaIndexer indexer;
    private final TokenEstimator tokenEstimator;
    private final QueryPilotProperties.Retrieval settings;
    private final AsyncTaskExecutor executor;
    private final Duration embeddingTimeout;
    private final Duration searchTimeout;

    public ContextRetriever(EmbeddingService embeddingService, VectorStore vectorStore, SchemaProvider schemaProvider,
                            SchemaIndexer indexer, TokenEstimator tokenEstimator, QueryPilotProperties.Retrieval settings,
                            AsyncTaskExecutor executor, Duration embeddingTimeout, Duration searchTimeout) {
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
        this.schemaProvider = schemaProvider;
        this.indexer = indexer;
        this.tokenEstimator = tokenEstimator;
        this.settings = settings;
        this.executor = executor;
        this.embeddingTimeout = embeddingTimeout;
        this.searchTimeout = searchTimeout;
    }

    /**
     * Embed the question ahead of intent analysis so that {@link #retrieve} finds the vector cached.
     */
    public void prefetch(String rawText) {
        try {
            embeddingService.embed(rawText);
        } catch (RuntimeException e) {
            log.debug("Embedding prefetch failed (reason={})", e.getMessage());
        }
    }

    public RetrievalContext retrieve(Query query, List<Query> history, Deadline deadline) {
        SchemaSnapshot schema = schemaProvider.snapshot();
        indexer.ensureIndexed(schema);

        int topK = chooseTopK(query, history);
        List<VectorHit> schemaHits;
        List<VectorHit> knowledgeHits;
        try {
            float[] vector = deadline.call("embedding", executor, embeddingTimeout,
                    () -> embeddingService.embed(query.rawText()));
            schemaHits = deadline.call("vector search", executor, searchTimeout,
                    () -> vectorStore.search(vector, topK, SCHEMA_KINDS));
            knowledgeHits = deadline.call("vector search", executor, searchTimeout,
                    () -> vectorStore.search(vector, topK, KNOWLEDGE_KINDS));
        } catch (RuntimeException e) {
            log.warn("Context retrieval degraded to empty context (query_id={}, reason={})", query.id(), e.getMessage());
            return RetrievalContext.empty(query, settings.getTokenBudget());
        }

        List<VectorHit> relevant = schemaHits.stream()
                .filter(hit -> hit.score() >= settings.getSimilarityThreshold())
                .toList();

        Map<String, Double> candidates = candidateTables(relevant, query, schema);
        List<String> selected = selectTables(candidates, schema);

        List<ContextElement> elements = new ArrayList<>();
        elements.addAll(tableElements(selected, candidates, relevant, schema));
        elements.addAll(columnElements(selected, candidates, relevant, query, schema));
        elements.addAll(relationshipElements(selected, candidates, schema));
        elements.addAll(knowledgeElements(knowledgeHits, query.intent()));

        RetrievalContext context = fitBudget(query, elements);
        log.debug("Retrieved context (query_id={}, top_k={}, hits={}, tables={}, elements={}, tokens={})",
                query.id(), topK, relevant.size(), selected, context.elements().size(), context.totalTokens());
        return context;
    }

    /**
     * Small K for short standalone questions, large K when the question spans several clauses or tables.
     */
    int chooseTopK(Query query, List<Query> history) {
        String text = query.normalizedText();
        int clauses = count(CLAUSE, text);
        int hintedTables = query.entities(EntityType.TABLE_HINT).size();
        if (JOIN_HINT.matcher(text).find() || clauses >= 2 || hintedTables >= 2) {
            return settings.getComplexTopK();
        }
        boolean noHistory = history == null || history.isEmpty();
        int words = text.isEmpty() ? 0 : text.split(" ").length;
        if (noHistory && clauses == 0 && words <= SIMPLE_MAX_WORDS) {
            return settings.getSimpleTopK();
        }
        return settings.getDefaultTopK();
    }

    private Map<String, Double> candidateTables(List<VectorHit> hits, Query query, SchemaSnapshot schema) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (VectorHit hit : hits) {
            if (hit.metadata() instanceof ContextMetadata.TableMetadata table) {
                scores.merge(key(table.table()), hit.score(), Math::max);
            } else if (hit.metadata() instanceof ContextMetadata.ColumnMetadata column) {
                scores.merge(key(column.table()), hit.score() * INDIRECT_TABLE_FACTOR, Math::max);
            } else if (hit.metadata() instanceof ContextMetadata.RelationshipMetadata rel) {
                scores.merge(key(rel.fromTable()), hit.score() * INDIRECT_TABLE_FACTOR, Math::max);
                scores.merge(key(rel.toTable()), hit.score() * INDIRECT_TABLE_FACTOR, Math::max);
            }
        }
        for (String hinted : query.entities(EntityType.TABLE_HINT)) {
            if (schema.hasTable(hinted)) {
                scores.merge(key(hinted), HINTED_TABLE_SCORE, Math::max);
            }
        }
        scores.keySet().removeIf(table -> !schema.hasTable(table));
        return scores;
    }

    /**
     * Best table first, then a breadth-first walk over foreign keys restricted to candidates, then the
     * remaining candidates by score, up to the table cap.
     */
    List<String> selectTables(Map<String, Double> candidates, SchemaSnapshot schema) {
        List<String> byScore = candidates.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed().thenComparing(Map.Entry::getKey))
                .map(Map.Entry::getKey)
                .toList();
        Set<String> selected = new LinkedHashSet<>();
        if (byScore.isEmpty()) {
            return List.of();
        }

        Deque<String> queue = new ArrayDeque<>();
        queue.add(byScore.get(0));
        selected.add(byScore.get(0));
        while (!queue.isEmpty() && selected.size() < settings.getMaxTables()) {
            String current = queue.poll();
            List<String> neighbours = neighbours(current, schema).stream()
                    .filter(candidates::containsKey)
                    .filter(t -> !selected.contains(t))
                    .sorted(Comparator.comparingDouble((String t) -> candidates.get(t)).reversed())
                    .toList();
            for (String next : neighbours) {
                if (selected.size() >= settings.getMaxTables()) {
                    break;
                }
                selected.add(next);
                queue.add(next);
            }
        }
        for (String table : byScore) {
            if (selected.size() >= settings.getMaxTables()) {
                break;
            }
            selected.add(table);
        }
        return List.copyOf(selected);
    }

    private List<ContextElement> tableElements(List<String> selected, Map<String, Double> scores, List<VectorHit> hits,
                                               SchemaSnapshot schema) {
        List<ContextElement> elements = new ArrayList<>();
        for (String name : selected) {
            VectorHit hit = hits.stream()
                    .filter(h -> h.metadata() instanceof ContextMetadata.TableMetadata t && key(t.table()).equals(name))
                    .findFirst()
                    .orElse(null);
            if (hit != null) {
                elements.add(hit.toElement().withScore(scores.get(name)));
                continue;
            }
            TableInfo table = schema.table(name).orElseThrow();
            elements.add(ContextElement.of("table:" + table.name(), SchemaIndexer.describe(table),
                    new ContextMetadata.TableMetadata(table.name(), table.rowCount(), table.remarks()), scores.get(name)));
        }
        return elements;
    }

    private List<ContextElement> columnElements(List<String> selected, Map<String, Double> scores, List<VectorHit> hits,
                                                Query query, SchemaSnapshot schema) {
        Map<String, ContextElement> columns = new LinkedHashMap<>();
        for (VectorHit hit : hits) {
            if (hit.metadata() instanceof ContextMetadata.ColumnMetadata column && selected.contains(key(column.table()))) {
                columns.put(hit.id(), hit.toElement());
            }
        }
        if (query.hasEntity(EntityType.DATE)) {
            for (String name : selected) {
                TableInfo table = schema.table(name).orElseThrow();
                for (ColumnInfo column : table.columns()) {
                    if (isTemporal(column.dataType())) {
                        String id = "column:" + table.name() + "." + column.name();
                        columns.putIfAbsent(id, ContextElement.of(id,
                                "Column " + table.name() + "." + column.name() + " (" + column.dataType()
                                        + ") of table " + table.name(),
                                new ContextMetadata.ColumnMetadata(table.name(), column.name(), column.dataType()),
                                scores.get(name) * DATE_COLUMN_FACTOR));
                    }
                }
            }
        }
        return new ArrayList<>(columns.values());
    }

    private List<ContextElement> relationshipElements(List<String> selected, Map<String, Double> scores,
                                                      SchemaSnapshot schema) {
        List<ContextElement> elements = new ArrayList<>();
        for (ForeignKey fk : schema.foreignKeys()) {
            String from = key(fk.fromTable());
            String to = key(fk.toTable());
            if (selected.contains(from) && selected.contains(to) && !from.equals(to)) {
                elements.add(ContextElement.of(SchemaIndexer.relationshipId(fk), SchemaIndexer.describe(fk),
                        new ContextMetadata.RelationshipMetadata(fk.fromTable(), fk.fromColumn(), fk.toTable(), fk.toColumn()),
                        Math.min(scores.get(from), scores.get(to))));
            }
        }
        return elements;
    }

    private List<ContextElement> knowledgeElements(List<VectorHit> hits, QueryIntent intent) {
        List<ContextElement> elements = new ArrayList<>();
        int examples = 0;
        int rules = 0;
        for (VectorHit hit : hits) {
            if (hit.metadata() instanceof ContextMetadata.ExampleMetadata example) {
                boolean matches = example.intent() == null || example.intent() == intent;
                if (matches && examples < settings.getMaxExamples() && hit.score() >= settings.getSimilarityThreshold()) {
                    elements.add(hit.toElement());
                    examples++;
                }
            } else if (hit.metadata() instanceof ContextMetadata.RuleMetadata rule) {
                if (rule.appliesTo(intent) && rules < settings.getMaxRules()) {
                    elements.add(hit.toElement());
                    rules++;
                }
            }
        }
        return elements;
    }

    /**
     * Greedy fill in descending score order, stopping at the first element that would exceed the budget left
     * after the fixed prompt overhead.
     */
    RetrievalContext fitBudget(Query query, List<ContextElement> elements) {
        int available = Math.max(0, settings.getTokenBudget() - settings.getPromptOverheadTokens());
        List<ContextElement> ordered = elements.stream()
                .sorted(Comparator.comparingDouble(ContextElement::score).reversed())
                .toList();
        List<ContextElement> kept = new ArrayList<>();
        int total = 0;
        for (ContextElement element : ordered) {
            int tokens = tokenEstimator.count(element.content());
            if (total + tokens > available) {
                break;
            }
            kept.add(element);
            total += tokens;
        }
        return new RetrievalContext(query, kept, total, settings.getTokenBudget());
    }

    private static List<String> neighbours(String table, SchemaSnapshot schema) {
        List<String> out = new ArrayList<>();
        for (ForeignKey fk : schema.foreignKeys()) {
            if (key(fk.fromTable()).equals(table)) {
                out.add(key(fk.toTable()));
            } else if (key(fk.toTable()).equals(table)) {
                out.add(key(fk.fromTable()));
            }
        }
        return out;
    }

    private static boolean isTemporal(String dataType) {
        String t = dataType == null ? "" : dataType.toUpperCase(Locale.ROOT);
        return t.contains("DATE") || t.contains("TIME");
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }

    private static String key(String table) {
        return SchemaSnapshot.stripQualifier(table).toLowerCase(Locale.ROOT);
    }
}
