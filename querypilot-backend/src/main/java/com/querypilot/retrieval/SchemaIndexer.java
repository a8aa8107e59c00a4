package com.querypilot.retrieval;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.querypilot.model.ContextMetadata;
import com.querypilot.schema.ColumnInfo;
import com.querypilot.schema.ForeignKey;
import com.querypilot.schema.SchemaSnapshot;
import com.querypilot.schema.TableInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a schema snapshot and the curated knowledge base into vector documents.
 *
 * <p>The index is rebuilt whenever it is asked about a snapshot with a different version than the one
 * last indexed.
 */
@Slf4j
public class SchemaIndexer {

    private final EmbeddingService embeddingService;
    private final VectorStore vectorStore;
    private final KnowledgeBase knowledge;
    private volatile String indexedVersion;

    public SchemaIndexer(EmbeddingService embeddingService, VectorStore vectorStore, KnowledgeBase knowledge) {
        this.embeddingService = embeddingService;
        this.vectorStore = vectorStore;
        this.knowledge = knowledge;
    }

    /**
     * Read a knowledge base from JSON. A missing resource yields an empty knowledge base.
     */
    public static KnowledgeBase loadKnowledge(Resource resource, ObjectMapper objectMapper) {
        if (resource == null || !resource.exists()) {
            log.warn("Knowledge file not found, indexing schema only (location={})", resource);
            return KnowledgeBase.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            KnowledgeBase kb = objectMapper.readValue(in, KnowledgeBase.class);
            log.info("Loaded knowledge base (examples={}, rules={})", kb.examples().size(), kb.rules().size());
            return kb;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read knowledge file " + resource.getDescription(), e);
        }
    }

    public void ensureIndexed(SchemaSnapshot snapshot) {
        if (snapshot.version().equals(indexedVersion)) {
            return;
        }
        synchronized (this) {
            if (!snapshot.version().equals(indexedVersion)) {
                reindex(snapshot);
            }
        }
    }

    public synchronized void reindex(SchemaSnapshot snapshot) {
        long start = System.currentTimeMillis();
        List<VectorDocument> documents = new ArrayList<>();
        for (TableInfo table : snapshot.tables()) {
            documents.add(document("table:" + table.name(), describe(table),
                    new ContextMetadata.TableMetadata(table.name(), table.rowCount(), table.remarks())));
            for (ColumnInfo column : table.columns()) {
                documents.add(document("column:" + table.name() + "." + column.name(),
                        "Column " + table.name() + "." + column.name() + " (" + column.dataType() + ") of table "
                                + table.name(),
                        new ContextMetadata.ColumnMetadata(table.name(), column.name(), column.dataType())));
            }
        }
        for (ForeignKey fk : snapshot.foreignKeys()) {
            documents.add(document(relationshipId(fk), describe(fk),
                    new ContextMetadata.RelationshipMetadata(fk.fromTable(), fk.fromColumn(), fk.toTable(), fk.toColumn())));
        }
        int n = 0;
        for (KnowledgeBase.Example example : knowledge.examples()) {
            documents.add(document("example:" + (++n),
                    "Question: " + example.question() + "\nSQL: " + example.sql(),
                    new ContextMetadata.ExampleMetadata(example.question(), example.sql(), example.intent())));
        }
        for (KnowledgeBase.Rule rule : knowledge.rules()) {
            documents.add(document("rule:" + rule.name(), rule.text(),
                    new ContextMetadata.RuleMetadata(rule.name(), rule.intents())));
        }
        vectorStore.replaceAll(documents);
        indexedVersion = snapshot.version();
        log.info("Indexed schema documents (version={}, documents={}, elapsed_ms={})",
                snapshot.version(), documents.size(), System.currentTimeMillis() - start);
    }

    public String indexedVersion() {
        return indexedVersion;
    }

    static String describe(TableInfo table) {
        StringBuilder sb = new StringBuilder("Table ").append(table.name());
        if (table.rowCount() >= 0) {
            sb.append(" (about ").append(table.rowCount()).append(" rows)");
        }
        if (table.remarks() != null && !table.remarks().isBlank()) {
            sb.append(": ").append(table.remarks().trim());
        }
        sb.append(". Columns: ").append(table.columns().stream()
                .map(c -> c.name() + " " + c.dataType())
                .collect(Collectors.joining(", ")));
        return sb.toString();
    }

    static String describe(ForeignKey fk) {
        return "Relationship: " + fk.fromTable() + "." + fk.fromColumn() + " references " + fk.toTable() + "."
                + fk.toColumn() + " (join " + fk.fromTable() + " to " + fk.toTable() + ")";
    }

    static String relationshipId(ForeignKey fk) {
        return "relationship:" + fk.fromTable() + "." + fk.fromColumn() + "->" + fk.toTable() + "." + fk.toColumn();
    }

    private VectorDocument document(String id, String content, ContextMetadata metadata) {
        return new VectorDocument(id, content, metadata, embeddingService.embed(content));
    }
}
