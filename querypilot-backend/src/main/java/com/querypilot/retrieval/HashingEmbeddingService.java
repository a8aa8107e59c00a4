package com.querypilot.retrieval;

import com.querypilot.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Deterministic, offline embedding based on feature hashing.
 *
 * <p>Words, their singular forms and character trigrams are hashed into signed buckets and the vector is
 * L2-normalized. Texts sharing vocabulary get a positive cosine similarity, which is enough to rank schema
 * documents against a question without calling an external model. Identifiers are split on underscores, so
 * {@code admitted_at} shares features with "admitted".
 */
@Slf4j
public class HashingEmbeddingService implements EmbeddingService {

    private static final float WORD_WEIGHT = 1.0f;
    private static final float STEM_WEIGHT = 0.8f;
    private static final float TRIGRAM_WEIGHT = 0.25f;

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "been", "by", "for", "from", "has", "had", "have", "in",
            "is", "it", "its", "of", "on", "that", "the", "to", "was", "were", "will", "with", "what", "where",
            "when", "which", "who", "how", "me", "my", "our", "this", "these", "those", "there", "i", "you", "we",
            "they", "them", "show", "list", "give", "get", "find", "please", "all");

    private final int dimensions;

    public HashingEmbeddingService(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
        log.info("Using hashing embeddings (dimensions={})", dimensions);
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimensions];
        for (String word : words(text)) {
            add(vector, "w:" + word, WORD_WEIGHT);
            String stem = stem(word);
            if (!stem.equals(word)) {
                add(vector, "w:" + stem, STEM_WEIGHT);
            }
            String padded = "^" + stem + "$";
            for (int i = 0; i + 3 <= padded.length(); i++) {
                add(vector, "t:" + padded.substring(i, i + 3), TRIGRAM_WEIGHT);
            }
        }
        double norm = 0.0d;
        for (float v : vector) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] = (float) (vector[i] / norm);
            }
        }
        return vector;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        for (String token : TextNormalizer.normalize(text).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                words.add(token);
            }
        }
        return words;
    }

    static String stem(String word) {
        if (word.endsWith("ies") && word.length() > 4) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.endsWith("s") && !word.endsWith("ss") && word.length() > 3) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    private void add(float[] vector, String feature, float weight) {
        int hash = feature.hashCode();
        int bucket = Math.floorMod(hash, dimensions);
        float sign = ((hash >>> 16) & 1) == 0 ? 1.0f : -1.0f;
        vector[bucket] += sign * weight;
    }
}
