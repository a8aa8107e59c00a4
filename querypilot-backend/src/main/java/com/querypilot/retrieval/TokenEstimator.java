package com.querypilot.retrieval;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Token counts for prompt budgeting.
 *
 * <p>Uses a BPE encoding from jtokkit when the configured name is known; otherwise falls back to a
 * characters-per-token ratio, rounded up.
 */
@Slf4j
public class TokenEstimator {

    private final Encoding encoding;
    private final int charsPerToken;

    public TokenEstimator(String encodingName, int charsPerToken) {
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be positive");
        }
        this.charsPerToken = charsPerToken;
        this.encoding = resolve(encodingName).orElse(null);
        if (encoding == null) {
            log.warn("Unknown tokenizer encoding, estimating by characters (encoding={}, chars_per_token={})",
                    encodingName, charsPerToken);
        }
    }

    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        if (encoding != null) {
            return encoding.countTokens(text);
        }
        return (text.length() + charsPerToken - 1) / charsPerToken;
    }

    private static Optional<Encoding> resolve(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
        return registry.getEncoding(name.trim());
    }
}
