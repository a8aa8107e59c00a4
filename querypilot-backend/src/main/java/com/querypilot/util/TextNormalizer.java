package com.querypilot.util;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Canonical form of question text, used for caching keys and pattern matching.
 */
public final class TextNormalizer {

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String s = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        s = s.replaceAll("[\\p{Punct}&&[^<>=!.%-]]", " ");
        s = s.replaceAll("(?<!\\d)\\.|\\.(?!\\d)", " ");
        return s.replaceAll("\\s+", " ").trim();
    }
}
