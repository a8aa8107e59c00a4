package com.querypilot.generation;

import java.util.List;

/**
 * Text-completion backend used to write statements.
 */
public interface GenerativeBackend {

    /**
     * Complete a prompt.
     *
     * @param prompt full prompt text
     * @param stopSequences sequences that end the completion
     * @param maxTokens upper bound on generated tokens
     * @param temperature sampling temperature
     * @return raw completion text
     */
    String generate(String prompt, List<String> stopSequences, int maxTokens, double temperature);
}
