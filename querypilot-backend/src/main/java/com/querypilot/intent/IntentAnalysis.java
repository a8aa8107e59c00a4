package com.querypilot.intent;

import com.querypilot.model.Query;

/**
 * Analyzed query plus whether it was resolved against earlier turns.
 *
 * @param followUp true when the question referred back to the previous turn and inherited its entities
 */
public record IntentAnalysis(Query query, boolean followUp) {
}
