package com.querypilot.session;

import com.querypilot.model.Query;
import com.querypilot.model.QueryResponse;

/**
 * One answered question in a session's history.
 */
public record ConversationTurn(Query query, QueryResponse response) {
}
