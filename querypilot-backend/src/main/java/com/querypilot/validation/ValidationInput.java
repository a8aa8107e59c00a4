package com.querypilot.validation;

import com.querypilot.model.RetrievalContext;
import com.querypilot.schema.SchemaSnapshot;
import com.querypilot.sql.StatementStructure;

/**
 * Everything a layer may look at. {@code context} is null when validation runs outside a request.
 */
public record ValidationInput(
        String statement,
        StatementStructure structure,
        SchemaSnapshot schema,
        RetrievalContext context
) {
}
