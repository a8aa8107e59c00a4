package com.querypilot.orchestration;

import com.querypilot.error.ErrorKind;
import com.querypilot.model.QueryIntent;
import com.querypilot.model.QueryResponse;

import java.util.List;

/**
 * What one pass through the pipeline produced. Exactly one of answer, clarification or failure.
 */
public sealed interface PipelineOutcome {

    String queryId();

    String sessionId();

    record Answered(String queryId, String sessionId, QueryResponse response, List<String> warnings)
            implements PipelineOutcome {

        public Answered {
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }
    }

    record Clarification(String queryId, String sessionId, QueryIntent intent, double confidence,
                         List<String> questions) implements PipelineOutcome {

        public Clarification {
            questions = List.copyOf(questions);
        }
    }

    record Failed(String queryId, String sessionId, ErrorKind kind, String message, List<String> suggestions)
            implements PipelineOutcome {

        public Failed {
            suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        }
    }
}
