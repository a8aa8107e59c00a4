package com.querypilot.controller;

import com.querypilot.api.AskRequest;
import com.querypilot.api.AskResponse;
import com.querypilot.api.ClarificationResponse;
import com.querypilot.api.ErrorResponse;
import com.querypilot.api.HealthResponse;
import com.querypilot.api.SessionHistoryResponse;
import com.querypilot.error.QueryPilotException;
import com.querypilot.execution.CircuitSnapshot;
import com.querypilot.execution.CircuitState;
import com.querypilot.execution.ExecutionGuard;
import com.querypilot.model.ExecutionResult;
import com.querypilot.model.QueryResponse;
import com.querypilot.orchestration.PipelineOutcome;
import com.querypilot.orchestration.QueryOrchestrator;
import com.querypilot.schema.SchemaProvider;
import com.querypilot.session.ConversationStore;
import com.querypilot.session.ConversationTurn;
import com.querypilot.session.Session;
import com.querypilot.web.GlobalExceptionHandler;
import com.querypilot.web.TraceIdFilter;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/v1")
public class QueryPilotController {

    private static final Logger log = LoggerFactory.getLogger(QueryPilotController.class);

    private final QueryOrchestrator orchestrator;
    private final ConversationStore conversationStore;
    private final ExecutionGuard executionGuard;
    private final SchemaProvider schemaProvider;

    public QueryPilotController(
            QueryOrchestrator orchestrator,
            ConversationStore conversationStore,
            ExecutionGuard executionGuard,
            SchemaProvider schemaProvider
    ) {
        this.orchestrator = orchestrator;
        this.conversationStore = conversationStore;
        this.executionGuard = executionGuard;
        this.schemaProvider = schemaProvider;
    }

    /**
     * Answer a question, ask for clarification, or report a classified failure.
     */
    @PostMapping("/ask")
    public ResponseEntity<?> ask(@Valid @RequestBody AskRequest request) {
        log.info("Ask received (session_id={}, length={})", request.getSessionId(), request.getQuery().length());
        PipelineOutcome outcome = orchestrator.process(request.getQuery(), request.getSessionId());
        String traceId = MDC.get(TraceIdFilter.MDC_TRACE_ID);

        if (outcome instanceof PipelineOutcome.Answered answered) {
            return ResponseEntity.ok(toAskResponse(answered, traceId));
        }
        if (outcome instanceof PipelineOutcome.Clarification clarification) {
            return ResponseEntity.ok(ClarificationResponse.builder()
                    .status("clarification")
                    .queryId(clarification.queryId())
                    .sessionId(clarification.sessionId())
                    .intent(clarification.intent().name())
                    .confidence(clarification.confidence())
                    .questions(clarification.questions())
                    .traceId(traceId)
                    .build());
        }
        PipelineOutcome.Failed failed = (PipelineOutcome.Failed) outcome;
        return ResponseEntity.status(GlobalExceptionHandler.statusFor(failed.kind())).body(ErrorResponse.builder()
                .code(failed.kind().name())
                .message(failed.message())
                .suggestions(failed.suggestions())
                .queryId(failed.queryId())
                .sessionId(failed.sessionId())
                .traceId(traceId)
                .build());
    }

    @GetMapping("/sessions/{sessionId}/history")
    public ResponseEntity<?> history(@PathVariable("sessionId") String sessionId) {
        String traceId = MDC.get(TraceIdFilter.MDC_TRACE_ID);
        Optional<Session> session = conversationStore.find(sessionId);
        if (session.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.builder()
                    .code("NOT_FOUND")
                    .message("Unknown or expired session")
                    .sessionId(sessionId)
                    .traceId(traceId)
                    .build());
        }

        List<SessionHistoryResponse.Turn> turns = session.get().history().stream()
                .map(QueryPilotController::toTurn)
                .toList();
        return ResponseEntity.ok(SessionHistoryResponse.builder()
                .sessionId(sessionId)
                .lastActivity(session.get().getLastActivity())
                .turns(turns)
                .traceId(traceId)
                .build());
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> deleteSession(@PathVariable("sessionId") String sessionId) {
        if (!conversationStore.remove(sessionId)) {
            return ResponseEntity.notFound().build();
        }
        log.info("Session removed (session_id={})", sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        CircuitSnapshot circuit = executionGuard.circuit();
        String schemaVersion;
        try {
            schemaVersion = schemaProvider.schemaVersion();
        } catch (QueryPilotException e) {
            log.warn("Health check could not read the schema: {}", e.getMessage());
            schemaVersion = null;
        }
        boolean up = circuit.state() == CircuitState.CLOSED && schemaVersion != null;
        return ResponseEntity.ok(HealthResponse.builder()
                .status(up ? "UP" : "DEGRADED")
                .circuitState(circuit.state().name())
                .consecutiveFailures(circuit.consecutiveFailures())
                .lastFailureAt(circuit.lastFailureAt())
                .schemaVersion(schemaVersion)
                .activeSessions(conversationStore.activeSessions())
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build());
    }

    private static AskResponse toAskResponse(PipelineOutcome.Answered answered, String traceId) {
        QueryResponse response = answered.response();
        ExecutionResult result = response.result();
        return AskResponse.builder()
                .status("answered")
                .queryId(answered.queryId())
                .sessionId(answered.sessionId())
                .answer(response.answer())
                .sql(response.statement())
                .columns(result.columns())
                .rows(result.rows())
                .rowCount(result.rowCount())
                .complete(result.complete())
                .estimatedTotalRows(result.estimatedTotalRows())
                .warnings(answered.warnings())
                .cacheHit(response.cacheHit())
                .latencyMs(response.latencyMs())
                .stageTimingsMs(response.stageTimingsMs())
                .traceId(traceId)
                .build();
    }

    private static SessionHistoryResponse.Turn toTurn(ConversationTurn turn) {
        QueryResponse response = turn.response();
        return SessionHistoryResponse.Turn.builder()
                .queryId(turn.query().id())
                .question(turn.query().rawText())
                .intent(turn.query().intent().name())
                .askedAt(turn.query().timestamp())
                .sql(response.statement())
                .answer(response.answer())
                .rowCount(response.result().rowCount())
                .cacheHit(response.cacheHit())
                .build();
    }
}
