package com.querypilot.controller;

import com.querypilot.error.ErrorKind;
import com.querypilot.error.QueryPilotException;
import com.querypilot.execution.CircuitSnapshot;
import com.querypilot.execution.CircuitState;
import com.querypilot.execution.ExecutionGuard;
import com.querypilot.model.ExecutionResult;
import com.querypilot.model.Query;
import com.querypilot.model.QueryIntent;
import com.querypilot.model.QueryResponse;
import com.querypilot.orchestration.PipelineOutcome;
import com.querypilot.orchestration.QueryOrchestrator;
import com.querypilot.schema.SchemaProvider;
import com.querypilot.session.ConversationStore;
import com.querypilot.session.ConversationTurn;
import com.querypilot.util.MutableClock;
import com.querypilot.web.GlobalExceptionHandler;
import com.querypilot.web.TraceIdFilter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class QueryPilotControllerTest {

    private static final String STATEMENT = "SELECT COUNT(*) AS admitted FROM patients";

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T09:00:00Z"));
    private final QueryOrchestrator orchestrator = mock(QueryOrchestrator.class);
    private final ExecutionGuard executionGuard = mock(ExecutionGuard.class);
    private final SchemaProvider schemaProvider = mock(SchemaProvider.class);
    private ConversationStore conversationStore;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        conversationStore = new ConversationStore(10, Duration.ofMinutes(30), Duration.ofMinutes(5), clock);
        QueryPilotController controller = new QueryPilotController(orchestrator, conversationStore, executionGuard,
                schemaProvider);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .addFilters(new TraceIdFilter())
                .build();
    }

    @AfterEach
    void tearDown() {
        conversationStore.close();
    }

    @Test
    void answeredQuestionIsRenderedInSnakeCase() throws Exception {
        when(orchestrator.process("How many patients?", "s1")).thenReturn(new PipelineOutcome.Answered("q1", "s1",
                response("q1", false), List.of()));

        mockMvc.perform(post("/v1/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(TraceIdFilter.TRACE_ID_HEADER, "trace-1")
                        .content("{\"query\":\"How many patients?\",\"session_id\":\"s1\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string(TraceIdFilter.TRACE_ID_HEADER, "trace-1"))
                .andExpect(jsonPath("$.status").value("answered"))
                .andExpect(jsonPath("$.query_id").value("q1"))
                .andExpect(jsonPath("$.session_id").value("s1"))
                .andExpect(jsonPath("$.sql").value(STATEMENT))
                .andExpect(jsonPath("$.rows[0].admitted").value(2))
                .andExpect(jsonPath("$.row_count").value(1))
                .andExpect(jsonPath("$.cache_hit").value(false))
                .andExpect(jsonPath("$.stage_timings_ms.generation").value(12))
                .andExpect(jsonPath("$.trace_id").value("trace-1"));
    }

    @Test
    void clarificationIsAnOkResponse() throws Exception {
        when(orchestrator.process(anyString(), any())).thenReturn(new PipelineOutcome.Clarification("q2", "s1",
                QueryIntent.UNKNOWN, 0.3, List.of("Which table do you mean?")));

        mockMvc.perform(post("/v1/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"Show me the data\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("clarification"))
                .andExpect(jsonPath("$.intent").value("UNKNOWN"))
                .andExpect(jsonPath("$.questions[0]").value("Which table do you mean?"));
    }

    @Test
    void failedOutcomeUsesTheKindStatus() throws Exception {
        when(orchestrator.process(anyString(), any())).thenReturn(new PipelineOutcome.Failed("q3", "s1",
                ErrorKind.GENERATION_FAILED, "Could not produce a valid query", List.of("Did you mean patients?")));

        mockMvc.perform(post("/v1/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"How many doctors?\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("GENERATION_FAILED"))
                .andExpect(jsonPath("$.suggestions[0]").value("Did you mean patients?"))
                .andExpect(jsonPath("$.query_id").value("q3"));
    }

    @Test
    void unavailableAndRateLimitedOutcomesMapToTheirStatuses() throws Exception {
        when(orchestrator.process(eq("first"), any())).thenReturn(new PipelineOutcome.Failed("q4", "s1",
                ErrorKind.SERVICE_UNAVAILABLE, ExecutionGuard.UNAVAILABLE_MESSAGE, List.of()));
        when(orchestrator.process(eq("second"), any())).thenReturn(new PipelineOutcome.Failed("q5", "s1",
                ErrorKind.RATE_LIMITED, "Too many requests", List.of()));

        mockMvc.perform(post("/v1/ask").contentType(MediaType.APPLICATION_JSON).content("{\"query\":\"first\"}"))
                .andExpect(status().isServiceUnavailable());
        mockMvc.perform(post("/v1/ask").contentType(MediaType.APPLICATION_JSON).content("{\"query\":\"second\"}"))
                .andExpect(status().isTooManyRequests());
    }

    @Test
    void blankQueryIsRejectedBeforeThePipeline() throws Exception {
        mockMvc.perform(post("/v1/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));

        verify(orchestrator, never()).process(any(), any());
    }

    @Test
    void malformedBodyIsInvalidInput() throws Exception {
        mockMvc.perform(post("/v1/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));
    }

    @Test
    void pipelineExceptionIsHandledByTheAdvice() throws Exception {
        when(orchestrator.process(anyString(), any())).thenThrow(
                new QueryPilotException(ErrorKind.INVALID_INPUT, "Query is too long"));

        mockMvc.perform(post("/v1/ask").contentType(MediaType.APPLICATION_JSON).content("{\"query\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Query is too long"));
    }

    @Test
    void historyListsAnsweredTurns() throws Exception {
        Query query = new Query("q1", "s9", "How many patients?", "how many patients", clock.instant(),
                QueryIntent.COUNT, 0.8, Map.of());
        conversationStore.getOrCreate("s9").append(new ConversationTurn(query, response("q1", true)),
                clock.instant());

        mockMvc.perform(get("/v1/sessions/s9/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value("s9"))
                .andExpect(jsonPath("$.turns[0].question").value("How many patients?"))
                .andExpect(jsonPath("$.turns[0].intent").value("COUNT"))
                .andExpect(jsonPath("$.turns[0].cache_hit").value(true));
    }

    @Test
    void unknownSessionHistoryIsNotFound() throws Exception {
        mockMvc.perform(get("/v1/sessions/missing/history"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void deletingSessionTwiceReportsNotFound() throws Exception {
        conversationStore.getOrCreate("s7");

        mockMvc.perform(delete("/v1/sessions/s7")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/v1/sessions/s7")).andExpect(status().isNotFound());
    }

    @Test
    void healthIsUpWithClosedCircuitAndReadableSchema() throws Exception {
        when(executionGuard.circuit()).thenReturn(new CircuitSnapshot(CircuitState.CLOSED, 0, null, 0));
        when(schemaProvider.schemaVersion()).thenReturn("v1");

        mockMvc.perform(get("/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.circuit_state").value("CLOSED"))
                .andExpect(jsonPath("$.schema_version").value("v1"));
    }

    @Test
    void healthIsDegradedWhenTheCircuitIsOpen() throws Exception {
        when(executionGuard.circuit()).thenReturn(new CircuitSnapshot(CircuitState.OPEN, 5, clock.instant(), 0));
        when(schemaProvider.schemaVersion()).thenReturn("v1");

        mockMvc.perform(get("/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.consecutive_failures").value(5));
    }

    @Test
    void healthIsDegradedWhenTheSchemaCannotBeRead() throws Exception {
        when(executionGuard.circuit()).thenReturn(new CircuitSnapshot(CircuitState.CLOSED, 0, null, 0));
        when(schemaProvider.schemaVersion()).thenThrow(
                new QueryPilotException(ErrorKind.SERVICE_UNAVAILABLE, "Schema unavailable"));

        mockMvc.perform(get("/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"));
    }

    private static QueryResponse response(String queryId, boolean cacheHit) {
        ExecutionResult result = ExecutionResult.complete(List.of("admitted"), List.of(Map.of("admitted", 2)), 4);
        return new QueryResponse(queryId, STATEMENT, result, "The answer is 2 (admitted).", 40, cacheHit,
                Map.of("generation", 12L));
    }
}
