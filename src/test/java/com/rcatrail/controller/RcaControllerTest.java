package com.rcatrail.controller;

import com.rcatrail.dto.AuditTrailResponse;
import com.rcatrail.exception.AmbiguousTimestampException;
import com.rcatrail.exception.NoRunsForScenarioException;
import com.rcatrail.exception.RunNotFoundException;
import com.rcatrail.exception.ScenarioNotFoundException;
import com.rcatrail.model.EventType;
import com.rcatrail.model.RankedCount;
import com.rcatrail.service.BatchProcessor;
import com.rcatrail.service.RcaQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Request mapping and error bodies of the RCA API, without a Spring context.
 */
@ExtendWith(MockitoExtension.class)
class RcaControllerTest {

    @Mock private RcaQueryService queryService;
    @Mock private BatchProcessor batchProcessor;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new RcaController(queryService), new BatchController(batchProcessor))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Audit trail parses dates and event type wire names")
    void auditTrail_parsesParameters() throws Exception {
        when(queryService.auditTrail(eq("s-1"), any(), any(), any())).thenReturn(
                AuditTrailResponse.builder().scenarioId("s-1").eventCount(0).events(List.of()).build());

        mockMvc.perform(get("/api/v1/rca/scenario/s-1/audit-trail")
                        .param("start", "2026-02-01")
                        .param("end", "2026-02-11")
                        .param("eventTypes", "run_failed,input_change"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scenarioId").value("s-1"));

        verify(queryService).auditTrail("s-1", LocalDate.of(2026, 2, 1), LocalDate.of(2026, 2, 11),
                EnumSet.of(EventType.RUN_FAILED, EventType.INPUT_CHANGE));
    }

    @Test
    @DisplayName("Unknown event type is a bad request")
    void unknownEventType_isBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/rca/scenario/s-1/audit-trail").param("eventTypes", "bogus"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    @DisplayName("Missing run and scenario map to 404 with distinct codes")
    void notFound_errors() throws Exception {
        when(queryService.runContext("s-1", "R9")).thenThrow(new RunNotFoundException("s-1", "R9"));
        when(queryService.runs("nope")).thenThrow(new ScenarioNotFoundException("nope"));
        when(queryService.runContext("s-2", "R1")).thenThrow(new NoRunsForScenarioException("s-2"));

        mockMvc.perform(get("/api/v1/rca/scenario/s-1/runs/R9/context"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("RUN_NOT_FOUND"));
        mockMvc.perform(get("/api/v1/rca/scenario/nope/runs"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("SCENARIO_NOT_FOUND"));
        mockMvc.perform(get("/api/v1/rca/scenario/s-2/runs/R1/context"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NO_RUNS_FOR_SCENARIO"));
    }

    @Test
    @DisplayName("Ambiguous ordering is unprocessable")
    void ambiguous_isUnprocessable() throws Exception {
        when(queryService.compareRuns("s-1", "R1", "R2"))
                .thenThrow(new AmbiguousTimestampException("R1 and R2 started at the same instant"));

        mockMvc.perform(get("/api/v1/rca/scenario/s-1/run-comparison").param("runA", "R1").param("runB", "R2"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("AMBIGUOUS_TIMESTAMP"));
    }

    @Test
    @DisplayName("Insights pass window and limit through")
    void insights_passParameters() throws Exception {
        when(queryService.topErrorCategories(7, 5)).thenReturn(List.of(new RankedCount("timeout", 3)));

        mockMvc.perform(get("/api/v1/rca/insights/error-categories").param("days", "7").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].key").value("timeout"))
                .andExpect(jsonPath("$[0].count").value(3));
    }

    @Test
    @DisplayName("Batch without id is rejected before processing")
    void batchWithoutId_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/rca/batches")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"runs\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("batchId: batchId is required"));

        verifyNoInteractions(batchProcessor);
    }
}
