package com.rcatrail.controller;

import com.rcatrail.dto.AuditTrailResponse;
import com.rcatrail.model.DailySuccessRate;
import com.rcatrail.model.ErrorSummary;
import com.rcatrail.model.EventType;
import com.rcatrail.model.RankedCount;
import com.rcatrail.model.Run;
import com.rcatrail.model.RunComparison;
import com.rcatrail.model.Session;
import com.rcatrail.model.UserVelocity;
import com.rcatrail.service.RcaQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only root-cause-analysis API.
 *
 * GET /api/v1/rca/scenario/{scenarioId}/audit-trail?start=2026-02-01&end=2026-02-11&eventTypes=run_failed,input_change
 * GET /api/v1/rca/scenario/{scenarioId}/runs/{runId}/context
 * GET /api/v1/rca/user/{userId}/sessions?gapMinutes=30
 * GET /api/v1/rca/insights/error-categories?days=7&limit=5
 *
 * Dates are UTC calendar days, both ends inclusive.
 */
@RestController
@RequestMapping("/api/v1/rca")
@RequiredArgsConstructor
public class RcaController {

    private final RcaQueryService queryService;

    // --- Scenario views ---

    @GetMapping("/scenario/{scenarioId}/audit-trail")
    public AuditTrailResponse auditTrail(
            @PathVariable String scenarioId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(required = false) List<String> eventTypes) {
        return queryService.auditTrail(scenarioId, start, end, parseTypes(eventTypes));
    }

    @GetMapping("/scenario/{scenarioId}/runs")
    public List<Run> runs(@PathVariable String scenarioId) {
        return queryService.runs(scenarioId);
    }

    @GetMapping("/scenario/{scenarioId}/runs/{runId}/context")
    public RunComparison runContext(@PathVariable String scenarioId, @PathVariable String runId) {
        return queryService.runContext(scenarioId, runId);
    }

    @GetMapping("/scenario/{scenarioId}/run-comparison")
    public RunComparison runComparison(@PathVariable String scenarioId,
                                       @RequestParam String runA,
                                       @RequestParam String runB) {
        return queryService.compareRuns(scenarioId, runA, runB);
    }

    @GetMapping("/scenario/{scenarioId}/error-summary")
    public ErrorSummary errorSummary(@PathVariable String scenarioId) {
        return queryService.errorSummary(scenarioId);
    }

    // --- User journey ---

    @GetMapping("/user/{userId}/sessions")
    public List<Session> sessions(
            @PathVariable String userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(required = false) Integer gapMinutes) {
        return queryService.sessions(userId, start, end, gapMinutes);
    }

    @GetMapping("/user/{userId}/velocity")
    public UserVelocity velocity(@PathVariable String userId, @RequestParam(required = false) Integer days) {
        return queryService.velocity(userId, days);
    }

    // --- Reliability insights ---

    @GetMapping("/insights/error-categories")
    public List<RankedCount> errorCategories(@RequestParam(required = false) Integer days,
                                             @RequestParam(required = false) Integer limit) {
        return queryService.topErrorCategories(days, limit);
    }

    @GetMapping("/insights/failing-nodes")
    public List<RankedCount> failingNodes(@RequestParam(required = false) Integer days,
                                          @RequestParam(required = false) Integer limit) {
        return queryService.topFailingNodes(days, limit);
    }

    @GetMapping("/insights/success-rate")
    public List<DailySuccessRate> successRate(@RequestParam(required = false) Integer days) {
        return queryService.successRate(days);
    }

    private static Set<EventType> parseTypes(List<String> raw) {
        Set<EventType> types = EnumSet.noneOf(EventType.class);
        if (raw != null) {
            raw.stream()
                    .filter(s -> !s.isBlank())
                    .map(s -> EventType.fromWireName(s.trim()))
                    .forEach(types::add);
        }
        return types;
    }
}
