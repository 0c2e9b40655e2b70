package com.rcatrail.controller;

import com.rcatrail.exception.AmbiguousTimestampException;
import com.rcatrail.exception.MalformedRecordException;
import com.rcatrail.exception.NoRunsForScenarioException;
import com.rcatrail.exception.RunNotFoundException;
import com.rcatrail.exception.ScenarioNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain failures of one request to JSON error bodies:
 * {"error": "RUN_NOT_FOUND", "message": "..."}
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler({RunNotFoundException.class, ScenarioNotFoundException.class})
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(RuntimeException e) {
        return body(e instanceof RunNotFoundException ? "RUN_NOT_FOUND" : "SCENARIO_NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(NoRunsForScenarioException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNoRuns(NoRunsForScenarioException e) {
        return body("NO_RUNS_FOR_SCENARIO", e.getMessage());
    }

    @ExceptionHandler(AmbiguousTimestampException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleAmbiguous(AmbiguousTimestampException e) {
        log.warn("Ambiguous ordering: {}", e.getMessage());
        return body("AMBIGUOUS_TIMESTAMP", e.getMessage());
    }

    @ExceptionHandler(MalformedRecordException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleMalformed(MalformedRecordException e) {
        return body("MALFORMED_RECORD", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + ": " + f.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        return body("BAD_REQUEST", message);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException e) {
        return body("BAD_REQUEST", e.getMessage());
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
