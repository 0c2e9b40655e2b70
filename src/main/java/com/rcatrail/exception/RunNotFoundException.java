package com.rcatrail.exception;

import lombok.Getter;

@Getter
public class RunNotFoundException extends RcaException {

    private final String runId;

    public RunNotFoundException(String scenarioId, String runId) {
        super("Run not found: " + runId + " (scenario " + scenarioId + ")");
        this.runId = runId;
    }
}
