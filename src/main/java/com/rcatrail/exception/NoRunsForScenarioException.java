package com.rcatrail.exception;

import lombok.Getter;

@Getter
public class NoRunsForScenarioException extends RcaException {

    private final String scenarioId;

    public NoRunsForScenarioException(String scenarioId) {
        super("Scenario has no runs: " + scenarioId);
        this.scenarioId = scenarioId;
    }
}
