package com.rcatrail.exception;

public class ScenarioNotFoundException extends RcaException {

    public ScenarioNotFoundException(String scenarioId) {
        super("Scenario not found: " + scenarioId);
    }
}
