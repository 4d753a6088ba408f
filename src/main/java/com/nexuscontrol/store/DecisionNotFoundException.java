package com.nexuscontrol.store;

public class DecisionNotFoundException extends RuntimeException {

    public DecisionNotFoundException(String decisionId) {
        super("Decision not found: " + decisionId);
    }
}
