package com.agentcouncil.common.model;

public enum VerdictOutcome {
    ACCEPT,
    REVISE
}
