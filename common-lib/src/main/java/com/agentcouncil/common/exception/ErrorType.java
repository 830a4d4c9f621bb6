package com.agentcouncil.common.exception;

public enum ErrorType {
    CONTRACT_VIOLATION,
    STAGE_FAILURE,
    CONFIGURATION
}
