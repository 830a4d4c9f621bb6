package com.agentcouncil.common.exception;

import com.agentcouncil.common.model.StageError;

import java.util.List;

/**
 * Root of the pipeline error taxonomy. Carries the name of the smallest unit (stage, group,
 * chain or driver) that failed.
 */
public abstract class PipelineException extends RuntimeException {

    private final String unitName;

    protected PipelineException(String unitName, String message) {
        super("[" + unitName + "] " + message);
        this.unitName = unitName;
    }

    protected PipelineException(String unitName, String message, Throwable cause) {
        super("[" + unitName + "] " + message, cause);
        this.unitName = unitName;
    }

    public String getUnitName() {
        return unitName;
    }

    public abstract ErrorType getErrorType();

    public List<StageError> getFailures() {
        return List.of();
    }

    public PipelineError toError() {
        return new PipelineError(getErrorType(), getMessage(), unitName, getFailures());
    }
}
