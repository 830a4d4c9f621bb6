package com.agentcouncil.common.exception;

/** Invalid topology or settings, detected when the driver is built. */
public class PipelineConfigurationException extends PipelineException {

    public PipelineConfigurationException(String unitName, String message) {
        super(unitName, message);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.CONFIGURATION;
    }
}
