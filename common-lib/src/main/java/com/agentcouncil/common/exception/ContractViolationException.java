package com.agentcouncil.common.exception;

/**
 * A stage or gate broke its declared contract: overlapping write-sets, an undeclared write, or
 * a malformed verdict. Never retried.
 */
public class ContractViolationException extends PipelineException {

    public ContractViolationException(String unitName, String message) {
        super(unitName, message);
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.CONTRACT_VIOLATION;
    }
}
