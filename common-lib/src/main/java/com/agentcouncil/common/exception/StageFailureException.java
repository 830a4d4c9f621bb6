package com.agentcouncil.common.exception;

import com.agentcouncil.common.model.StageError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One or more stages of a unit (a fan-out group or a chain) failed. A group failure lists
 * every member failure it observed, not just the first.
 */
public class StageFailureException extends PipelineException {

    private final List<StageError> failures;

    public StageFailureException(String unitName, List<StageError> failures) {
        super(unitName, describe(failures));
        this.failures = List.copyOf(failures);
    }

    public StageFailureException(String unitName, StageError failure) {
        this(unitName, List.of(failure));
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.STAGE_FAILURE;
    }

    @Override
    public List<StageError> getFailures() {
        return failures;
    }

    private static String describe(List<StageError> failures) {
        return failures.size() + " stage failure(s): "
            + failures.stream().map(StageError::toString).collect(Collectors.joining("; "));
    }
}
