package com.agentcouncil.common.model;

/**
 * Classification of a failed stage invocation.
 *
 * <ul>
 *   <li>{@link #ERROR}    : the stage raised an error or returned a failure</li>
 *   <li>{@link #TIMEOUT}  : the stage exceeded its time budget</li>
 *   <li>{@link #CANCELLED}: a sibling in the same fan-out group failed first</li>
 * </ul>
 */
public enum FailureKind {
    ERROR,
    TIMEOUT,
    CANCELLED
}
