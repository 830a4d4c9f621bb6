package com.agentcouncil.orchestrator.feedback;

/**
 * States of the decision feedback loop.
 *
 * <ul>
 *   <li>{@link #RUNNING}   — decision stage and gate are being (re-)executed</li>
 *   <li>{@link #ACCEPTED}  — terminal; the gate accepted the decision</li>
 *   <li>{@link #EXHAUSTED} — terminal; the gate still asked for revision at the last allowed
 *       attempt, and the last decision is returned unverified</li>
 * </ul>
 */
public enum FeedbackState {
    RUNNING,
    ACCEPTED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
