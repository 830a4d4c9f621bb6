package com.agentcouncil.orchestrator.feedback;

import com.agentcouncil.common.model.Verdict;

import java.util.ArrayList;
import java.util.List;

/**
 * Attempt counter and verdict history of one feedback loop. Owned by a single
 * {@link FeedbackController} run and accessed strictly sequentially.
 */
public final class RetryState {

    private final int maxAttempts;
    private final List<Verdict> history = new ArrayList<>();
    private int attempt;
    private FeedbackState state = FeedbackState.RUNNING;

    public RetryState(int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0, was " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
    }

    /** Starts the next attempt and returns its 1-based number. */
    public int beginAttempt() {
        if (state.isTerminal()) {
            throw new IllegalStateException("loop already terminated in state " + state);
        }
        if (attempt >= maxAttempts) {
            throw new IllegalStateException("attempt " + (attempt + 1) + " exceeds max " + maxAttempts);
        }
        return ++attempt;
    }

    /**
     * Records the verdict of the current attempt and moves to the next state: ACCEPTED on
     * accept, EXHAUSTED on revise at the last attempt, otherwise RUNNING.
     */
    public FeedbackState record(Verdict verdict) {
        if (history.size() != attempt - 1) {
            throw new IllegalStateException("verdict for attempt " + attempt + " already recorded");
        }
        history.add(verdict);
        if (verdict.isAccepted()) {
            state = FeedbackState.ACCEPTED;
        } else if (attempt == maxAttempts) {
            state = FeedbackState.EXHAUSTED;
        }
        return state;
    }

    public int attempt() {
        return attempt;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public FeedbackState state() {
        return state;
    }

    public List<Verdict> history() {
        return List.copyOf(history);
    }
}
