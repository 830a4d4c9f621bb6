package com.agentcouncil.common.context;

import com.agentcouncil.common.exception.ContractViolationException;
import com.agentcouncil.common.model.StageResult;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owner of the shared state for a single pipeline run.
 *
 * <p>Each merge publishes a new {@link PipelineContext} version; previously returned snapshots
 * are left untouched. Merges are issued only at stage and group boundaries by the driver, so
 * they never overlap and the store needs no locking beyond publishing the current version.
 */
public final class ContextStore {

    private volatile PipelineContext current;

    public ContextStore(Map<String, Object> seed) {
        this.current = new PipelineContext(0, seed);
    }

    public PipelineContext snapshot() {
        return current;
    }

    /** Total overwrite per key: keys in {@code updates} replace earlier values. */
    public PipelineContext merge(Map<String, Object> updates) {
        Map<String, Object> next = new LinkedHashMap<>(current.fields());
        next.putAll(updates);
        current = new PipelineContext(current.version() + 1, next);
        return current;
    }

    /**
     * Merges the outputs of one fan-out group as a single version.
     *
     * <p>Results are applied in the order given. Two results writing the same key break the
     * disjoint write-set contract, and the merge fails without publishing anything.
     *
     * @throws ContractViolationException when two results share a key or a result is a failure
     */
    public PipelineContext mergeGroup(String groupName, List<StageResult> results) {
        Map<String, Object> combined = new LinkedHashMap<>();
        Map<String, String> writerByKey = new HashMap<>();
        for (StageResult result : results) {
            if (!result.succeeded()) {
                throw new ContractViolationException(groupName,
                    "cannot merge failed stage " + result.stageName());
            }
            for (Map.Entry<String, Object> entry : result.updates().entrySet()) {
                String previousWriter = writerByKey.putIfAbsent(entry.getKey(), result.stageName());
                if (previousWriter != null) {
                    throw new ContractViolationException(groupName,
                        "stages " + previousWriter + " and " + result.stageName()
                            + " both wrote '" + entry.getKey() + "'");
                }
                combined.put(entry.getKey(), entry.getValue());
            }
        }
        return merge(combined);
    }
}
