package com.agentcouncil.orchestrator.pipeline;

import com.agentcouncil.common.context.ContextKeys;
import com.agentcouncil.common.exception.ContractViolationException;
import com.agentcouncil.common.exception.PipelineConfigurationException;
import com.agentcouncil.common.stage.Stage;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Composition-time checks run before any stage executes.
 *
 * <p>Settings and structural problems raise {@link PipelineConfigurationException}; broken
 * read/write declarations raise {@link ContractViolationException}.
 */
public final class TopologyValidator {

    static final String UNIT = "topology";
    static final String SEED_UNIT = "seed";

    private static final Set<String> RESERVED = Set.of(ContextKeys.VERDICT, ContextKeys.PRIOR_CRITIQUE);

    private TopologyValidator() {}

    public static void validate(PipelineTopology topology) {
        validateSettings(topology.settings());

        if (topology.analysts().isEmpty()) {
            throw new PipelineConfigurationException(UNIT, "analyst group has no stages");
        }
        if (topology.revision().isEmpty()) {
            throw new PipelineConfigurationException(UNIT, "revision subsequence has no stages");
        }
        if (topology.gate() == null) {
            throw new PipelineConfigurationException(UNIT, "no verdict gate configured");
        }
        validateUniqueNames(topology);
        validateDisjointWrites(topology.analysts());
        validateWriteTargets(topology);
        validateReads(topology);
    }

    /**
     * Rejects seed fields that a stage or the feedback loop owns. Runs before any stage executes;
     * {@code instrument_id} is always allowed since the driver overwrites it.
     */
    public static void validateSeed(PipelineTopology topology, Set<String> seedKeys) {
        Set<String> owned = new HashSet<>(RESERVED);
        for (Stage stage : allStages(topology)) {
            owned.addAll(stage.writes());
        }
        Set<String> clashes = new TreeSet<>(seedKeys);
        clashes.retainAll(owned);
        if (!clashes.isEmpty()) {
            throw new ContractViolationException(SEED_UNIT,
                "seed must not provide " + clashes + "; these fields are written by the pipeline");
        }
    }

    private static void validateSettings(PipelineSettings settings) {
        if (settings == null) {
            throw new PipelineConfigurationException(UNIT, "no pipeline settings");
        }
        if (settings.maxAttempts() <= 0) {
            throw new PipelineConfigurationException(UNIT,
                "max attempts must be > 0, was " + settings.maxAttempts());
        }
        Duration timeout = settings.stageTimeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new PipelineConfigurationException(UNIT, "stage timeout must be positive, was " + timeout);
        }
    }

    private static void validateUniqueNames(PipelineTopology topology) {
        Set<String> seen = new HashSet<>();
        for (Stage stage : allStages(topology)) {
            if (!seen.add(stage.stageName())) {
                throw new PipelineConfigurationException(UNIT, "duplicate stage name '" + stage.stageName() + "'");
            }
            Duration override = stage.timeout();
            if (override != null && (override.isZero() || override.isNegative())) {
                throw new PipelineConfigurationException(stage.stageName(),
                    "timeout override must be positive, was " + override);
            }
        }
    }

    private static void validateDisjointWrites(List<Stage> group) {
        Map<String, String> writerByKey = new HashMap<>();
        for (Stage stage : group) {
            for (String key : stage.writes()) {
                String other = writerByKey.putIfAbsent(key, stage.stageName());
                if (other != null) {
                    throw new ContractViolationException(UNIT,
                        "fan-out stages " + other + " and " + stage.stageName() + " both declare '" + key + "'");
                }
            }
        }
    }

    private static void validateWriteTargets(PipelineTopology topology) {
        Stage gate = topology.gate();
        if (!gate.writes().equals(Set.of(ContextKeys.VERDICT))) {
            throw new ContractViolationException(gate.stageName(),
                "a verdict gate must write exactly '" + ContextKeys.VERDICT + "', declares "
                    + new TreeSet<>(gate.writes()));
        }
        for (Stage stage : topology.analysts()) {
            rejectReserved(stage);
        }
        for (Stage stage : topology.chain()) {
            rejectReserved(stage);
        }
        boolean decides = false;
        for (Stage stage : topology.revision()) {
            rejectReserved(stage);
            decides |= stage.writes().contains(ContextKeys.FINAL_DECISION);
        }
        if (!decides) {
            throw new ContractViolationException(UNIT,
                "no revision stage declares '" + ContextKeys.FINAL_DECISION + "'");
        }
    }

    private static void rejectReserved(Stage stage) {
        for (String key : stage.writes()) {
            if (RESERVED.contains(key)) {
                throw new ContractViolationException(stage.stageName(),
                    "'" + key + "' is written by the feedback loop and cannot be declared by a stage");
            }
        }
    }

    /** Every declared read must be produced by the seed or a stage that runs earlier. */
    private static void validateReads(PipelineTopology topology) {
        Set<String> available = new HashSet<>(topology.seedKeys());
        available.add(ContextKeys.INSTRUMENT_ID);

        for (Stage stage : topology.analysts()) {
            requireReads(stage, available);
        }
        topology.analysts().forEach(s -> available.addAll(s.writes()));

        for (Stage stage : topology.chain()) {
            requireReads(stage, available);
            available.addAll(stage.writes());
        }

        // revision stages may consult the critique and the output of a previous attempt
        available.add(ContextKeys.PRIOR_CRITIQUE);
        topology.revision().forEach(s -> available.addAll(s.writes()));
        for (Stage stage : topology.revision()) {
            requireReads(stage, available);
        }
        requireReads(topology.gate(), available);
    }

    private static void requireReads(Stage stage, Set<String> available) {
        Set<String> missing = new TreeSet<>(stage.reads());
        missing.removeAll(available);
        if (!missing.isEmpty()) {
            throw new ContractViolationException(stage.stageName(),
                "reads " + missing + " which no upstream stage or seed provides");
        }
    }

    private static List<Stage> allStages(PipelineTopology topology) {
        List<Stage> all = new ArrayList<>();
        all.addAll(topology.analysts());
        all.addAll(topology.chain());
        all.addAll(topology.revision());
        all.add(topology.gate());
        return all;
    }
}
