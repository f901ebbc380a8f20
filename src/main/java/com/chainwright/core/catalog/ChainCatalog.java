package com.chainwright.core.catalog;

import com.chainwright.core.agent.AgentDescriptor;
import com.chainwright.core.agent.AgentKind;
import com.chainwright.core.model.StageId;
import com.chainwright.core.qualitygate.QualityGate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validated, immutable view of the stage, agent and gate configuration.
 * <p>
 * Construction fails with {@link CatalogException} when a stage references an unknown gate,
 * a gate depends on an unknown gate, gate dependencies form a cycle, an agent kind is
 * declared twice, or a stage's {@code nextStage} does not move strictly forward.
 */
public class ChainCatalog {

    private final Map<StageId, StageDefinition> stages;
    private final List<AgentDescriptor> descriptors;
    private final Map<String, QualityGate> gates;
    private final Map<StageId, List<String>> adaptiveGates;

    public ChainCatalog(List<StageDefinition> stages,
                        List<AgentDescriptor> descriptors,
                        List<QualityGate> gates,
                        Map<StageId, List<String>> adaptiveGates) {
        var gateMap = new LinkedHashMap<String, QualityGate>();
        for (var gate : gates) {
            if (gateMap.put(gate.id(), gate) != null) {
                throw new CatalogException("Duplicate quality gate id: " + gate.id());
            }
        }
        this.gates = Collections.unmodifiableMap(gateMap);

        var stageMap = new EnumMap<StageId, StageDefinition>(StageId.class);
        for (var stage : stages) {
            if (stageMap.put(stage.id(), stage) != null) {
                throw new CatalogException("Duplicate stage definition: " + stage.id());
            }
        }
        this.stages = Collections.unmodifiableMap(stageMap);

        var seenKinds = new HashSet<AgentKind>();
        for (var d : descriptors) {
            if (!seenKinds.add(d.kind())) {
                throw new CatalogException("Duplicate agent descriptor: " + d.kind());
            }
        }
        var sorted = new ArrayList<>(descriptors);
        sorted.sort(Comparator.comparingInt(AgentDescriptor::priority)
                .thenComparing(AgentDescriptor::kind));
        this.descriptors = List.copyOf(sorted);

        var adaptive = new EnumMap<StageId, List<String>>(StageId.class);
        if (adaptiveGates != null) {
            adaptiveGates.forEach((stage, ids) -> adaptive.put(stage, List.copyOf(ids)));
        }
        this.adaptiveGates = Collections.unmodifiableMap(adaptive);

        validate();
    }

    private void validate() {
        if (!stages.containsKey(StageId.first())) {
            throw new CatalogException("Catalog must define the first stage " + StageId.first());
        }
        for (var stage : stages.values()) {
            for (String gateId : stage.allGates()) {
                requireGate(gateId, "stage " + stage.id());
            }
            if (stage.nextStage() != null) {
                if (stage.nextStage().ordinal() <= stage.id().ordinal()) {
                    throw new CatalogException("Stage " + stage.id() + " must advance forward, not to "
                            + stage.nextStage());
                }
                if (!stages.containsKey(stage.nextStage())) {
                    throw new CatalogException("Stage " + stage.id() + " points to undefined stage "
                            + stage.nextStage());
                }
            }
        }
        for (var entry : adaptiveGates.entrySet()) {
            for (String gateId : entry.getValue()) {
                requireGate(gateId, "adaptive mapping for " + entry.getKey());
            }
        }
        for (var gate : gates.values()) {
            for (String dep : gate.dependsOn()) {
                requireGate(dep, "gate " + gate.id());
            }
        }
        for (var gate : gates.values()) {
            detectCycle(gate.id(), new HashSet<>(), new HashSet<>());
        }
    }

    private void requireGate(String gateId, String referencedBy) {
        if (!gates.containsKey(gateId)) {
            throw new CatalogException("Unknown quality gate '" + gateId + "' referenced by " + referencedBy);
        }
    }

    private void detectCycle(String gateId, Set<String> visiting, Set<String> done) {
        if (done.contains(gateId)) return;
        if (!visiting.add(gateId)) {
            throw new CatalogException("Quality gate dependency cycle through '" + gateId + "'");
        }
        for (String dep : gates.get(gateId).dependsOn()) {
            detectCycle(dep, visiting, done);
        }
        visiting.remove(gateId);
        done.add(gateId);
    }

    public StageDefinition stage(StageId id) {
        var stage = stages.get(id);
        if (stage == null) {
            throw new CatalogException("No stage definition for " + id);
        }
        return stage;
    }

    public Map<StageId, StageDefinition> stages() {
        return stages;
    }

    /** Descriptors in priority order (lower priority value first). */
    public List<AgentDescriptor> descriptors() {
        return descriptors;
    }

    public Optional<AgentDescriptor> descriptor(AgentKind kind) {
        return descriptors.stream().filter(d -> d.kind() == kind).findFirst();
    }

    public QualityGate gate(String id) {
        var gate = gates.get(id);
        if (gate == null) {
            throw new CatalogException("Unknown quality gate: " + id);
        }
        return gate;
    }

    public Map<String, QualityGate> gates() {
        return gates;
    }

    public List<QualityGate> gates(List<String> ids) {
        return ids.stream().map(this::gate).toList();
    }

    /**
     * Gate subset from the static stage-to-gates mapping, falling back to the stage's own gates
     * when the stage has no adaptive entry.
     */
    public List<String> adaptiveGatesFor(StageId stage) {
        var ids = adaptiveGates.get(stage);
        return ids != null ? ids : stage(stage).allGates();
    }

    /** Stages reachable from the first stage, in chain order. */
    public List<StageId> chainOrder() {
        var order = new ArrayList<StageId>();
        StageId current = StageId.first();
        while (current != null) {
            order.add(current);
            current = stage(current).nextStage();
        }
        return order;
    }
}
