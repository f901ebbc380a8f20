package com.chainwright.core.catalog;

import com.chainwright.core.model.StageId;

import java.util.ArrayList;
import java.util.List;

/**
 * Static definition of one chain stage.
 *
 * @param id               the stage
 * @param requiredInputs   names of the inputs the stage consumes ("idea" or an earlier stage id)
 * @param outputFormat     output format tag, currently always "markdown"
 * @param requiredSections section headings the output must contain
 * @param requiredGates    gates that block the transition on failure
 * @param optionalGates    gates that only warn
 * @param agentPolicy      agent spawning policy
 * @param nextStage        the following stage, {@code null} for the last one
 * @param instructions     stage-specific prompt instructions
 */
public record StageDefinition(
    StageId id,
    List<String> requiredInputs,
    String outputFormat,
    List<String> requiredSections,
    List<String> requiredGates,
    List<String> optionalGates,
    AgentPolicy agentPolicy,
    StageId nextStage,
    String instructions
) {
    public StageDefinition {
        if (id == null) {
            throw new IllegalArgumentException("Stage definition requires an id");
        }
        requiredInputs = requiredInputs == null ? List.of() : List.copyOf(requiredInputs);
        outputFormat = outputFormat == null || outputFormat.isBlank() ? "markdown" : outputFormat;
        requiredSections = requiredSections == null ? List.of() : List.copyOf(requiredSections);
        requiredGates = requiredGates == null ? List.of() : List.copyOf(requiredGates);
        optionalGates = optionalGates == null ? List.of() : List.copyOf(optionalGates);
        agentPolicy = agentPolicy == null ? AgentPolicy.none() : agentPolicy;
        instructions = instructions == null ? "" : instructions;
    }

    /** Required gates followed by optional gates. */
    public List<String> allGates() {
        var all = new ArrayList<String>(requiredGates);
        for (String g : optionalGates) {
            if (!all.contains(g)) all.add(g);
        }
        return all;
    }

    public boolean isLast() {
        return nextStage == null;
    }
}
