package com.chainwright.core.qualitygate;

import com.chainwright.core.catalog.StageDefinition;
import com.chainwright.core.model.StageOutput;

import java.util.List;

/**
 * What a gate checks: one stage's content plus the material it should trace back to.
 */
public record GateInput(
    StageDefinition stage,
    String idea,
    String content,
    List<StageOutput> previousOutputs
) {
    public GateInput {
        idea = idea == null ? "" : idea;
        content = content == null ? "" : content;
        previousOutputs = previousOutputs == null ? List.of() : List.copyOf(previousOutputs);
    }
}
