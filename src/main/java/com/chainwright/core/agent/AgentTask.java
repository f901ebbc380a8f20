package com.chainwright.core.agent;

import com.chainwright.core.catalog.StageDefinition;
import com.chainwright.core.model.StageOutput;
import com.chainwright.core.wave.WavePhase;

import java.util.List;

/**
 * The work assigned to the agents (and the orchestrator) for one stage, or one wave of a stage.
 *
 * @param runId            owning run
 * @param stage            the stage being produced
 * @param idea             the user's original idea
 * @param previousOutputs  accepted outputs of earlier stages, in chain order
 * @param wavePhase        current wave, {@code null} for single-pass execution
 * @param draft            the stage content produced by earlier waves, empty for the first wave
 */
public record AgentTask(
    String runId,
    StageDefinition stage,
    String idea,
    List<StageOutput> previousOutputs,
    WavePhase wavePhase,
    String draft
) {
    public AgentTask {
        previousOutputs = previousOutputs == null ? List.of() : List.copyOf(previousOutputs);
        draft = draft == null ? "" : draft;
    }

    public AgentTask forWave(WavePhase phase, String currentDraft) {
        return new AgentTask(runId, stage, idea, previousOutputs, phase, currentDraft);
    }

    /**
     * Text the scoring engine and capability calls work from: the idea plus the latest accepted output.
     */
    public String workingText() {
        if (previousOutputs.isEmpty()) return idea;
        return idea + "\n\n" + previousOutputs.get(previousOutputs.size() - 1).content();
    }
}
