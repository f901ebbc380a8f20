package com.chainwright.core.model;

import com.chainwright.core.agent.SecondarySuggestion;
import com.chainwright.core.qualitygate.GateReport;
import com.chainwright.core.wave.WaveDecision;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of a chain run, as handed to callers.
 *
 * @param runId                unique run id
 * @param idea                 the idea the run started from
 * @param status               lifecycle status
 * @param currentStage         the open stage; the last stage once the run completed
 * @param outputs              accepted stage outputs in chain order
 * @param context              latest project context
 * @param waveDecision         wave decision in force, {@code null} before assessment
 * @param pendingRemediation   the blocking gate report the run waits on, {@code null} if none
 * @param suggestions          agents that scored in the suggest bucket
 * @param secondarySuggestions sections that lost a region conflict
 * @param errors               non-fatal and fatal problems, in occurrence order
 * @param failureReason        why the run failed or was aborted, empty otherwise
 * @param updatedAt            when the snapshot was taken
 */
public record ChainRun(
    String runId,
    String idea,
    RunStatus status,
    StageId currentStage,
    List<StageOutput> outputs,
    ProjectContext context,
    WaveDecision waveDecision,
    GateReport pendingRemediation,
    List<AgentSuggestion> suggestions,
    List<SecondarySuggestion> secondarySuggestions,
    List<String> errors,
    String failureReason,
    Instant updatedAt
) {
    public ChainRun {
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        secondarySuggestions = secondarySuggestions == null ? List.of() : List.copyOf(secondarySuggestions);
        errors = errors == null ? List.of() : List.copyOf(errors);
        failureReason = failureReason == null ? "" : failureReason;
    }

    public boolean awaitingRemediation() {
        return status == RunStatus.IN_PROGRESS && pendingRemediation != null;
    }

    public Optional<StageOutput> output(StageId stage) {
        return outputs.stream().filter(o -> o.stage() == stage).findFirst();
    }

    /** Content of the last accepted stage, empty before the first one. */
    public String latestContent() {
        return outputs.isEmpty() ? "" : outputs.get(outputs.size() - 1).content();
    }

    public ChainRun withStatus(RunStatus newStatus, String reason) {
        return new ChainRun(runId, idea, newStatus, currentStage, outputs, context, waveDecision,
                newStatus == RunStatus.IN_PROGRESS ? pendingRemediation : null,
                suggestions, secondarySuggestions, errors, reason, Instant.now());
    }
}
