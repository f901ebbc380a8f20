package com.chainwright.core.state;

import com.chainwright.core.agent.SecondarySuggestion;
import com.chainwright.core.model.AgentSuggestion;
import com.chainwright.core.model.ProjectContext;
import com.chainwright.core.model.RunStatus;
import com.chainwright.core.model.StageId;
import com.chainwright.core.model.StageOutput;
import com.chainwright.core.model.UserPreferences;
import com.chainwright.core.qualitygate.GateExecutionStrategy;
import com.chainwright.core.qualitygate.GateReport;
import com.chainwright.core.wave.WaveDecision;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state of one chain run.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. The run-wide fields survive
 * from one stage invocation to the next; the {@code stage*} fields describe the stage that is
 * currently open and are overwritten at every stage entry. Outputs, suggestions and errors use
 * appender channels so each node adds entries without replacing earlier ones.
 */
public class ChainState extends AgentState {

    /** How the last graph invocation ended. */
    public enum StageOutcome {
        NONE,
        ADVANCED,
        REMEDIATION,
        ABORTED,
        FAILED
    }

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Run-wide scalar channels ─────────────────────────────────
        Map.entry("runId",                  Channels.base(() -> "")),
        Map.entry("idea",                   Channels.base(() -> "")),
        Map.entry("projectRoot",            Channels.base(() -> "")),
        Map.entry("status",                 Channels.base(() -> RunStatus.IN_PROGRESS.name())),
        Map.entry("currentStage",           Channels.base(() -> StageId.first().name())),
        Map.entry("gateStrategy",           Channels.base(() -> "")),
        Map.entry("preferences",            Channels.base((Reducer<UserPreferences>) null)),
        Map.entry("projectContext",         Channels.base((Reducer<ProjectContext>) null)),
        Map.entry("waveDecision",           Channels.base((Reducer<WaveDecision>) null)),
        Map.entry("pendingWaveDecision",    Channels.base((Reducer<WaveDecision>) null)),
        Map.entry("failureReason",          Channels.base(() -> "")),

        // ── Stage-scoped channels ────────────────────────────────────
        Map.entry("stageStartedAt",         Channels.base(() -> 0L)),
        Map.entry("spawnAgents",            Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("stageDraft",             Channels.base(() -> "")),
        Map.entry("stageContributors",      Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("stageConfidenceReduced", Channels.base(() -> false)),
        Map.entry("stageRemediated",        Channels.base(() -> false)),
        Map.entry("checkpointBlocked",      Channels.base(() -> false)),
        Map.entry("remediationContent",     Channels.base(() -> "")),
        Map.entry("gateReport",             Channels.base((Reducer<GateReport>) null)),
        Map.entry("stageOutcome",           Channels.base(() -> StageOutcome.NONE.name())),

        // ── Appender channels (list accumulation) ────────────────────
        Map.entry("outputs",                Channels.appender(ArrayList::new)),
        Map.entry("suggestions",            Channels.appender(ArrayList::new)),
        Map.entry("secondarySuggestions",   Channels.appender(ArrayList::new)),
        Map.entry("errors",                 Channels.appender(ArrayList::new))
    );

    public ChainState(Map<String, Object> initData) {
        super(initData);
    }

    // ── Run-wide accessors ───────────────────────────────────────────

    public String runId() {
        return this.<String>value("runId").orElse("");
    }

    public String idea() {
        return this.<String>value("idea").orElse("");
    }

    public String projectRoot() {
        return this.<String>value("projectRoot").orElse("");
    }

    public boolean hasProjectRoot() {
        return !projectRoot().isBlank();
    }

    public RunStatus status() {
        return RunStatus.valueOf(this.<String>value("status").orElse(RunStatus.IN_PROGRESS.name()));
    }

    public StageId currentStage() {
        return StageId.valueOf(this.<String>value("currentStage").orElse(StageId.first().name()));
    }

    /**
     * The caller's gate strategy override, empty for the configured default.
     */
    public Optional<GateExecutionStrategy> gateStrategy() {
        String raw = this.<String>value("gateStrategy").orElse("");
        return raw.isBlank() ? Optional.empty() : Optional.of(GateExecutionStrategy.valueOf(raw));
    }

    public UserPreferences preferences() {
        return this.<UserPreferences>value("preferences").orElse(UserPreferences.none());
    }

    public ProjectContext projectContext() {
        return this.<ProjectContext>value("projectContext").orElse(ProjectContext.empty());
    }

    public Optional<WaveDecision> waveDecision() {
        return this.value("waveDecision");
    }

    public Optional<WaveDecision> pendingWaveDecision() {
        return this.value("pendingWaveDecision");
    }

    public String failureReason() {
        return this.<String>value("failureReason").orElse("");
    }

    // ── Stage-scoped accessors ───────────────────────────────────────

    public long stageStartedAt() {
        return this.<Long>value("stageStartedAt").orElse(0L);
    }

    public List<String> spawnAgents() {
        return this.<List<String>>value("spawnAgents").orElse(List.of());
    }

    public String stageDraft() {
        return this.<String>value("stageDraft").orElse("");
    }

    public List<String> stageContributors() {
        return this.<List<String>>value("stageContributors").orElse(List.of());
    }

    public boolean stageConfidenceReduced() {
        return this.<Boolean>value("stageConfidenceReduced").orElse(false);
    }

    public boolean stageRemediated() {
        return this.<Boolean>value("stageRemediated").orElse(false);
    }

    public boolean checkpointBlocked() {
        return this.<Boolean>value("checkpointBlocked").orElse(false);
    }

    public String remediationContent() {
        return this.<String>value("remediationContent").orElse("");
    }

    public boolean isRemediating() {
        return !remediationContent().isBlank();
    }

    public Optional<GateReport> gateReport() {
        return this.value("gateReport");
    }

    public StageOutcome stageOutcome() {
        return StageOutcome.valueOf(this.<String>value("stageOutcome").orElse(StageOutcome.NONE.name()));
    }

    // ── Appender accessors ───────────────────────────────────────────

    public List<StageOutput> outputs() {
        return this.<List<StageOutput>>value("outputs").orElse(List.of());
    }

    public List<AgentSuggestion> suggestions() {
        return this.<List<AgentSuggestion>>value("suggestions").orElse(List.of());
    }

    public List<SecondarySuggestion> secondarySuggestions() {
        return this.<List<SecondarySuggestion>>value("secondarySuggestions").orElse(List.of());
    }

    public List<String> errors() {
        return this.<List<String>>value("errors").orElse(List.of());
    }
}
