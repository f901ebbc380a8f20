package com.chainwright.core.nodes;

import com.chainwright.core.analyzer.ContextAnalyzer;
import com.chainwright.core.events.ChainEvent;
import com.chainwright.core.events.EventBus;
import com.chainwright.core.metrics.ChainMetrics;
import com.chainwright.core.model.ProjectContext;
import com.chainwright.core.model.StageId;
import com.chainwright.core.wave.WaveDecision;
import com.chainwright.core.wave.WaveModeAssessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;

/**
 * Re-derives the project context at stage entries and wave checkpoints, and re-runs the wave
 * assessment when a domain score moved past the configured delta.
 * <p>
 * A flipped strategy is reported as a wave miscalculation and handed back as the pending
 * decision; callers apply it at the next stage entry, never in the middle of a stage.
 */
@Component
public class StageContextRefresher {

    private static final Logger log = LoggerFactory.getLogger(StageContextRefresher.class);

    /**
     * @param context     the context to continue with
     * @param reassessed  a new decision whose strategy differs from the current one, or {@code null}
     */
    public record Refresh(ProjectContext context, WaveDecision reassessed) {
        public boolean changed(ProjectContext previous) {
            return context.version() != previous.version();
        }
    }

    private final ContextAnalyzer analyzer;
    private final WaveModeAssessor assessor;
    private final EventBus eventBus;
    private final ChainMetrics metrics;

    public StageContextRefresher(ContextAnalyzer analyzer, WaveModeAssessor assessor,
                                 EventBus eventBus, ChainMetrics metrics) {
        this.analyzer = analyzer;
        this.assessor = assessor;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * @throws com.chainwright.core.analyzer.ContextAnalysisException if the root can no longer be analysed
     */
    public Refresh refresh(String runId, StageId stage, String idea, Path root,
                           ProjectContext previous, WaveDecision current) {
        var fresh = analyzer.reanalyze(root, previous);
        if (fresh.version() == previous.version()) {
            log.debug("Context of run {} unchanged at version {}", runId, previous.version());
            return new Refresh(previous, null);
        }
        double delta = fresh.maxDomainDelta(previous);
        log.info("Context of run {} re-derived: version {} -> {}, max domain delta {}",
                runId, previous.version(), fresh.version(), String.format("%.3f", delta));

        if (current == null || !assessor.needsReassessment(previous, fresh)) {
            return new Refresh(fresh, null);
        }

        var next = assessor.assess(idea, fresh);
        metrics.recordWaveDecision(next.strategy().name(), next.total());
        eventBus.publish(ChainEvent.of("wave.assessed", runId, stage.name(), Map.of(
                "score", next.total(),
                "strategy", next.strategy().name(),
                "contextVersion", fresh.version(),
                "reassessment", true)));

        if (next.strategy() == current.strategy()) {
            return new Refresh(fresh, null);
        }
        log.warn("Wave miscalculation for run {}: strategy {} -> {} after context moved by {}; applying at next stage",
                runId, current.strategy(), next.strategy(), String.format("%.3f", delta));
        eventBus.publish(ChainEvent.of("wave.miscalculation", runId, stage.name(), Map.of(
                "previousStrategy", current.strategy().name(),
                "newStrategy", next.strategy().name(),
                "previousScore", current.total(),
                "newScore", next.total(),
                "domainDelta", delta)));
        return new Refresh(fresh, next);
    }
}
