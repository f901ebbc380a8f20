package com.chainwright.core.wave;

import com.chainwright.core.catalog.ChainCatalog;
import com.chainwright.core.config.ChainwrightProperties;
import com.chainwright.core.model.Domain;
import com.chainwright.core.model.ProjectContext;
import com.chainwright.core.scoring.AgentScoringEngine;
import com.chainwright.core.state.ChainState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides between single-pass and checkpointed multi-wave stage execution.
 * <p>
 * {@code waveScore = 0.35*chainComplexity + 0.25*agentCoordination + 0.20*implementationScale
 * + 0.15*projectContext + 0.05*qualityRequirements}. At or above the threshold the run is
 * multi-wave; the strategy is VALIDATION when quality requirements reach 0.9, otherwise it
 * follows the dominant raw sub-score.
 */
@Service
public class WaveModeAssessor {

    private static final Logger log = LoggerFactory.getLogger(WaveModeAssessor.class);

    static final double VALIDATION_QUALITY = 0.9;
    static final double IDEA_WORDS_SATURATION = 150.0;
    static final double DOMAINS_SATURATION = 4.0;
    static final double FILES_SATURATION = 500.0;
    static final double SCALE_WORDS_SATURATION = 300.0;
    static final double QUALITY_HITS_SATURATION = 3.0;
    static final double ACTIVE_DOMAIN_SCORE = 0.3;

    private static final List<Pattern> QUALITY_MARKERS = List.of(
            "compliance", "regulated", "regulatory", "hipaa", "gdpr", "pci", "sox", "audit",
            "mission-critical", "safety-critical", "sla", "high availability", "production-grade", "certified")
            .stream()
            .map(k -> Pattern.compile("\\b" + Pattern.quote(k) + "\\b", Pattern.CASE_INSENSITIVE))
            .toList();

    private final ChainCatalog catalog;
    private final ChainwrightProperties.Wave config;

    public WaveModeAssessor(ChainCatalog catalog, ChainwrightProperties properties) {
        this.catalog = catalog;
        this.config = properties.getWave();
    }

    /**
     * Derives a complexity profile from the idea and project context and decides on it.
     */
    public WaveDecision assess(String idea, ProjectContext context) {
        var decision = decide(profile(idea, context));
        log.info("Wave assessment: score {} -> {}", String.format("%.3f", decision.total()), decision.strategy());
        return decision;
    }

    public WaveDecision assess(ChainState state) {
        return assess(state.idea(), state.projectContext());
    }

    ComplexityProfile profile(String idea, ProjectContext context) {
        String text = idea == null ? "" : idea;
        int words = text.isBlank() ? 0 : text.strip().split("\\s+").length;

        int domainsInIdea = 0;
        int activeAgents = 0;
        for (var descriptor : catalog.descriptors()) {
            boolean mentioned = !AgentScoringEngine.matchKeywords(descriptor.domainKeywords(), text).isEmpty();
            if (mentioned) domainsInIdea++;
            if (mentioned || context.score(descriptor.kind().domain()) >= ACTIVE_DOMAIN_SCORE) activeAgents++;
        }

        double chain = 0.5 * Math.min(1.0, words / IDEA_WORDS_SATURATION)
                + 0.5 * Math.min(1.0, domainsInIdea / DOMAINS_SATURATION);
        double coordination = Math.min(1.0, activeAgents / DOMAINS_SATURATION);
        double scale = Math.max(Math.min(1.0, context.fileCount() / FILES_SATURATION),
                Math.min(1.0, words / SCALE_WORDS_SATURATION));
        double projectContext = 0.0;
        for (Domain d : Domain.values()) {
            projectContext = Math.max(projectContext, context.score(d));
        }
        int qualityHits = 0;
        for (var marker : QUALITY_MARKERS) {
            if (marker.matcher(text).find()) qualityHits++;
        }
        double quality = Math.min(1.0, qualityHits / QUALITY_HITS_SATURATION);

        return new ComplexityProfile(chain, coordination, scale, projectContext, quality);
    }

    /**
     * Computes the wave score of a profile and picks the strategy.
     */
    public WaveDecision decide(ComplexityProfile p) {
        double total = WaveDecision.CHAIN_COMPLEXITY_WEIGHT * p.chainComplexity()
                + WaveDecision.AGENT_COORDINATION_WEIGHT * p.agentCoordination()
                + WaveDecision.IMPLEMENTATION_SCALE_WEIGHT * p.implementationScale()
                + WaveDecision.PROJECT_CONTEXT_WEIGHT * p.projectContext()
                + WaveDecision.QUALITY_REQUIREMENTS_WEIGHT * p.qualityRequirements();
        total = Math.max(0.0, Math.min(1.0, total));

        if (total < config.getThreshold() - 1e-9) {
            return new WaveDecision(p, total, WaveStrategy.SINGLE_PASS);
        }
        if (p.qualityRequirements() >= VALIDATION_QUALITY) {
            return new WaveDecision(p, total, WaveStrategy.VALIDATION);
        }
        WaveStrategy strategy = WaveStrategy.PROGRESSIVE;
        double best = p.chainComplexity();
        if (p.agentCoordination() > best) {
            best = p.agentCoordination();
            strategy = WaveStrategy.AGENT_COORDINATED;
        }
        if (p.implementationScale() > best) {
            best = p.implementationScale();
            strategy = WaveStrategy.PROGRESSIVE;
        }
        if (p.projectContext() > best) {
            strategy = WaveStrategy.CONTEXT_DRIVEN;
        }
        return new WaveDecision(p, total, strategy);
    }

    /**
     * Whether a re-derived context moved enough on any domain to warrant a new assessment.
     */
    public boolean needsReassessment(ProjectContext previous, ProjectContext current) {
        if (previous == null || current == null || previous.version() == current.version()) {
            return false;
        }
        return current.maxDomainDelta(previous) > config.getContextDeltaThreshold();
    }
}
