package com.chainwright.core.scoring;

import com.chainwright.core.agent.AgentDescriptor;
import com.chainwright.core.catalog.ChainCatalog;
import com.chainwright.core.catalog.StageDefinition;
import com.chainwright.core.config.ChainwrightProperties;
import com.chainwright.core.model.ProjectContext;
import com.chainwright.core.model.UserPreferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Scores every registered agent descriptor for a stage and buckets it into
 * {@link SpawnDecision#AUTO_SPAWN}, {@link SpawnDecision#SUGGEST} or {@link SpawnDecision#SKIP}.
 * <p>
 * {@code total = 0.40*stageRequirement + 0.35*content + 0.15*context + 0.10*preference}. Each
 * sub-score is a saturating sum of matched signals capped at 1. Scoring is a pure function of
 * its inputs.
 */
@Service
public class AgentScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(AgentScoringEngine.class);

    static final double REQUIRED_AGENT = 1.0;
    static final double OPTIONAL_AGENT = 0.75;
    static final double KEYWORD_HIT = 0.5;
    static final double DIRECTORY_HIT = 0.6;
    static final double FILE_PATTERN_HIT = 0.3;
    static final double DOMAIN_SCORE_FACTOR = 0.5;
    static final double PREFERRED = 1.0;
    static final double NEUTRAL = 0.5;
    static final double EXCLUDED = 0.0;

    private final ChainCatalog catalog;
    private final ChainwrightProperties.Scoring config;

    public AgentScoringEngine(ChainCatalog catalog, ChainwrightProperties properties) {
        this.catalog = catalog;
        this.config = properties.getScoring();
    }

    /**
     * Scores every registered descriptor, in descriptor-priority order.
     *
     * @param stage   the stage being entered
     * @param content the text the stage works from (idea plus previous outputs)
     * @param context the current project context
     * @param prefs   user preferences
     * @return one result per descriptor
     */
    public List<ScoringResult> score(StageDefinition stage, String content, ProjectContext context,
                                     UserPreferences prefs) {
        double autoThreshold = autoSpawnThreshold(stage);
        var results = new ArrayList<ScoringResult>();
        for (AgentDescriptor descriptor : catalog.descriptors()) {
            var result = score(stage, descriptor, content, context, prefs, autoThreshold);
            log.debug("Scored {}", result.explain());
            if (result.ambiguous()) {
                log.info("Scoring ambiguity for {} at {}: total {} sits on a boundary, resolved {} as {}",
                        descriptor.kind(), stage.id(), result.total(), config.getBoundaryPolicy(), result.decision());
            }
            results.add(result);
        }
        return results;
    }

    ScoringResult score(StageDefinition stage, AgentDescriptor descriptor, String content,
                        ProjectContext context, UserPreferences prefs, double autoThreshold) {
        var kind = descriptor.kind();
        double stageReq = stage.agentPolicy().requires(kind) ? REQUIRED_AGENT
                : stage.agentPolicy().allows(kind) ? OPTIONAL_AGENT : 0.0;

        var matched = matchKeywords(descriptor.domainKeywords(), content);
        double contentScore = Math.min(1.0, KEYWORD_HIT * matched.size());
        double contextScore = contextScore(descriptor, context);

        double preference = prefs.excludes(kind) ? EXCLUDED : prefs.prefers(kind) ? PREFERRED : NEUTRAL;

        double total = ScoringResult.STAGE_REQUIREMENT_WEIGHT * stageReq
                + ScoringResult.CONTENT_WEIGHT * contentScore
                + ScoringResult.CONTEXT_WEIGHT * contextScore
                + ScoringResult.PREFERENCE_WEIGHT * preference;
        total = Math.max(0.0, Math.min(1.0, total));

        SpawnDecision decision = decide(total, autoThreshold);
        if (prefs.excludes(kind)) {
            decision = SpawnDecision.SKIP;
        }
        boolean ambiguous = BoundaryPolicy.onBoundary(total, autoThreshold)
                || BoundaryPolicy.onBoundary(total, config.getSuggestThreshold());

        return new ScoringResult(kind, stage.id(), stageReq, contentScore, contextScore, preference,
                total, autoThreshold, decision, ambiguous, matched);
    }

    /**
     * Buckets a total against the auto-spawn and suggest thresholds under the configured boundary policy.
     */
    public SpawnDecision decide(double total, double autoThreshold) {
        var policy = config.getBoundaryPolicy();
        if (policy.meets(total, autoThreshold)) {
            return SpawnDecision.AUTO_SPAWN;
        }
        if (policy.meets(total, config.getSuggestThreshold())) {
            return SpawnDecision.SUGGEST;
        }
        return SpawnDecision.SKIP;
    }

    double autoSpawnThreshold(StageDefinition stage) {
        double fromPolicy = stage.agentPolicy().spawningThreshold();
        return fromPolicy > 0.0 ? fromPolicy : config.getAutoSpawnThreshold();
    }

    private double contextScore(AgentDescriptor descriptor, ProjectContext context) {
        double score = 0.0;
        for (String pattern : descriptor.dirPatterns()) {
            if (context.directoryHits().getOrDefault(normalizeDirectory(pattern), 0) > 0) {
                score += DIRECTORY_HIT;
            }
        }
        for (String pattern : descriptor.filePatterns()) {
            String ext = patternExtension(pattern);
            if (!ext.isEmpty() && context.extensionHistogram().getOrDefault(ext, 0) > 0) {
                score += FILE_PATTERN_HIT;
            }
        }
        score += DOMAIN_SCORE_FACTOR * context.score(descriptor.kind().domain());
        return Math.min(1.0, score);
    }

    public static List<String> matchKeywords(List<String> keywords, String content) {
        var matched = new ArrayList<String>();
        if (content == null || content.isBlank()) return matched;
        for (String keyword : keywords) {
            var pattern = Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", Pattern.CASE_INSENSITIVE);
            if (pattern.matcher(content).find() && !matched.contains(keyword)) {
                matched.add(keyword);
            }
        }
        return matched;
    }

    static String normalizeDirectory(String pattern) {
        String p = pattern.trim().toLowerCase(Locale.ROOT);
        while (p.startsWith("/")) p = p.substring(1);
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        return p;
    }

    static String patternExtension(String pattern) {
        int dot = pattern.lastIndexOf('.');
        if (dot < 0 || dot == pattern.length() - 1) return "";
        return pattern.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
