package com.chainwright.core.scoring;

import com.chainwright.core.agent.AgentKind;
import com.chainwright.core.model.StageId;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of scoring one agent descriptor for one stage.
 *
 * @param agent            the scored agent kind
 * @param stage            the stage being entered
 * @param stageRequirement stage-policy sub-score in [0,1]
 * @param content          content-analysis sub-score in [0,1]
 * @param context          project-context sub-score in [0,1]
 * @param preference       user-preference sub-score in [0,1]
 * @param total            weighted total in [0,1]
 * @param threshold        the auto-spawn threshold that applied
 * @param decision         resulting bucket
 * @param ambiguous        whether the total sat on a bucket boundary
 * @param matchedKeywords  domain keywords found in the stage content
 */
public record ScoringResult(
    AgentKind agent,
    StageId stage,
    double stageRequirement,
    double content,
    double context,
    double preference,
    double total,
    double threshold,
    SpawnDecision decision,
    boolean ambiguous,
    List<String> matchedKeywords
) {
    public static final double STAGE_REQUIREMENT_WEIGHT = 0.40;
    public static final double CONTENT_WEIGHT = 0.35;
    public static final double CONTEXT_WEIGHT = 0.15;
    public static final double PREFERENCE_WEIGHT = 0.10;

    public ScoringResult {
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
    }

    /** Declared sub-score weights, in formula order. */
    public static Map<String, Double> weights() {
        var weights = new LinkedHashMap<String, Double>();
        weights.put("stageRequirement", STAGE_REQUIREMENT_WEIGHT);
        weights.put("content", CONTENT_WEIGHT);
        weights.put("context", CONTEXT_WEIGHT);
        weights.put("preference", PREFERENCE_WEIGHT);
        return weights;
    }

    public String explain() {
        return String.format("%s: total %.3f (stage %.2f, content %.2f, context %.2f, preference %.2f) -> %s",
                agent, total, stageRequirement, content, context, preference, decision);
    }
}
