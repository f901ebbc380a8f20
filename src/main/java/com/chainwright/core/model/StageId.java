package com.chainwright.core.model;

/**
 * The five stages of a prompt chain, in pipeline order. Ordinal order is the
 * only legal direction of travel; see {@link com.chainwright.core.engine.StageTransitions}.
 */
public enum StageId {
    IDEA_DEFINITION("Idea Definition"),
    PRD("Product Requirements"),
    TRD("Technical Requirements"),
    FEATURE_BREAKDOWN("Feature Breakdown"),
    USER_STORY("User Stories");

    private final String displayName;

    StageId(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public static StageId first() {
        return IDEA_DEFINITION;
    }
}
