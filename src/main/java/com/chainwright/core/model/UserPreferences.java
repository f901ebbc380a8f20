package com.chainwright.core.model;

import com.chainwright.core.agent.AgentKind;

import java.io.Serializable;
import java.util.EnumSet;
import java.util.Set;

/**
 * Caller preferences feeding the preference sub-score of agent scoring.
 */
public record UserPreferences(Set<AgentKind> preferred, Set<AgentKind> excluded) implements Serializable {

    public UserPreferences {
        preferred = preferred == null || preferred.isEmpty() ? Set.of() : Set.copyOf(preferred);
        excluded = excluded == null || excluded.isEmpty() ? Set.of() : Set.copyOf(excluded);
        var overlap = EnumSet.noneOf(AgentKind.class);
        overlap.addAll(preferred);
        overlap.retainAll(excluded);
        if (!overlap.isEmpty()) {
            throw new IllegalArgumentException("Agents both preferred and excluded: " + overlap);
        }
    }

    public static UserPreferences none() {
        return new UserPreferences(Set.of(), Set.of());
    }

    public boolean prefers(AgentKind kind) {
        return preferred.contains(kind);
    }

    public boolean excludes(AgentKind kind) {
        return excluded.contains(kind);
    }
}
