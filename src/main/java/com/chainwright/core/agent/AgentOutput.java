package com.chainwright.core.agent;

import java.util.List;

/**
 * What one agent produced.
 *
 * @param content           markdown contribution
 * @param confidenceReduced whether a capability it relied on was degraded or served by a fallback
 * @param capabilityNotes   capability results folded into its prompt
 */
public record AgentOutput(String content, boolean confidenceReduced, List<String> capabilityNotes) {
    public AgentOutput {
        content = content == null ? "" : content;
        capabilityNotes = capabilityNotes == null ? List.of() : List.copyOf(capabilityNotes);
    }
}
