package com.chainwright.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * The accepted output of one stage, appended to the run once all required gates passed.
 *
 * @param stage             the stage that produced it
 * @param content           merged markdown content
 * @param contributors      agent kinds whose sections made it into the content, in priority order
 * @param confidenceReduced true if any contributor worked from a degraded capability fallback
 * @param remediated        true if the content came from a caller remediation rather than generation
 */
public record StageOutput(
    StageId stage,
    String content,
    List<String> contributors,
    boolean confidenceReduced,
    boolean remediated
) implements Serializable {
    public StageOutput {
        contributors = contributors == null ? List.of() : List.copyOf(contributors);
    }
}
