package com.chainwright.core.qualitygate.checks;

import com.chainwright.core.model.MarkdownSection;
import com.chainwright.core.qualitygate.GateCheck;
import com.chainwright.core.qualitygate.GateChecker;
import com.chainwright.core.qualitygate.GateInput;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;

/**
 * Scores the share of the stage's required sections present as {@code ## } headings.
 */
@Component
public class StructureChecker implements GateChecker {

    @Override
    public String id() {
        return "structure";
    }

    @Override
    public GateCheck check(GateInput input) {
        var sections = MarkdownSection.parse(input.content());
        var required = input.stage().requiredSections();
        if (required.isEmpty()) {
            boolean anyHeading = sections.stream().anyMatch(s -> !s.isPreamble());
            return anyHeading ? GateCheck.of(1.0) : GateCheck.of(0.5, "document has no section headings");
        }

        var present = new HashSet<String>();
        for (var section : sections) {
            present.add(section.key());
        }
        var findings = new ArrayList<String>();
        int found = 0;
        for (String name : required) {
            if (present.contains(MarkdownSection.normalize(name))) {
                found++;
            } else {
                findings.add("missing section: " + name);
            }
        }
        return new GateCheck((double) found / required.size(), findings);
    }
}
