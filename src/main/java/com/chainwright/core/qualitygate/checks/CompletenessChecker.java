package com.chainwright.core.qualitygate.checks;

import com.chainwright.core.model.MarkdownSection;
import com.chainwright.core.qualitygate.GateCheck;
import com.chainwright.core.qualitygate.GateChecker;
import com.chainwright.core.qualitygate.GateInput;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Scores how many required sections have a substantive body, penalising placeholders.
 */
@Component
public class CompletenessChecker implements GateChecker {

    static final int MIN_SECTION_WORDS = 20;
    static final int MIN_DOCUMENT_WORDS = 200;
    static final double PLACEHOLDER_PENALTY = 0.1;

    private static final Pattern PLACEHOLDER = Pattern.compile(
            "\\b(TODO|TBD|FIXME|lorem ipsum)\\b|\\[(insert|placeholder)[^\\]]*]", Pattern.CASE_INSENSITIVE);

    @Override
    public String id() {
        return "completeness";
    }

    @Override
    public GateCheck check(GateInput input) {
        var findings = new ArrayList<String>();
        var sections = MarkdownSection.parse(input.content());
        List<String> required = input.stage().requiredSections();

        double base;
        if (required.isEmpty()) {
            int words = sections.stream().mapToInt(MarkdownSection::wordCount).sum();
            base = Math.min(1.0, (double) words / MIN_DOCUMENT_WORDS);
            if (base < 1.0) findings.add("document is short (" + words + " words)");
        } else {
            var byKey = new HashMap<String, MarkdownSection>();
            for (var s : sections) byKey.putIfAbsent(s.key(), s);
            int substantive = 0;
            for (String name : required) {
                var section = byKey.get(MarkdownSection.normalize(name));
                if (section == null) continue;
                if (section.wordCount() >= MIN_SECTION_WORDS) {
                    substantive++;
                } else {
                    findings.add("section '" + name + "' is thin (" + section.wordCount() + " words)");
                }
            }
            base = (double) substantive / required.size();
        }

        var matcher = PLACEHOLDER.matcher(input.content());
        int placeholders = 0;
        while (matcher.find()) placeholders++;
        if (placeholders > 0) {
            findings.add(placeholders + " placeholder marker(s) left in the document");
        }
        return new GateCheck(base - PLACEHOLDER_PENALTY * placeholders, findings);
    }
}
