package com.chainwright.core.qualitygate.checks;

import com.chainwright.core.model.MarkdownSection;
import com.chainwright.core.qualitygate.GateCheck;
import com.chainwright.core.qualitygate.GateChecker;
import com.chainwright.core.qualitygate.GateInput;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Scores how many key terms of the idea and the previous stage's output reappear in the current
 * stage, so each stage stays traceable to the one before it.
 */
@Component
public class TraceabilityChecker implements GateChecker {

    static final int MIN_TERM_LENGTH = 5;
    static final int MAX_TERMS = 40;

    private static final Pattern WORD = Pattern.compile("[\\p{L}][\\p{L}\\p{N}-]*");

    private static final Set<String> STOPWORDS = Set.of(
            "about", "above", "after", "again", "against", "should", "would", "could", "their", "there",
            "these", "those", "which", "while", "where", "other", "every", "being", "under", "within",
            "without", "between", "through", "during", "before", "using", "based", "into", "must", "shall",
            "requirements", "overview", "summary", "section", "document", "product", "technical", "feature",
            "features", "stories", "story", "users");

    @Override
    public String id() {
        return "traceability";
    }

    @Override
    public GateCheck check(GateInput input) {
        var terms = new TreeSet<String>();
        addTerms(terms, input.idea());
        if (!input.previousOutputs().isEmpty()) {
            var previous = input.previousOutputs().get(input.previousOutputs().size() - 1);
            for (var section : MarkdownSection.parse(previous.content())) {
                if (!section.isPreamble()) addTerms(terms, section.heading());
            }
        }
        if (terms.isEmpty()) {
            return GateCheck.of(1.0);
        }

        var selected = new ArrayList<>(terms).subList(0, Math.min(terms.size(), MAX_TERMS));
        String content = input.content().toLowerCase(Locale.ROOT);
        var missing = new ArrayList<String>();
        int found = 0;
        for (String term : selected) {
            if (content.contains(term)) {
                found++;
            } else {
                missing.add(term);
            }
        }
        List<String> findings = missing.isEmpty() ? List.of()
                : List.of("terms from earlier stages not carried forward: " + missing);
        return new GateCheck((double) found / selected.size(), findings);
    }

    private static void addTerms(Set<String> terms, String text) {
        if (text == null) return;
        var m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            String word = m.group();
            if (word.length() >= MIN_TERM_LENGTH && !STOPWORDS.contains(word)) {
                terms.add(word);
            }
        }
    }
}
