package com.chainwright.core.qualitygate.checks;

import com.chainwright.core.qualitygate.GateCheck;
import com.chainwright.core.qualitygate.GateChecker;
import com.chainwright.core.qualitygate.GateInput;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Scores the share of user stories ("As a ..., I want ...") that carry acceptance criteria
 * (Given/When/Then or an explicit "Acceptance criteria" block).
 */
@Component
public class AcceptanceCriteriaChecker implements GateChecker {

    private static final Pattern STORY = Pattern.compile("(?is)\\bas an?\\s+.+?\\bi want\\b");
    private static final Pattern GIVEN_WHEN_THEN = Pattern.compile("(?is)\\bgiven\\b.+?\\bwhen\\b.+?\\bthen\\b");
    private static final Pattern CRITERIA_BLOCK = Pattern.compile("(?i)acceptance criteria");
    private static final Pattern BLOCK_SPLIT = Pattern.compile("(?m)^#{2,4} ");

    @Override
    public String id() {
        return "acceptance-criteria";
    }

    @Override
    public GateCheck check(GateInput input) {
        var blocks = storyBlocks(input.content());
        if (blocks.isEmpty()) {
            return GateCheck.of(0.0, "no user stories found");
        }
        var findings = new ArrayList<String>();
        int withCriteria = 0;
        for (int i = 0; i < blocks.size(); i++) {
            String block = blocks.get(i);
            if (GIVEN_WHEN_THEN.matcher(block).find() || CRITERIA_BLOCK.matcher(block).find()) {
                withCriteria++;
            } else {
                findings.add("story " + (i + 1) + " has no acceptance criteria: " + firstLine(block));
            }
        }
        return new GateCheck((double) withCriteria / blocks.size(), findings);
    }

    static List<String> storyBlocks(String content) {
        var stories = new ArrayList<String>();
        for (String block : BLOCK_SPLIT.split(content)) {
            if (STORY.matcher(block).find()) {
                stories.add(block.strip());
            }
        }
        return stories;
    }

    private static String firstLine(String block) {
        int nl = block.indexOf('\n');
        String line = nl < 0 ? block : block.substring(0, nl);
        return line.length() > 80 ? line.substring(0, 80) + "..." : line;
    }
}
