package com.chainwright.core.qualitygate.checks;

import com.chainwright.core.qualitygate.GateCheck;
import com.chainwright.core.qualitygate.GateChecker;
import com.chainwright.core.qualitygate.GateInput;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scores coverage of core security topics and penalises secrets pasted into the document.
 */
@Component
public class SecurityChecker implements GateChecker {

    static final double LEAK_PENALTY = 0.5;

    private static final Map<String, Pattern> TOPICS = new LinkedHashMap<>();

    static {
        TOPICS.put("authentication", Pattern.compile("\\b(authenticat\\w*|login|sign[- ]in|sso|oauth)\\b", Pattern.CASE_INSENSITIVE));
        TOPICS.put("authorization", Pattern.compile("\\b(authori[sz]\\w*|permission\\w*|role[- ]based|rbac|access control)\\b", Pattern.CASE_INSENSITIVE));
        TOPICS.put("data protection", Pattern.compile("\\b(encrypt\\w*|tls|https|at rest|in transit|privacy|pii|gdpr)\\b", Pattern.CASE_INSENSITIVE));
        TOPICS.put("input validation", Pattern.compile("\\b(validat\\w*|sanitiz\\w*|injection|xss|csrf)\\b", Pattern.CASE_INSENSITIVE));
        TOPICS.put("secrets management", Pattern.compile("\\b(secret\\w*|credential\\w*|vault|key management|api keys?)\\b", Pattern.CASE_INSENSITIVE));
        TOPICS.put("audit", Pattern.compile("\\b(audit\\w*|security logging|monitoring|alerting)\\b", Pattern.CASE_INSENSITIVE));
    }

    private static final List<Pattern> LEAKS = List.of(
            Pattern.compile("-----BEGIN [A-Z ]*PRIVATE KEY-----"),
            Pattern.compile("\\bAKIA[0-9A-Z]{16}\\b"),
            Pattern.compile("(?i)\\b(password|passwd|secret|api[_-]?key)\\s*[:=]\\s*['\"]?[^\\s'\"]{6,}"));

    @Override
    public String id() {
        return "security";
    }

    @Override
    public GateCheck check(GateInput input) {
        String content = input.content();
        var findings = new ArrayList<String>();
        int covered = 0;
        for (var topic : TOPICS.entrySet()) {
            if (topic.getValue().matcher(content).find()) {
                covered++;
            } else {
                findings.add("security topic not addressed: " + topic.getKey());
            }
        }
        double score = (double) covered / TOPICS.size();
        for (var leak : LEAKS) {
            if (leak.matcher(content).find()) {
                findings.add("possible secret in document matching " + leak.pattern());
                score -= LEAK_PENALTY;
            }
        }
        return new GateCheck(score, findings);
    }
}
