package com.chainwright.core.agent;

import com.chainwright.core.model.MarkdownSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges agent outputs region by region.
 * <p>
 * Each output is split into {@code ## } sections. Two sections claim the same region when their
 * normalised headings are equal or one ends with the other as a whole word ("Security" and
 * "Data Security"). The first claimant in priority order wins; later claimants become
 * {@link SecondarySuggestion}s. Preambles never conflict.
 */
@Component
public class OutputConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(OutputConflictResolver.class);

    public record Resolution(
        String content,
        Map<AgentKind, List<String>> sectionsWon,
        List<SecondarySuggestion> secondarySuggestions
    ) {}

    private record Claim(MarkdownSection section, AgentKind owner) {}

    /**
     * Merges completed outcomes, which must already be in descriptor-priority order.
     */
    public Resolution resolve(List<AgentOutcome> inPriorityOrder) {
        var claims = new LinkedHashMap<String, Claim>();
        var won = new LinkedHashMap<AgentKind, List<String>>();
        var secondary = new ArrayList<SecondarySuggestion>();

        for (var outcome : inPriorityOrder) {
            if (!outcome.completed()) continue;
            var kind = outcome.kind();
            won.putIfAbsent(kind, new ArrayList<>());
            for (var section : MarkdownSection.parse(outcome.output().content())) {
                String key = section.isPreamble()
                        ? MarkdownSection.PREAMBLE_KEY + ":" + kind.name()
                        : section.key();
                var existing = section.isPreamble() ? null : findOverlap(claims, key);
                if (existing != null) {
                    log.debug("Region '{}' from {} overridden by {}", section.heading(), kind, existing.owner());
                    secondary.add(new SecondarySuggestion(section.heading(), kind, existing.owner(), section.body()));
                    continue;
                }
                claims.put(key, new Claim(section, kind));
                if (!section.isPreamble()) {
                    won.get(kind).add(section.heading());
                }
            }
        }

        var merged = new StringBuilder();
        for (var claim : claims.values()) {
            if (merged.length() > 0) merged.append("\n\n");
            merged.append(claim.section().render());
        }
        if (!secondary.isEmpty()) {
            log.info("Resolved {} region conflict(s) by descriptor priority", secondary.size());
        }
        return new Resolution(merged.toString(), won, secondary);
    }

    /**
     * Lays a later wave's output over the current draft: the wave's sections replace the draft's
     * matching regions, the draft's other regions are kept in place, new regions are appended.
     */
    public String overlay(String draft, String waveContent) {
        if (draft == null || draft.isBlank()) return waveContent == null ? "" : waveContent;
        if (waveContent == null || waveContent.isBlank()) return draft;

        var regions = new LinkedHashMap<String, MarkdownSection>();
        for (var section : MarkdownSection.parse(draft)) {
            regions.put(section.key(), section);
        }
        for (var section : MarkdownSection.parse(waveContent)) {
            if (section.isPreamble()) {
                if (!regions.containsKey(MarkdownSection.PREAMBLE_KEY)) {
                    regions.put(MarkdownSection.PREAMBLE_KEY, section);
                }
                continue;
            }
            var existing = findOverlapKey(regions, section.key());
            regions.put(existing != null ? existing : section.key(), section);
        }
        var sb = new StringBuilder();
        for (var section : regions.values()) {
            if (sb.length() > 0) sb.append("\n\n");
            sb.append(section.render());
        }
        return sb.toString();
    }

    private static Claim findOverlap(Map<String, Claim> claims, String key) {
        String match = findOverlapKey(claims, key);
        return match == null ? null : claims.get(match);
    }

    private static String findOverlapKey(Map<String, ?> regions, String key) {
        for (String claimed : regions.keySet()) {
            if (claimed.startsWith(MarkdownSection.PREAMBLE_KEY)) continue;
            if (regionsMatch(claimed, key)) return claimed;
        }
        return null;
    }

    static boolean regionsMatch(String a, String b) {
        if (a.equals(b)) return true;
        return a.endsWith(" " + b) || b.endsWith(" " + a);
    }
}
