package com.chainwright.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One {@code ## } region of a markdown document. Text before the first heading is the preamble,
 * with a {@code null} heading.
 *
 * @param heading the heading text without the {@code ## } marker, {@code null} for the preamble
 * @param body    the region text below the heading, trimmed
 */
public record MarkdownSection(String heading, String body) {

    public static final String PREAMBLE_KEY = "_preamble";

    public MarkdownSection {
        body = body == null ? "" : body.strip();
    }

    public boolean isPreamble() {
        return heading == null;
    }

    /** Normalised region key used to detect two sections claiming the same region. */
    public String key() {
        return heading == null ? PREAMBLE_KEY : normalize(heading);
    }

    public String render() {
        return heading == null ? body : "## " + heading + "\n\n" + body;
    }

    public int wordCount() {
        String trimmed = body.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    /**
     * Splits a document into its preamble (if non-blank) and {@code ## } sections, in document order.
     * Deeper headings stay inside their enclosing section.
     */
    public static List<MarkdownSection> parse(String content) {
        var sections = new ArrayList<MarkdownSection>();
        if (content == null || content.isBlank()) return sections;

        String heading = null;
        var body = new StringBuilder();
        boolean inFence = false;
        for (String line : content.split("\\R", -1)) {
            if (line.strip().startsWith("```")) {
                inFence = !inFence;
            }
            if (!inFence && line.startsWith("## ")) {
                if (heading != null || !body.toString().isBlank()) {
                    sections.add(new MarkdownSection(heading, body.toString()));
                }
                heading = line.substring(3).strip();
                body.setLength(0);
            } else {
                body.append(line).append('\n');
            }
        }
        if (heading != null || !body.toString().isBlank()) {
            sections.add(new MarkdownSection(heading, body.toString()));
        }
        return sections;
    }

    public static String normalize(String heading) {
        return heading.strip()
                .replaceAll("^[0-9.]+\\s*", "")
                .replaceAll("[^\\p{Alnum}]+", " ")
                .strip()
                .toLowerCase(Locale.ROOT);
    }
}
