package com.chainwright.core.qualitygate.checks;

import com.chainwright.TestFixtures;
import com.chainwright.core.catalog.AgentPolicy;
import com.chainwright.core.catalog.StageDefinition;
import com.chainwright.core.model.StageId;
import com.chainwright.core.model.StageOutput;
import com.chainwright.core.qualitygate.GateInput;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the built-in gate checkers.
 */
class GateCheckersTest {

    private static final List<String> SECTIONS = List.of("Overview", "Functional Requirements", "Release Criteria");

    private static StageDefinition stage(List<String> sections) {
        return new StageDefinition(StageId.PRD, List.of("idea"), "markdown", sections, List.of(), List.of(),
                AgentPolicy.none(), null, "");
    }

    private static GateInput input(String content) {
        return new GateInput(stage(SECTIONS), "idea", content, List.of());
    }

    // ===================================================================
    // Structure
    // ===================================================================

    @Nested
    @DisplayName("structure")
    class Structure {

        private final StructureChecker checker = new StructureChecker();

        @Test
        @DisplayName("all required sections present scores 1")
        void complete() {
            var check = checker.check(input(TestFixtures.document(SECTIONS)));
            assertEquals(1.0, check.score(), 1e-9);
            assertTrue(check.findings().isEmpty());
        }

        @Test
        @DisplayName("headings match after normalising numbering and punctuation")
        void normalisedHeadings() {
            var check = checker.check(input("## 1. Overview\n\n## Functional requirements:\n\n## RELEASE CRITERIA\n"));
            assertEquals(1.0, check.score(), 1e-9);
        }

        @Test
        @DisplayName("each missing section lowers the score and is reported")
        void missingSection() {
            var check = checker.check(input(TestFixtures.document(List.of("Overview"))));
            assertEquals(1.0 / 3, check.score(), 1e-9);
            assertTrue(check.findings().contains("missing section: Release Criteria"));
        }

        @Test
        @DisplayName("a heading inside a code fence does not count")
        void fencedHeading() {
            var check = checker.check(input("## Overview\n\n```\n## Release Criteria\n```\n"));
            assertEquals(1.0 / 3, check.score(), 1e-9);
        }
    }

    // ===================================================================
    // Completeness
    // ===================================================================

    @Nested
    @DisplayName("completeness")
    class Completeness {

        private final CompletenessChecker checker = new CompletenessChecker();

        @Test
        @DisplayName("substantive sections score 1")
        void substantive() {
            assertEquals(1.0, checker.check(input(TestFixtures.document(SECTIONS))).score(), 1e-9);
        }

        @Test
        @DisplayName("thin sections do not count")
        void thinSection() {
            String content = TestFixtures.document(List.of("Overview", "Functional Requirements"))
                    + "## Release Criteria\n\nShip it.\n";
            var check = checker.check(input(content));
            assertEquals(2.0 / 3, check.score(), 1e-9);
            assertTrue(check.findings().stream().anyMatch(f -> f.contains("Release Criteria")));
        }

        @Test
        @DisplayName("placeholders are penalised")
        void placeholders() {
            String content = TestFixtures.document(SECTIONS) + "\nTODO: fill in. Owner TBD.\n";
            assertEquals(0.8, checker.check(input(content)).score(), 1e-9);
        }
    }

    // ===================================================================
    // Security
    // ===================================================================

    @Nested
    @DisplayName("security")
    class Security {

        private final SecurityChecker checker = new SecurityChecker();

        @Test
        @DisplayName("covering every topic scores 1")
        void allTopics() {
            String content = "Users authenticate with OAuth. Role-based access control guards admin actions. "
                    + "Data is encrypted at rest and in transit. Inputs are validated against injection. "
                    + "Credentials live in a vault. Security logging feeds alerting.";
            assertEquals(1.0, checker.check(input(content)).score(), 1e-9);
        }

        @Test
        @DisplayName("a pasted secret is penalised")
        void leakedSecret() {
            String content = "Users authenticate with OAuth. password = hunter22secret";
            var check = checker.check(input(content));
            assertEquals(0.0, check.score(), 1e-9);
            assertTrue(check.findings().stream().anyMatch(f -> f.startsWith("possible secret")));
        }
    }

    // ===================================================================
    // Acceptance criteria
    // ===================================================================

    @Nested
    @DisplayName("acceptance criteria")
    class AcceptanceCriteria {

        private final AcceptanceCriteriaChecker checker = new AcceptanceCriteriaChecker();

        @Test
        @DisplayName("the share of stories with criteria is the score")
        void share() {
            String content = """
                    ## User Stories

                    ### Story 1
                    As a shopper, I want to save my cart, so that I can finish later.
                    Given a cart with items, when I log out, then the items are kept.

                    ### Story 2
                    As an admin, I want to export orders, so that finance can reconcile.
                    """;
            var check = checker.check(input(content));
            assertEquals(0.5, check.score(), 1e-9);
            assertEquals(1, check.findings().size());
        }

        @Test
        @DisplayName("a document without stories scores 0")
        void noStories() {
            assertEquals(0.0, checker.check(input("## User Stories\n\nNone yet.\n")).score());
        }
    }

    // ===================================================================
    // Traceability
    // ===================================================================

    @Nested
    @DisplayName("traceability")
    class Traceability {

        private final TraceabilityChecker checker = new TraceabilityChecker();

        @Test
        @DisplayName("terms of the idea and the previous headings must reappear")
        void carriesTermsForward() {
            var previous = new StageOutput(StageId.IDEA_DEFINITION, "## Pricing\n\nsome text", List.of(), false, false);
            var input = new GateInput(stage(SECTIONS), "Recipe sharing platform", "Recipe platform overview",
                    List.of(previous));

            var check = checker.check(input);

            // terms: recipe, sharing, platform, pricing -> recipe and platform found
            assertEquals(0.5, check.score(), 1e-9);
            assertTrue(check.findings().get(0).contains("pricing"));
        }

        @Test
        @DisplayName("nothing to trace scores 1")
        void nothingToTrace() {
            var input = new GateInput(stage(SECTIONS), "An app", "content", List.of());
            assertEquals(1.0, checker.check(input).score());
        }
    }
}
