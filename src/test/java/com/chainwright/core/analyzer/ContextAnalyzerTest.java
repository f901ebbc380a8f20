package com.chainwright.core.analyzer;

import com.chainwright.TestFixtures;
import com.chainwright.core.agent.AgentKind;
import com.chainwright.core.model.Domain;
import com.chainwright.core.model.StageId;
import com.chainwright.core.model.UserPreferences;
import com.chainwright.core.scoring.AgentScoringEngine;
import com.chainwright.core.scoring.ScoringResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ContextAnalyzer} against small project trees on disk.
 */
class ContextAnalyzerTest {

    @TempDir
    Path root;

    private ContextAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new ContextAnalyzer(TestFixtures.properties());
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    // ===================================================================
    // Domain attribution
    // ===================================================================

    @Nested
    @DisplayName("analyze")
    class Analyze {

        @Test
        @DisplayName("a React component tree scores highest on frontend")
        void frontendProject() throws IOException {
            write("src/components/Button.tsx",
                    "import React from 'react';\n// A reusable component with props and responsive layout\n");
            write("src/components/Card.tsx", "export const Card = (props) => render(props);\n");
            write("package.json", "{ \"dependencies\": { \"react\": \"18.2.0\" } }\n");

            var context = analyzer.analyze(root);

            assertEquals(1, context.version());
            assertEquals(3, context.fileCount());
            assertEquals(2, context.extensionHistogram().get("tsx"));
            assertEquals(1, context.directoryHits().get("components"));
            double frontend = context.score(Domain.FRONTEND);
            for (Domain d : Domain.values()) {
                if (d != Domain.FRONTEND) {
                    assertTrue(frontend > context.score(d), "frontend should lead " + d);
                }
            }
            assertTrue(context.summary().contains("frontend"));
        }

        @Test
        @DisplayName("a backend service scores on backend and not on frontend")
        void backendProject() throws IOException {
            write("api/controllers/OrderController.java",
                    "@RestController class OrderController { /* endpoint over the database repository */ }\n");
            write("db/schema.sql", "create table orders (id int);\n");

            var context = analyzer.analyze(root);

            assertTrue(context.score(Domain.BACKEND) > 0.5);
            assertEquals(0.0, context.score(Domain.FRONTEND));
        }

        @Test
        @DisplayName("ignored directories contribute nothing")
        void ignoredDirectories() throws IOException {
            write("README.md", "# readme\n");
            write("node_modules/react/index.jsx", "react component\n");

            var context = analyzer.analyze(root);

            assertEquals(1, context.fileCount());
            assertNull(context.extensionHistogram().get("jsx"));
        }

        @Test
        @DisplayName("every walked directory is counted under each trailing path")
        void directoryKeys() throws IOException {
            write("src/main/db/schema.sql", "create table orders (id int);\n");
            write("specs/checkout.md", "# Checkout\n");

            var context = analyzer.analyze(root);

            assertEquals(1, context.directoryHits().get("db"));
            assertEquals(1, context.directoryHits().get("main/db"));
            assertEquals(1, context.directoryHits().get("src/main/db"));
            assertEquals(1, context.directoryHits().get("specs"));
        }

        @Test
        @DisplayName("a db tree raises the backend agent's context sub-score")
        void dbTreeScoresBackend(@TempDir Path other) throws IOException {
            write("src/main/db/schema.sql", "create table orders (id int);\n");
            Files.createDirectories(other.resolve("src/main/store"));
            Files.writeString(other.resolve("src/main/store/schema.sql"), "create table orders (id int);\n");

            var catalog = TestFixtures.catalog();
            var scoring = new AgentScoringEngine(catalog, TestFixtures.properties());
            var stage = catalog.stage(StageId.TRD);
            double withDb = backendContext(scoring.score(stage, "", analyzer.analyze(root), UserPreferences.none()));
            double withoutDb = backendContext(scoring.score(stage, "", analyzer.analyze(other), UserPreferences.none()));

            assertTrue(withDb > withoutDb, withDb + " <= " + withoutDb);
        }

        private double backendContext(List<ScoringResult> results) {
            return results.stream().filter(r -> r.agent() == AgentKind.BACKEND).findFirst().orElseThrow().context();
        }

        @Test
        @DisplayName("analysing the same tree twice gives the same snapshot")
        void deterministic() throws IOException {
            write("docs/guide.md", "A guide to the architecture\n");
            assertEquals(analyzer.analyze(root), analyzer.analyze(root));
        }
    }

    // ===================================================================
    // Failures
    // ===================================================================

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a missing root fails")
        void missingRoot() {
            var ex = assertThrows(ContextAnalysisException.class, () -> analyzer.analyze(root.resolve("absent")));
            assertTrue(ex.getMessage().contains("does not exist"));
        }

        @Test
        @DisplayName("a file given as root fails")
        void fileRoot() throws IOException {
            write("single.txt", "text");
            assertThrows(ContextAnalysisException.class, () -> analyzer.analyze(root.resolve("single.txt")));
        }

        @Test
        @DisplayName("an empty root fails")
        void emptyRoot() {
            var ex = assertThrows(ContextAnalysisException.class, () -> analyzer.analyze(root));
            assertTrue(ex.getMessage().contains("no files"));
        }
    }

    // ===================================================================
    // Re-derivation
    // ===================================================================

    @Nested
    @DisplayName("reanalyze")
    class Reanalyze {

        @Test
        @DisplayName("an unchanged tree returns the previous snapshot")
        void unchanged() throws IOException {
            write("src/Main.java", "class Main {}\n");
            var first = analyzer.analyze(root);
            assertSame(first, analyzer.reanalyze(root, first));
        }

        @Test
        @DisplayName("a changed tree yields the next version without touching the previous one")
        void changed() throws IOException {
            write("src/Main.java", "class Main {}\n");
            var first = analyzer.analyze(root);
            write("security/auth/TokenService.java", "// jwt token authentication and authorization\n");

            var second = analyzer.reanalyze(root, first);

            assertEquals(2, second.version());
            assertEquals(1, first.version());
            assertEquals(1, first.fileCount());
            assertTrue(second.score(Domain.SECURITY) > first.score(Domain.SECURITY));
        }
    }

    @Test
    @DisplayName("extensions are lower-cased and dotfiles have none")
    void extensions() {
        assertEquals("tsx", ContextAnalyzer.extensionOf("Button.TSX"));
        assertEquals("", ContextAnalyzer.extensionOf(".gitignore"));
        assertEquals("", ContextAnalyzer.extensionOf("Makefile"));
    }
}
