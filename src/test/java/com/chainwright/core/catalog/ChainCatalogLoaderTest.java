package com.chainwright.core.catalog;

import com.chainwright.core.agent.AgentKind;
import com.chainwright.core.model.StageId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChainCatalogLoaderTest {

    private ChainCatalogLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ChainCatalogLoader(new DefaultResourceLoader());
    }

    private ChainCatalog parse(String json) throws Exception {
        return loader.parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    // ===================================================================
    // Bundled catalog
    // ===================================================================

    @Nested
    @DisplayName("bundled catalog")
    class Bundled {

        private ChainCatalog catalog;

        @BeforeEach
        void load() {
            catalog = loader.load("classpath:chain-catalog.json");
        }

        @Test
        @DisplayName("defines the five stages in chain order")
        void chainOrder() {
            assertEquals(List.of(StageId.IDEA_DEFINITION, StageId.PRD, StageId.TRD, StageId.FEATURE_BREAKDOWN,
                    StageId.USER_STORY), catalog.chainOrder());
            assertTrue(catalog.stage(StageId.USER_STORY).isLast());
        }

        @Test
        @DisplayName("registers one descriptor per agent kind")
        void descriptors() {
            assertEquals(AgentKind.values().length, catalog.descriptors().size());
            assertEquals(AgentKind.ARCHITECT, catalog.descriptors().get(0).kind());
            assertTrue(catalog.descriptor(AgentKind.FRONTEND).orElseThrow().dirPatterns().contains("/components/"));
        }

        @Test
        @DisplayName("the security gate consults the security-scan capability")
        void securityGate() {
            var gate = catalog.gate("security");
            assertEquals(List.of("security-scan"), gate.requiredCapabilityTags());
            assertFalse(gate.required());
            assertEquals(List.of("structure"), catalog.gate("completeness").dependsOn());
        }

        @Test
        @DisplayName("adaptive mapping falls back to the stage's own gates")
        void adaptive() {
            assertEquals(List.of("acceptance-criteria", "traceability"), catalog.adaptiveGatesFor(StageId.USER_STORY));
        }
    }

    // ===================================================================
    // Validation
    // ===================================================================

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("a missing resource is reported")
        void missingResource() {
            var ex = assertThrows(CatalogException.class, () -> loader.load("classpath:absent-catalog.json"));
            assertTrue(ex.getMessage().contains("not found"));
        }

        @Test
        @DisplayName("malformed JSON is reported")
        void malformed() {
            assertThrows(CatalogException.class, () -> parse("{ \"stages\": [ "));
        }

        @Test
        @DisplayName("a stage referencing an unknown gate is rejected")
        void unknownGate() {
            var ex = assertThrows(CatalogException.class, () -> parse("""
                    { "stages": [ { "id": "IDEA_DEFINITION", "requiredGates": ["ghost"] } ] }
                    """));
            assertTrue(ex.getMessage().contains("ghost"));
        }

        @Test
        @DisplayName("a gate dependency cycle is rejected")
        void cycle() {
            assertThrows(CatalogException.class, () -> parse("""
                    { "stages": [ { "id": "IDEA_DEFINITION" } ],
                      "gates": [ { "id": "a", "threshold": 0.5, "dependsOn": ["b"] },
                                 { "id": "b", "threshold": 0.5, "dependsOn": ["a"] } ] }
                    """));
        }

        @Test
        @DisplayName("a stage pointing backwards is rejected")
        void backwards() {
            assertThrows(CatalogException.class, () -> parse("""
                    { "stages": [ { "id": "IDEA_DEFINITION", "nextStage": "PRD" },
                                  { "id": "PRD", "nextStage": "IDEA_DEFINITION" } ] }
                    """));
        }

        @Test
        @DisplayName("a duplicate agent kind is rejected")
        void duplicateAgent() {
            assertThrows(CatalogException.class, () -> parse("""
                    { "stages": [ { "id": "IDEA_DEFINITION" } ],
                      "agents": [ { "kind": "SCRIBE", "priority": 1 }, { "kind": "SCRIBE", "priority": 2 } ] }
                    """));
        }

        @Test
        @DisplayName("a catalog without the first stage is rejected")
        void noFirstStage() {
            assertThrows(CatalogException.class, () -> parse("{ \"stages\": [ { \"id\": \"PRD\" } ] }"));
        }

        @Test
        @DisplayName("an out-of-range threshold is rejected")
        void badThreshold() {
            assertThrows(CatalogException.class, () -> parse("""
                    { "stages": [ { "id": "IDEA_DEFINITION" } ], "gates": [ { "id": "a", "threshold": 1.5 } ] }
                    """));
        }
    }
}
