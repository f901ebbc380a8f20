package com.chainwright.core.agent;

import com.chainwright.TestFixtures;
import com.chainwright.core.catalog.ChainCatalog;
import com.chainwright.core.events.EventBus;
import com.chainwright.core.llm.InferenceProvider;
import com.chainwright.core.llm.StagePrompt;
import com.chainwright.core.llm.StagePromptBuilder;
import com.chainwright.core.metrics.ChainMetrics;
import com.chainwright.core.model.ProjectContext;
import com.chainwright.core.model.StageId;
import com.chainwright.mcp.CapabilityInvoker;
import com.chainwright.mcp.CapabilityTransport;
import com.chainwright.mcp.CapabilityUnavailableException;
import com.chainwright.mcp.McpServerDescriptor;
import com.chainwright.mcp.McpServerSelector;
import com.chainwright.mcp.ServerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class InferenceAgentExecutorTest {

    private ChainCatalog catalog;
    private InferenceProvider provider;
    private CapabilityTransport transport;

    @BeforeEach
    void setUp() {
        catalog = TestFixtures.catalog();
        provider = mock(InferenceProvider.class);
        transport = mock(CapabilityTransport.class);
        when(provider.generate(any(), any())).thenReturn("## Data Model\n\ntables");
    }

    private InferenceAgentExecutor executor(List<McpServerDescriptor> servers, Set<String> degradable) {
        var selector = new McpServerSelector(new ServerRegistry(servers, 10), Map.of(), 0.5, 5_000);
        var invoker = new CapabilityInvoker(selector, transport, Map.of(), degradable, new EventBus(),
                new ChainMetrics(new SimpleMeterRegistry()));
        return new InferenceAgentExecutor(provider, new StagePromptBuilder(), invoker);
    }

    private AgentInstance instance(AgentKind kind) {
        var task = new AgentTask("CHN-1", catalog.stage(StageId.TRD), "Inventory service", List.of(), null, "");
        return new AgentInstance("CHN-1", catalog.descriptor(kind).orElseThrow(), task,
                ProjectContext.empty().view(List.of(kind.domain())));
    }

    @Test
    @DisplayName("capability results are passed to the agent prompt as notes")
    void capabilityNotes() throws Exception {
        var docs = McpServerDescriptor.of("docs", List.of("documentation"), 1, 2);
        when(transport.callTool(eq(docs), anyString(), anyMap())).thenReturn("use PostgreSQL 16");

        var output = executor(List.of(docs), Set.of()).execute(instance(AgentKind.BACKEND));

        assertEquals("## Data Model\n\ntables", output.content());
        assertFalse(output.confidenceReduced());
        var prompt = ArgumentCaptor.forClass(StagePrompt.class);
        verify(provider).generate(prompt.capture(), any());
        assertEquals(AgentKind.BACKEND, prompt.getValue().agent());
        assertTrue(prompt.getValue().user().contains("use PostgreSQL 16"));
    }

    @Test
    @DisplayName("a degraded capability lowers confidence but the agent still answers")
    void degraded() throws Exception {
        var output = executor(List.of(), Set.of("documentation")).execute(instance(AgentKind.BACKEND));

        assertTrue(output.confidenceReduced());
        assertTrue(output.capabilityNotes().get(0).contains("unavailable"));
    }

    @Test
    @DisplayName("an unavailable required capability stops the agent before inference")
    void unavailable() {
        var executor = executor(List.of(), Set.of());
        assertThrows(CapabilityUnavailableException.class, () -> executor.execute(instance(AgentKind.SECURITY)));
        verifyNoInteractions(provider);
    }
}
