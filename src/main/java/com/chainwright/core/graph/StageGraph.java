package com.chainwright.core.graph;

import com.chainwright.core.engine.RunRegistry;
import com.chainwright.core.model.RunStatus;
import com.chainwright.core.nodes.AbortRunNode;
import com.chainwright.core.nodes.AdvanceStageNode;
import com.chainwright.core.nodes.AwaitRemediationNode;
import com.chainwright.core.nodes.EnterStageNode;
import com.chainwright.core.nodes.EvaluateGatesNode;
import com.chainwright.core.nodes.ProduceStageNode;
import com.chainwright.core.state.ChainState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that runs one stage of a chain.
 * <p>
 * Topology:
 * <pre>
 *   START -> enter_stage -> [routeAfterEnter]
 *            -> produce_stage -> [routeAfterProduce]
 *               -> evaluate_gates -> [routeAfterGates]
 *                  -> advance_stage -> END
 *                  -> await_remediation -> END
 *               -> await_remediation -> END   (blocking wave checkpoint)
 *            -> evaluate_gates                 (remediation re-entry)
 *   any router -> abort_run -> END            (abort requested)
 *   any router -> END                         (run failed)
 * </pre>
 * The engine invokes the graph once per stage.
 */
@Component
public class StageGraph {

    private static final Logger log = LoggerFactory.getLogger(StageGraph.class);

    private final CompiledGraph<ChainState> compiledGraph;
    private final RunRegistry runRegistry;

    public StageGraph(
            EnterStageNode enterNode,
            ProduceStageNode produceNode,
            EvaluateGatesNode evaluateNode,
            AdvanceStageNode advanceNode,
            AwaitRemediationNode remediationNode,
            AbortRunNode abortNode,
            RunRegistry runRegistry) throws Exception {
        this.runRegistry = runRegistry;

        var graph = new StateGraph<>(ChainState.SCHEMA, ChainState::new)
                .addNode("enter_stage", node_async(enterNode::apply))
                .addNode("produce_stage", node_async(produceNode::apply))
                .addNode("evaluate_gates", node_async(evaluateNode::apply))
                .addNode("advance_stage", node_async(advanceNode::apply))
                .addNode("await_remediation", node_async(remediationNode::apply))
                .addNode("abort_run", node_async(abortNode::apply))
                .addEdge(START, "enter_stage")
                .addConditionalEdges("enter_stage",
                        edge_async(this::routeAfterEnter),
                        Map.of("produce_stage", "produce_stage",
                                "evaluate_gates", "evaluate_gates",
                                "abort_run", "abort_run",
                                "end", END))
                .addConditionalEdges("produce_stage",
                        edge_async(this::routeAfterProduce),
                        Map.of("evaluate_gates", "evaluate_gates",
                                "await_remediation", "await_remediation",
                                "abort_run", "abort_run",
                                "end", END))
                .addConditionalEdges("evaluate_gates",
                        edge_async(this::routeAfterGates),
                        Map.of("advance_stage", "advance_stage",
                                "await_remediation", "await_remediation",
                                "abort_run", "abort_run",
                                "end", END))
                .addEdge("advance_stage", END)
                .addEdge("await_remediation", END)
                .addEdge("abort_run", END);

        // No checkpoint saver: the engine passes the full run state into every stage invocation.
        this.compiledGraph = graph.compile();
        log.info("Stage graph compiled without checkpoint saver");
    }

    /**
     * Remediation re-entries go straight to the gates; everything else produces content first.
     */
    String routeAfterEnter(ChainState state) {
        if (state.status() == RunStatus.FAILED) return "end";
        if (runRegistry.isAbortRequested(state.runId())) return "abort_run";
        return state.isRemediating() ? "evaluate_gates" : "produce_stage";
    }

    /**
     * A checkpoint that blocked under VALIDATION skips the final gate pass.
     */
    String routeAfterProduce(ChainState state) {
        if (state.status() == RunStatus.FAILED) return "end";
        if (runRegistry.isAbortRequested(state.runId())) return "abort_run";
        return state.checkpointBlocked() ? "await_remediation" : "evaluate_gates";
    }

    /**
     * Any blocking required gate keeps the run at this stage.
     */
    String routeAfterGates(ChainState state) {
        if (state.status() == RunStatus.FAILED) return "end";
        if (runRegistry.isAbortRequested(state.runId())) return "abort_run";
        boolean blocking = state.gateReport().map(r -> r.isBlocking()).orElse(false);
        return blocking ? "await_remediation" : "advance_stage";
    }

    public CompiledGraph<ChainState> getCompiledGraph() {
        return compiledGraph;
    }
}
