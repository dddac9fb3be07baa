package com.mendloop.core.graph;

import com.mendloop.core.model.LoopStatus;
import com.mendloop.core.phases.AnalyzeFailuresPhase;
import com.mendloop.core.phases.FinalizePhase;
import com.mendloop.core.phases.ProposeFixPhase;
import com.mendloop.core.phases.RunValidationPhase;
import com.mendloop.core.phases.ScaffoldChecksPhase;
import com.mendloop.core.phases.WorkPhase;
import com.mendloop.core.state.LoopState;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} of the convergence loop.
 * <p>
 * Topology:
 * <pre>
 *   START -> propose_fix -> scaffold_checks -> work -> validate
 *         -> [routeAfterValidation]
 *            -> analyze -> work          (ANALYZING: iterate again)
 *            -> finalize -> END          (DONE_PASS or DONE_CEILING)
 * </pre>
 * Setup nodes decide for themselves whether to skip on resume, so every run enters at START.
 */
@Component
public class ConvergenceGraph {

    private static final Logger log = LoggerFactory.getLogger(ConvergenceGraph.class);

    /** Graph steps outside the work/validate/analyze cycle: two setup nodes, finalize, slack. */
    static final int FIXED_STEPS = 10;
    static final int STEPS_PER_ITERATION = 3;

    private final CompiledGraph<LoopState> compiledGraph;

    public ConvergenceGraph(
            ProposeFixPhase proposeFix,
            ScaffoldChecksPhase scaffoldChecks,
            WorkPhase work,
            RunValidationPhase validation,
            AnalyzeFailuresPhase analyze,
            FinalizePhase finalizePhase) throws Exception {

        var graph = new StateGraph<>(LoopState.SCHEMA, LoopState::new)
                .addNode("propose_fix", node_async(proposeFix::apply))
                .addNode("scaffold_checks", node_async(scaffoldChecks::apply))
                .addNode("work", node_async(work::apply))
                .addNode("validate", node_async(validation::apply))
                .addNode("analyze", node_async(analyze::apply))
                .addNode("finalize", node_async(finalizePhase::apply))
                .addEdge(START, "propose_fix")
                .addEdge("propose_fix", "scaffold_checks")
                .addEdge("scaffold_checks", "work")
                .addEdge("work", "validate")
                .addConditionalEdges("validate",
                        edge_async(ConvergenceGraph::routeAfterValidation),
                        Map.of("analyze", "analyze",
                                "finalize", "finalize"))
                .addEdge("analyze", "work")
                .addEdge("finalize", END);

        this.compiledGraph = graph.compile(CompileConfig.builder().build());
        log.info("Convergence graph compiled");
    }

    /**
     * Routes after validate: a terminal status finalizes, anything else analyzes and iterates.
     */
    static String routeAfterValidation(LoopState state) {
        LoopStatus status = state.status();
        if (status == LoopStatus.DONE_PASS || status == LoopStatus.DONE_CEILING) {
            return "finalize";
        }
        return "analyze";
    }

    /**
     * Runs the loop to completion. The step budget is sized to the iteration ceiling so the
     * graph never stops before the loop does.
     */
    public Optional<LoopState> invoke(Map<String, Object> initialState, String runId, int maxIterations) {
        compiledGraph.setMaxIterations(FIXED_STEPS + STEPS_PER_ITERATION * Math.max(1, maxIterations));
        var config = RunnableConfig.builder()
                .threadId(runId)
                .build();
        return compiledGraph.invoke(initialState, config);
    }

    public CompiledGraph<LoopState> getCompiledGraph() {
        return compiledGraph;
    }
}
