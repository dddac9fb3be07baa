package com.mendloop.core.state;

import com.mendloop.core.model.IterationState;
import com.mendloop.core.model.LoopCheckpoint;
import com.mendloop.core.model.LoopPhase;
import com.mendloop.core.model.LoopStatus;
import com.mendloop.core.model.PhaseContext;
import com.mendloop.core.model.ResumePoint;
import com.mendloop.core.model.TaskDescriptor;
import com.mendloop.core.model.TaskWork;
import com.mendloop.core.model.ValidationResult;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for the convergence loop.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. {@code history} and
 * {@code setupWarnings} use appender channels: nodes return only the new entries.
 */
public class LoopState extends AgentState {

    static final String HISTORY = "history";
    static final String SETUP_WARNINGS = "setupWarnings";

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Scalar channels ──────────────────────────────────────────
        Map.entry("runId",             Channels.base(() -> "")),
        Map.entry("status",            Channels.base(() -> LoopStatus.SETUP.name())),
        Map.entry("iteration",         Channels.base(() -> 1)),
        Map.entry("maxIterations",     Channels.base(() -> 1)),
        Map.entry("tasks",             Channels.base((Supplier<List<TaskDescriptor>>) List::of)),
        Map.entry("context",           Channels.base((Reducer<PhaseContext>) null)),
        Map.entry("resumePhase",       Channels.base(() -> LoopPhase.PROPOSE_FIX.name())),
        Map.entry("resumeIteration",   Channels.base(() -> 1)),
        Map.entry("currentWork",       Channels.base((Supplier<List<TaskWork>>) List::of)),
        Map.entry("reportPath",        Channels.base(() -> "")),

        // ── Appender channels (list accumulation) ────────────────────
        Map.entry(HISTORY,             Channels.appender(ArrayList::new)),
        Map.entry(SETUP_WARNINGS,      Channels.appender(ArrayList::new))
    );

    public LoopState(Map<String, Object> initData) {
        super(initData);
    }

    // ── Scalar accessors ─────────────────────────────────────────────

    public String runId() {
        return this.<String>value("runId").orElse("");
    }

    public LoopStatus status() {
        return LoopStatus.valueOf(this.<String>value("status").orElse(LoopStatus.SETUP.name()));
    }

    public int iteration() {
        return this.<Integer>value("iteration").orElse(1);
    }

    public int maxIterations() {
        return this.<Integer>value("maxIterations").orElse(1);
    }

    public List<TaskDescriptor> tasks() {
        return this.<List<TaskDescriptor>>value("tasks").orElse(List.of());
    }

    public PhaseContext context() {
        return this.<PhaseContext>value("context").orElseGet(() -> PhaseContext.initial(iteration()));
    }

    public ResumePoint resumePoint() {
        var phase = LoopPhase.valueOf(this.<String>value("resumePhase").orElse(LoopPhase.PROPOSE_FIX.name()));
        return new ResumePoint(phase, this.<Integer>value("resumeIteration").orElse(1));
    }

    public List<TaskWork> currentWork() {
        return this.<List<TaskWork>>value("currentWork").orElse(List.of());
    }

    public String reportPath() {
        return this.<String>value("reportPath").orElse("");
    }

    // ── List accessors ───────────────────────────────────────────────

    public List<IterationState> history() {
        return this.<List<IterationState>>value(HISTORY).orElse(List.of());
    }

    public List<String> setupWarnings() {
        return this.<List<String>>value(SETUP_WARNINGS).orElse(List.of());
    }

    /** Validation of the latest completed iteration, if any. */
    public Optional<ValidationResult> latestValidation() {
        var history = history();
        return history.isEmpty() ? Optional.empty() : Optional.ofNullable(history.get(history.size() - 1).validation());
    }

    /**
     * The state a node's output will produce once the graph merges it: scalar keys are
     * replaced, appender keys are extended. Used to checkpoint before the node returns.
     */
    @SuppressWarnings("unchecked")
    public LoopState withUpdates(Map<String, Object> updates) {
        var merged = new HashMap<>(data());
        updates.forEach((key, value) -> {
            if ((HISTORY.equals(key) || SETUP_WARNINGS.equals(key)) && value instanceof List<?> added) {
                var list = new ArrayList<Object>((List<Object>) merged.getOrDefault(key, List.of()));
                list.addAll(added);
                merged.put(key, list);
            } else {
                merged.put(key, value);
            }
        });
        return new LoopState(merged);
    }

    public LoopCheckpoint toCheckpoint(LoopPhase completedPhase) {
        return new LoopCheckpoint(runId(), status(), completedPhase, iteration(), maxIterations(),
                context(), currentWork(), history(), setupWarnings(), Instant.now());
    }

    /**
     * Initial graph input. Restored checkpoints pass their history and warnings,
     * fresh runs pass empty lists.
     */
    public static Map<String, Object> initialData(String runId, List<TaskDescriptor> tasks, int maxIterations,
                                                  ResumePoint resumePoint, LoopStatus status,
                                                  PhaseContext context, List<TaskWork> currentWork,
                                                  List<IterationState> history, List<String> setupWarnings) {
        var data = new HashMap<String, Object>();
        data.put("runId", runId);
        data.put("tasks", List.copyOf(tasks));
        data.put("maxIterations", maxIterations);
        data.put("iteration", resumePoint.iteration());
        data.put("resumePhase", resumePoint.phase().name());
        data.put("resumeIteration", resumePoint.iteration());
        data.put("status", status.name());
        data.put("context", context.withIteration(resumePoint.iteration()));
        data.put("currentWork", List.copyOf(currentWork));
        data.put(HISTORY, new ArrayList<>(history));
        data.put(SETUP_WARNINGS, new ArrayList<>(setupWarnings));
        return data;
    }
}
