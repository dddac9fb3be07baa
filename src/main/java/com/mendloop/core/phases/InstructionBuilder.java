package com.mendloop.core.phases;

import com.mendloop.core.analysis.RegressionDetector.Regression;
import com.mendloop.core.model.PhaseContext;
import com.mendloop.core.model.TaskDescriptor;
import com.mendloop.core.model.TaskWork;
import com.mendloop.core.model.ValidationResult;
import com.mendloop.core.model.ValidationResult.FailedItem;

import java.util.List;

/**
 * Builds the markdown payload handed to a worker for each phase.
 * Pure functions, no Spring dependencies.
 */
public final class InstructionBuilder {

    static final int MAX_LISTED_FAILURES = 50;

    private InstructionBuilder() {}

    public static String proposeFix(TaskDescriptor task, String planPath, PhaseContext context) {
        var sb = new StringBuilder();
        sb.append("# Propose Fix: ").append(task.identity()).append("\n\n");
        appendTask(sb, task);

        sb.append("## Objective\n\n");
        sb.append("Study the source and write a concrete, step-by-step repair plan for this task. ");
        sb.append("Do not modify any source file in this step.\n\n");

        appendGuidance(sb, context);

        sb.append("## Output\n\n");
        sb.append("- Write the plan as markdown to `").append(planPath).append("`\n");
        sb.append("- Exit with code 0 only when the plan file was written\n");
        return sb.toString();
    }

    public static String scaffoldHarness(List<TaskDescriptor> tasks, String harnessPath) {
        var sb = new StringBuilder();
        sb.append("# Scaffold Check Harness\n\n");
        sb.append("## Objective\n\n");
        sb.append("Set up the shared verification harness that the per-task checks will use ");
        sb.append("for the ").append(tasks.size()).append(" task(s) below.\n\n");

        sb.append("## Tasks\n\n");
        for (TaskDescriptor task : tasks) {
            sb.append("- `").append(task.identity()).append("`");
            if (!task.category().isEmpty()) {
                sb.append(" (").append(task.category()).append(")");
            }
            sb.append("\n");
        }
        sb.append("\n");

        sb.append("## Output\n\n");
        sb.append("- Describe the harness and how to run it in `").append(harnessPath).append("`\n");
        return sb.toString();
    }

    public static String scaffoldCheck(TaskDescriptor task, String checkPath, String harnessPath, PhaseContext context) {
        var sb = new StringBuilder();
        sb.append("# Scaffold Check: ").append(task.identity()).append("\n\n");
        appendTask(sb, task);

        sb.append("## Objective\n\n");
        sb.append("Write a task-specific check that fails while the problem is present ");
        sb.append("and passes once it is repaired. Use the shared harness described in `")
          .append(harnessPath).append("` if it exists.\n\n");

        appendPlan(sb, task, context);

        sb.append("## Output\n\n");
        sb.append("- Write the check, or instructions to run it, to `").append(checkPath).append("`\n");
        return sb.toString();
    }

    public static String applyWork(TaskDescriptor task, PhaseContext context) {
        var sb = new StringBuilder();
        sb.append("# Apply Work: ").append(task.identity())
          .append(" (iteration ").append(context.iteration()).append(")\n\n");
        appendTask(sb, task);

        sb.append("## Objective\n\n");
        sb.append("Repair this task by following its plan. Only modify files related to this task.\n\n");

        appendPlan(sb, task, context);
        appendCheck(sb, task, context);
        appendTaskFailures(sb, task, context);
        appendGuidance(sb, context);

        sb.append("## Constraints\n\n");
        sb.append("- Other tasks are being repaired concurrently; do not touch their files\n");
        sb.append("- Exit with code 0 when the repair is in place\n");
        return sb.toString();
    }

    public static String verifyWork(TaskDescriptor task, PhaseContext context) {
        var sb = new StringBuilder();
        sb.append("# Verify Work: ").append(task.identity())
          .append(" (iteration ").append(context.iteration()).append(")\n\n");
        appendTask(sb, task);

        sb.append("## Objective\n\n");
        sb.append("Re-examine the changes made for this task. Run its check and correct the ");
        sb.append("repair if the check fails.\n\n");

        appendCheck(sb, task, context);
        appendTaskFailures(sb, task, context);
        appendGuidance(sb, context);

        sb.append("## Constraints\n\n");
        sb.append("- Exit with code 0 only when the check passes\n");
        return sb.toString();
    }

    public static String analyzeFailures(int iteration, ValidationResult validation, List<TaskWork> work,
                                         List<Regression> regressions, List<String> oscillating,
                                         PhaseContext context, String guidancePath) {
        var sb = new StringBuilder();
        sb.append("# Analyze Failures: iteration ").append(iteration).append("\n\n");

        sb.append("## Objective\n\n");
        sb.append("Validation did not pass. Work out why and write revised guidance for the ");
        sb.append("next repair iteration. Every task is repaired again, so call out changes ");
        sb.append("that broke previously passing items.\n\n");

        sb.append("## Validation Summary\n\n");
        sb.append("- **Total:** ").append(validation.total()).append("\n");
        sb.append("- **Passed:** ").append(validation.passed()).append("\n");
        sb.append("- **Failed:** ").append(validation.failed()).append("\n\n");

        appendFailures(sb, validation.failedItems());

        long failedJobs = work.stream().filter(w -> !w.succeeded()).count();
        if (failedJobs > 0) {
            sb.append("## Worker Failures\n\n");
            for (TaskWork w : work) {
                if (!w.succeeded()) {
                    sb.append("- `").append(w.task().identity()).append("`");
                    if (w.apply() != null) {
                        sb.append(" apply=").append(w.apply().outcome());
                    }
                    if (w.verify() != null) {
                        sb.append(" verify=").append(w.verify().outcome());
                    }
                    sb.append("\n");
                }
            }
            sb.append("\n");
        }

        appendRegressions(sb, regressions, oscillating);

        if (!context.guidance().isBlank()) {
            sb.append("## Previous Guidance\n\n");
            sb.append(context.guidance()).append("\n\n");
        }

        sb.append("## Output\n\n");
        sb.append("- Write the revised guidance as markdown to `").append(guidancePath).append("`\n");
        return sb.toString();
    }

    /**
     * Guidance used when the analysis job produced nothing: a plain listing of the failures.
     */
    public static String failureDigest(int iteration, ValidationResult validation,
                                       List<Regression> regressions, List<String> oscillating) {
        var sb = new StringBuilder();
        sb.append("# Guidance after iteration ").append(iteration).append("\n\n");
        sb.append(validation.failed()).append(" of ").append(validation.total())
          .append(" validation item(s) failed.\n\n");
        appendFailures(sb, validation.failedItems());
        appendRegressions(sb, regressions, oscillating);
        return sb.toString();
    }

    private static void appendTask(StringBuilder sb, TaskDescriptor task) {
        sb.append("## Task\n\n");
        sb.append("- **Identity:** ").append(task.identity()).append("\n");
        if (!task.category().isEmpty()) {
            sb.append("- **Category:** ").append(task.category()).append("\n");
        }
        if (!task.sourceLocation().isEmpty()) {
            sb.append("- **Source:** `").append(task.sourceLocation()).append("`\n");
        }
        if (!task.originalIdentity().equals(task.identity())) {
            sb.append("- **Validation name:** ").append(task.originalIdentity()).append("\n");
        }
        sb.append("\n");
    }

    private static void appendPlan(StringBuilder sb, TaskDescriptor task, PhaseContext context) {
        String plan = context.planFor(task.identity());
        if (!plan.isBlank()) {
            sb.append("## Plan\n\n").append(plan.strip()).append("\n\n");
        }
    }

    private static void appendCheck(StringBuilder sb, TaskDescriptor task, PhaseContext context) {
        String check = context.checkFor(task.identity());
        if (!check.isBlank()) {
            sb.append("## Check\n\n");
            sb.append("The task-specific check is described in `").append(check).append("`.\n\n");
        }
    }

    private static void appendTaskFailures(StringBuilder sb, TaskDescriptor task, PhaseContext context) {
        if (context.lastValidation() == null) {
            return;
        }
        var failures = context.lastValidation().failuresFor(task);
        if (!failures.isEmpty()) {
            sb.append("## Failing Validation Items\n\n");
            for (FailedItem item : failures) {
                appendItem(sb, item);
            }
            sb.append("\n");
        }
    }

    private static void appendGuidance(StringBuilder sb, PhaseContext context) {
        if (!context.guidance().isBlank()) {
            sb.append("## Guidance From Previous Iterations\n\n");
            sb.append(context.guidance().strip()).append("\n\n");
        }
    }

    private static void appendFailures(StringBuilder sb, List<FailedItem> failures) {
        if (failures.isEmpty()) {
            return;
        }
        sb.append("## Failed Items\n\n");
        int shown = Math.min(failures.size(), MAX_LISTED_FAILURES);
        for (int i = 0; i < shown; i++) {
            appendItem(sb, failures.get(i));
        }
        if (failures.size() > shown) {
            sb.append("- ... and ").append(failures.size() - shown).append(" more\n");
        }
        sb.append("\n");
    }

    private static void appendRegressions(StringBuilder sb, List<Regression> regressions, List<String> oscillating) {
        if (!regressions.isEmpty()) {
            sb.append("## Regressions\n\n");
            sb.append("These items passed in the previous iteration and fail now:\n\n");
            for (Regression regression : regressions) {
                sb.append("- `").append(regression.name()).append("`");
                if (regression.message() != null && !regression.message().isBlank()) {
                    sb.append(": ").append(firstLine(regression.message()));
                }
                sb.append("\n");
            }
            sb.append("\n");
        }
        if (!oscillating.isEmpty()) {
            sb.append("## Oscillating Items\n\n");
            sb.append("These items alternate between two failures across iterations; ");
            sb.append("change the approach rather than repeating an earlier fix:\n\n");
            for (String name : oscillating) {
                sb.append("- `").append(name).append("`\n");
            }
            sb.append("\n");
        }
    }

    private static void appendItem(StringBuilder sb, FailedItem item) {
        sb.append("- `").append(item.name()).append("`");
        if (item.message() != null && !item.message().isBlank()) {
            sb.append(": ").append(firstLine(item.message()));
        }
        sb.append("\n");
    }

    private static String firstLine(String text) {
        String stripped = text.strip();
        int newline = stripped.indexOf('\n');
        return newline < 0 ? stripped : stripped.substring(0, newline) + " ...";
    }
}
