package com.taskflow.core.engine;

import com.taskflow.core.audit.Reconciler;
import com.taskflow.core.audit.ReconciliationReport;
import com.taskflow.core.dispatch.SubAgentDispatcher;
import com.taskflow.core.gate.GateController;
import com.taskflow.core.gate.GateOutcome;
import com.taskflow.core.model.ChangelogEntry;
import com.taskflow.core.model.GateId;
import com.taskflow.core.model.HandoverNote;
import com.taskflow.core.model.StepState;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskSnapshot;
import com.taskflow.core.model.TaskSpec;
import com.taskflow.core.model.TaskStatus;
import com.taskflow.core.model.Verdict;
import com.taskflow.core.persistence.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * The operator command surface shared by the CLI and the REST API.
 * <p>
 * Every command takes an explicit task id and is safe to re-run: gates already passed are
 * reported as such and skipped, so no side effect is executed twice. Commands that walk
 * several gates stop at the first one that does not approve.
 */
@Service
public class LifecycleService {

    private static final Logger log = LoggerFactory.getLogger(LifecycleService.class);

    static final List<GateId> PLAN_GATES = List.of(
            GateId.REQUIREMENTS, GateId.TEST_PLAN, GateId.TECHNICAL_REVIEW, GateId.SPLIT_EVALUATION);
    static final List<GateId> REVIEW_GATES = List.of(GateId.CHANGE_REQUEST, GateId.CODE_REVIEW);

    private final TaskStore taskStore;
    private final GateController gateController;
    private final SubAgentDispatcher dispatcher;
    private final Reconciler reconciler;
    private final Clock clock;

    public LifecycleService(TaskStore taskStore,
                            GateController gateController,
                            SubAgentDispatcher dispatcher,
                            Reconciler reconciler,
                            Clock clock) {
        this.taskStore = taskStore;
        this.gateController = gateController;
        this.dispatcher = dispatcher;
        this.reconciler = reconciler;
        this.clock = clock;
    }

    // ── Lifecycle commands ───────────────────────────────────────────────

    public CommandReport createTask(TaskSpec spec, boolean keepDraft, String identity) {
        var task = taskStore.create(spec);
        var messages = new ArrayList<String>();
        messages.add("Created " + task.id());
        if (!keepDraft) {
            task = gateController.submitDraft(task.id(), identity);
            messages.add("Submitted for requirements review");
        }
        return new CommandReport("create-task", task, List.of(), messages);
    }

    /**
     * Requirements and test plan sign-off by the operator, then technical review and split
     * evaluation by their agents. A draft is submitted first.
     */
    public CommandReport reviewPlan(String taskId, String identity, OperatorPrompt prompt) {
        var messages = new ArrayList<String>();
        if (taskStore.load(taskId).status() == TaskStatus.DRAFT) {
            gateController.submitDraft(taskId, identity);
            messages.add("Draft submitted for requirements review");
        }
        return runGates("review-plan", taskId, PLAN_GATES, identity, prompt, messages);
    }

    public CommandReport startImplementation(String taskId, String identity, OperatorPrompt prompt) {
        return runGates("start-implementation", taskId, List.of(GateId.IMPLEMENTATION_START),
                identity, prompt, new ArrayList<>());
    }

    /**
     * Records completion of a step (when given) with a changelog entry from the changelog
     * writer, then reports the next pending step. Completing a step that is already
     * finished is a no-op.
     *
     * @param stepIndex 0-based index of the finished step; messages number steps from 1
     */
    public CommandReport continueImplementation(String taskId, Integer stepIndex, String evidence, String identity) {
        var task = taskStore.load(taskId);
        var messages = new ArrayList<String>();
        if (task.status() != TaskStatus.IN_PROGRESS) {
            messages.add("Task is " + task.status() + "; implementation steps can only be recorded while IN_PROGRESS");
            return new CommandReport("continue-implementation", task, List.of(), messages);
        }

        if (stepIndex != null) {
            if (stepIndex < 0 || stepIndex >= task.steps().size()) {
                throw new IllegalArgumentException("Task %s has no step %d (it has %d)"
                        .formatted(taskId, stepIndex + 1, task.steps().size()));
            }
            var step = task.steps().get(stepIndex);
            if (step.state().isFinished()) {
                messages.add("Step " + (stepIndex + 1) + " already " + step.state());
            } else {
                taskStore.updateStep(taskId, stepIndex, StepState.DONE, evidence);
                var entry = dispatcher.describeChange(taskId, stepIndex);
                log.info("Step {} of {} completed by {}", stepIndex, taskId, identity);
                messages.add("Step %d done: %s".formatted(stepIndex + 1, entry.summary()));
            }
        }

        task = taskStore.load(taskId);
        var next = task.nextPendingStep();
        if (next.isPresent()) {
            var step = task.steps().get(next.get());
            messages.add("Next step %d: %s".formatted(next.get() + 1, step.description()));
            if (step.acceptanceCriteria() != null && !step.acceptanceCriteria().isBlank()) {
                messages.add("Acceptance: " + step.acceptanceCriteria());
            }
        } else {
            messages.add("All steps finished; run start-review");
        }
        return new CommandReport("continue-implementation", task, List.of(), messages);
    }

    public CommandReport prepareHandover(String taskId, String summary, List<String> nextSteps,
                                         List<String> openQuestions, String identity) {
        var now = clock.instant();
        var note = new HandoverNote(identity, now, summary, nextSteps, openQuestions);
        var task = taskStore.update(taskId, current -> current.toBuilder()
                .handover(note)
                .addChangelog(new ChangelogEntry(now, "handover", "Handover prepared",
                        nextSteps.size() + " next step(s), " + openQuestions.size() + " open question(s)", identity))
                .build());
        return new CommandReport("prepare-handover", task, List.of(), List.of("Handover written"));
    }

    public CommandReport startReview(String taskId, String identity) {
        return runGates("start-review", taskId, REVIEW_GATES, identity, null, new ArrayList<>());
    }

    public CommandReport updateDocumentation(String taskId, String identity) {
        return runGates("update-documentation", taskId, List.of(GateId.DOCUMENTATION), identity, null, new ArrayList<>());
    }

    public CommandReport merge(String taskId, String identity, OperatorPrompt prompt) {
        return runGates("merge", taskId, List.of(GateId.MERGE), identity, prompt, new ArrayList<>());
    }

    // ── Operator commands ────────────────────────────────────────────────

    public Task status(String taskId) {
        return taskStore.load(taskId);
    }

    public List<Task> list() {
        return taskStore.list();
    }

    public Task block(String taskId, String reason, String identity) {
        return gateController.block(taskId, reason, identity);
    }

    public Task unblock(String taskId, String identity) {
        return gateController.clearBlock(taskId, identity);
    }

    public Task override(String taskId, GateId gate, String identity) {
        return gateController.overrideStuckGate(taskId, gate, identity);
    }

    public Task archive(String taskId, String identity) {
        return gateController.archive(taskId, identity);
    }

    public GateOutcome confirm(String taskId, GateId gate, String identity) {
        return gateController.confirmHumanGate(taskId, gate, identity);
    }

    public ReconciliationReport reconcile(String taskId, boolean repair) {
        return reconciler.reconcile(taskId, repair);
    }

    public List<ReconciliationReport> reconcileAll(boolean repair) {
        return reconciler.reconcileAll(repair);
    }

    // ── Internals ────────────────────────────────────────────────────────

    private CommandReport runGates(String command, String taskId, List<GateId> gates, String identity,
                                   OperatorPrompt prompt, List<String> messages) {
        var reports = new ArrayList<GateReport>();
        for (var gate : gates) {
            var report = runGate(taskId, gate, identity, prompt);
            reports.add(report);
            if (report.result() != GateReport.Result.APPROVED && report.result() != GateReport.Result.ALREADY_PASSED) {
                break;
            }
        }
        var task = taskStore.load(taskId);
        messages.add("Status: " + task.status());
        return new CommandReport(command, task, reports, messages);
    }

    private GateReport runGate(String taskId, GateId gate, String identity, OperatorPrompt prompt) {
        var task = taskStore.load(taskId);
        if (task.hasPassed(gate)) {
            return new GateReport(gate, GateReport.Result.ALREADY_PASSED, "gate already passed");
        }
        if (!gate.isHumanGate()) {
            return toReport(gateController.enterGate(taskId, gate));
        }

        gateController.checkReady(task, gate);
        var decision = prompt.confirm(TaskSnapshot.of(task), gate);
        return switch (decision.kind()) {
            case APPROVE -> toReport(gateController.confirmHumanGate(taskId, gate, identity));
            case REVISE -> {
                ensureOpen(task, gate);
                yield toReport(gateController.recordVerdict(taskId, gate, Verdict.NEEDS_REVISION,
                        identity + ": " + decision.note()));
            }
            case DEFER -> {
                ensureOpen(task, gate);
                yield new GateReport(gate, GateReport.Result.AWAITING_CONFIRMATION, "awaiting operator confirmation");
            }
        };
    }

    private void ensureOpen(Task task, GateId gate) {
        if (task.openInvocation().filter(i -> i.gateId() == gate).isEmpty()) {
            gateController.enterGate(task.id(), gate);
        }
    }

    private static GateReport toReport(GateOutcome outcome) {
        if (outcome.awaitingConfirmation()) {
            return new GateReport(outcome.gate(), GateReport.Result.AWAITING_CONFIRMATION, "awaiting operator confirmation");
        }
        var result = switch (outcome.verdict()) {
            case APPROVED -> GateReport.Result.APPROVED;
            case NEEDS_REVISION -> GateReport.Result.NEEDS_REVISION;
            case REJECTED -> GateReport.Result.REJECTED;
        };
        return new GateReport(outcome.gate(), result, outcome.invocation().note());
    }
}
