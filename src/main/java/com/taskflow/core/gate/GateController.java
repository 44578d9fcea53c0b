package com.taskflow.core.gate;

import com.taskflow.core.config.TaskflowProperties;
import com.taskflow.core.dispatch.DispatchResult;
import com.taskflow.core.dispatch.SubAgentDispatcher;
import com.taskflow.core.logging.MdcContext;
import com.taskflow.core.metrics.TaskflowMetrics;
import com.taskflow.core.model.ChangeRequestDraft;
import com.taskflow.core.model.ChangelogEntry;
import com.taskflow.core.model.GateId;
import com.taskflow.core.model.GateInvocation;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskSnapshot;
import com.taskflow.core.model.TaskStatus;
import com.taskflow.core.model.Verdict;
import com.taskflow.core.persistence.TaskStore;
import com.taskflow.core.sync.ExternalSyncService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * The task state machine and the only writer of status, passed gates, invocations and
 * revision state.
 * <p>
 * Gates fire strictly in {@link GateId} order. Entering a gate persists an open
 * {@link GateInvocation} before anything else happens; agent gates then dispatch and record
 * the agent's verdict, operator gates wait for {@link #confirmHumanGate}. At most one
 * invocation is open per task, which is checked against the loaded task and made safe by
 * the store's version check rather than by locking.
 * <p>
 * An approved gate advances the status first and mirrors it externally afterwards; sync
 * failures are recorded for reconciliation and never undo the transition.
 */
@Service
public class GateController {

    private static final Logger log = LoggerFactory.getLogger(GateController.class);

    private static final String SYSTEM = "system";

    private final TaskStore taskStore;
    private final SubAgentDispatcher dispatcher;
    private final ExternalSyncService syncService;
    private final TaskflowMetrics metrics;
    private final Clock clock;
    private final int maxRevisions;

    public GateController(TaskStore taskStore,
                          SubAgentDispatcher dispatcher,
                          ExternalSyncService syncService,
                          TaskflowProperties properties,
                          TaskflowMetrics metrics,
                          Clock clock) {
        this.taskStore = taskStore;
        this.dispatcher = dispatcher;
        this.syncService = syncService;
        this.metrics = metrics;
        this.clock = clock;
        this.maxRevisions = properties.getGates().getMaxRevisions();
    }

    // ── Submission ───────────────────────────────────────────────────────

    /**
     * Moves a draft into requirements review. Not a gate: the operator's confirmation is
     * recorded in the changelog instead.
     */
    public Task submitDraft(String taskId, String identity) {
        MdcContext.setTask(taskId);
        try {
            var task = taskStore.load(taskId);
            if (task.status() != TaskStatus.DRAFT) {
                throw new OutOfOrderGateException(taskId, null, "only a DRAFT can be submitted, status is " + task.status());
            }
            var now = clock.instant();
            var saved = taskStore.save(task.toBuilder()
                    .status(TaskStatus.REQUIREMENTS_REVIEW)
                    .addChangelog(new ChangelogEntry(now, "submission", "Draft confirmed for requirements review",
                            transition(TaskStatus.DRAFT, TaskStatus.REQUIREMENTS_REVIEW), identity))
                    .build());
            log.info("Task {} submitted by {}", taskId, identity);
            syncService.syncStatus(saved, saved.status());
            return taskStore.load(taskId);
        } finally {
            MdcContext.clear();
        }
    }

    // ── Gates ────────────────────────────────────────────────────────────

    /**
     * Opens a new invocation for {@code gate}. For agent gates, dispatches and records the
     * verdict before returning; a dispatch error is recorded as a system-authored
     * NEEDS_REVISION.
     *
     * @throws OutOfOrderGateException if the task is not at the gate's entry status, the gate
     *                                 was already passed or another invocation is open
     * @throws StuckGateException      if the gate is stuck, or becomes stuck with this verdict
     */
    public GateOutcome enterGate(String taskId, GateId gate) {
        MdcContext.setGate(taskId, gate);
        try {
            var task = taskStore.load(taskId);
            checkCanEnter(task, gate);

            var invocation = GateInvocation.open(task, gate, clock.instant());
            var saved = taskStore.save(task.toBuilder().addInvocation(invocation).build());
            log.info("Entered gate {} on task {} ({})", gate.key(), taskId,
                    gate.isHumanGate() ? "awaiting confirmation" : "dispatching " + gate.agent());

            if (gate.isHumanGate()) {
                return new GateOutcome(saved, gate, invocation, null);
            }

            var result = dispatcher.dispatch(gate.agent(), invocation.inputSnapshot());
            if (result.failed()) {
                return decide(taskId, gate, Verdict.NEEDS_REVISION,
                        "Dispatch error (" + result.error().describe() + ")", null, true, result);
            }
            return decide(taskId, gate, result.verdict(), result.note(), null, false, result);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Records a verdict on the open invocation of {@code gate}.
     *
     * @throws OutOfOrderGateException if no invocation of the gate is open
     * @throws StuckGateException      if a NEEDS_REVISION pushes the gate over its revision limit
     */
    public GateOutcome recordVerdict(String taskId, GateId gate, Verdict verdict, String note) {
        MdcContext.setGate(taskId, gate);
        try {
            return decide(taskId, gate, verdict, note, null, false, null);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Approves an operator gate on behalf of {@code identity}, opening the invocation first
     * when none is open.
     */
    public GateOutcome confirmHumanGate(String taskId, GateId gate, String identity) {
        if (!gate.isHumanGate()) {
            throw new OutOfOrderGateException(taskId, gate, "gate is decided by " + gate.agent() + ", not by an operator");
        }
        var task = taskStore.load(taskId);
        boolean open = task.openInvocation().filter(i -> i.gateId() == gate).isPresent();
        if (!open) {
            enterGate(taskId, gate);
        }
        MdcContext.setGate(taskId, gate);
        try {
            return decide(taskId, gate, Verdict.APPROVED, "Confirmed by " + identity, identity, false, null);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Throws if {@code gate} can neither be entered nor decided on {@code task} right now. An
     * invocation already open for this gate counts as ready.
     *
     * @throws OutOfOrderGateException if the gate is out of order or another invocation is open
     * @throws StuckGateException      if the gate is stuck
     */
    public void checkReady(Task task, GateId gate) {
        if (task.openInvocation().filter(i -> i.gateId() == gate).isPresent()) {
            return;
        }
        checkCanEnter(task, gate);
    }

    // ── Side states ──────────────────────────────────────────────────────

    /**
     * Cancels work on an active task. Any open invocation is abandoned. An agent call still
     * running for it is not recorded when it returns: its {@link #enterGate} call fails with
     * {@link OutOfOrderGateException} ("no open invocation") and the task stays blocked.
     */
    public Task block(String taskId, String reason, String identity) {
        MdcContext.setTask(taskId);
        try {
            var task = taskStore.load(taskId);
            if (task.status() == TaskStatus.BLOCKED) {
                return task;
            }
            if (!task.status().isActive()) {
                throw new OutOfOrderGateException(taskId, null, "cannot block a task in status " + task.status());
            }
            var now = clock.instant();
            var builder = task.toBuilder()
                    .status(TaskStatus.BLOCKED)
                    .blockedFrom(task.status())
                    .addChangelog(new ChangelogEntry(now, "lifecycle", "Blocked: " + reason,
                            transition(task.status(), TaskStatus.BLOCKED), identity));
            task.openInvocation().ifPresent(open -> builder.replaceInvocation(open.abandon("Cancelled: " + reason, now)));

            var saved = taskStore.save(builder.build());
            log.warn("Task {} blocked by {}: {}", taskId, identity, reason);
            syncService.syncStatus(saved, TaskStatus.BLOCKED);
            return taskStore.load(taskId);
        } finally {
            MdcContext.clear();
        }
    }

    public Task clearBlock(String taskId, String identity) {
        MdcContext.setTask(taskId);
        try {
            var task = taskStore.load(taskId);
            if (task.status() != TaskStatus.BLOCKED || task.blockedFrom() == null) {
                throw new OutOfOrderGateException(taskId, null, "task is not blocked");
            }
            var resumed = task.blockedFrom();
            var saved = taskStore.save(task.toBuilder()
                    .status(resumed)
                    .blockedFrom(null)
                    .addChangelog(new ChangelogEntry(clock.instant(), "lifecycle", "Block cleared",
                            transition(TaskStatus.BLOCKED, resumed), identity))
                    .build());
            log.info("Task {} unblocked by {}, resuming at {}", taskId, identity, resumed);
            syncService.syncStatus(saved, resumed);
            return taskStore.load(taskId);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * The manual override for a stuck gate: clears the stuck marker and the revision count
     * so the gate can be entered again.
     */
    public Task overrideStuckGate(String taskId, GateId gate, String identity) {
        MdcContext.setGate(taskId, gate);
        try {
            var task = taskStore.load(taskId);
            if (task.stuckGate() != gate) {
                throw new OutOfOrderGateException(taskId, gate, "gate is not stuck");
            }
            int revisions = task.revisionCount(gate);
            var saved = taskStore.save(task.toBuilder()
                    .stuckGate(null)
                    .resetRevisions(gate)
                    .addChangelog(new ChangelogEntry(clock.instant(), "gate:" + gate.key(),
                            "Manual override of stuck gate after " + revisions + " revision(s)",
                            "revision count reset", identity))
                    .build());
            log.warn("Stuck gate {} of task {} overridden by {} after {} revision(s)",
                    gate.key(), taskId, identity, revisions);
            return saved;
        } finally {
            MdcContext.clear();
        }
    }

    public Task archive(String taskId, String identity) {
        MdcContext.setTask(taskId);
        try {
            var task = taskStore.load(taskId);
            if (task.status() == TaskStatus.ARCHIVED) {
                return task;
            }
            var now = clock.instant();
            var builder = task.toBuilder()
                    .status(TaskStatus.ARCHIVED)
                    .blockedFrom(null)
                    .addChangelog(new ChangelogEntry(now, "lifecycle", "Archived",
                            transition(task.status(), TaskStatus.ARCHIVED), identity));
            task.openInvocation().ifPresent(open -> builder.replaceInvocation(open.abandon("Archived", now)));
            log.info("Task {} archived by {}", taskId, identity);
            return taskStore.save(builder.build());
        } finally {
            MdcContext.clear();
        }
    }

    // ── Internals ────────────────────────────────────────────────────────

    private void checkCanEnter(Task task, GateId gate) {
        if (task.stuckGate() == gate) {
            throw new StuckGateException(task.id(), gate, task.revisionCount(gate));
        }
        if (task.hasPassed(gate)) {
            throw new OutOfOrderGateException(task.id(), gate, "gate already passed");
        }
        if (task.status() != gate.entryStatus()) {
            throw new OutOfOrderGateException(task.id(), gate,
                    "task is %s, gate requires %s".formatted(task.status(), gate.entryStatus()));
        }
        var predecessor = gate.predecessor();
        if (predecessor.isPresent() && !task.hasPassed(predecessor.get())) {
            throw new OutOfOrderGateException(task.id(), gate,
                    "predecessor gate " + predecessor.get().key() + " not passed");
        }
        var open = task.openInvocation();
        if (open.isPresent()) {
            throw new OutOfOrderGateException(task.id(), gate,
                    "invocation for gate " + open.get().gateId().key() + " is still open");
        }
    }

    private GateOutcome decide(String taskId, GateId gate, Verdict verdict, String note,
                               String confirmer, boolean bySystem, DispatchResult dispatch) {
        var task = taskStore.load(taskId);
        var open = task.openInvocation()
                .filter(i -> i.gateId() == gate)
                .orElseThrow(() -> new OutOfOrderGateException(taskId, gate, "no open invocation for this gate"));

        var now = clock.instant();
        var decided = open.decide(verdict, note, confirmer, bySystem, now);
        var author = confirmer != null ? confirmer
                : bySystem || open.invokedAgent() == null ? SYSTEM : open.invokedAgent().name();
        var builder = task.toBuilder().replaceInvocation(decided);
        metrics.recordVerdict(gate, verdict);

        return switch (verdict) {
            case APPROVED -> approve(task, gate, decided, builder, author, now, dispatch);
            case NEEDS_REVISION -> requestRevision(task, gate, decided, builder, author, now, dispatch);
            case REJECTED -> reject(task, gate, decided, builder, author, now, dispatch);
        };
    }

    private GateOutcome approve(Task task, GateId gate, GateInvocation decided, Task.Builder builder,
                                String author, Instant now, DispatchResult dispatch) {
        var saved = taskStore.save(builder
                .status(gate.exitStatus())
                .addGatePassed(gate)
                .resetRevisions(gate)
                .addChangelog(new ChangelogEntry(now, "gate:" + gate.key(), "Gate passed" + noteSuffix(decided.note()),
                        transition(task.status(), gate.exitStatus()), author))
                .build());
        log.info("Gate {} passed on task {}: {}", gate.key(), task.id(), transition(task.status(), gate.exitStatus()));

        runSyncPlan(saved, gate, dispatch);
        return new GateOutcome(taskStore.load(task.id()), gate, decided, dispatch);
    }

    private GateOutcome requestRevision(Task task, GateId gate, GateInvocation decided, Task.Builder builder,
                                        String author, Instant now, DispatchResult dispatch) {
        int revisions = task.revisionCount(gate) + 1;
        metrics.recordRevisionDepth(gate, revisions);
        builder.status(gate.entryStatus())
                .incrementRevisions(gate)
                .addChangelog(new ChangelogEntry(now, "gate:" + gate.key(),
                        "Revision requested (%d/%d)%s".formatted(revisions, maxRevisions, noteSuffix(decided.note())),
                        "status stays " + gate.entryStatus(), author));

        if (revisions > maxRevisions) {
            taskStore.save(builder
                    .stuckGate(gate)
                    .addChangelog(new ChangelogEntry(now, "gate:" + gate.key(),
                            "Gate stuck after " + revisions + " revision requests",
                            "manual override required", SYSTEM))
                    .build());
            metrics.incrementStuckGates(gate);
            log.warn("Gate {} on task {} is stuck after {} revision requests", gate.key(), task.id(), revisions);
            throw new StuckGateException(task.id(), gate, revisions);
        }

        var saved = taskStore.save(builder.build());
        log.warn("Gate {} on task {} needs revision ({}/{}): {}", gate.key(), task.id(), revisions, maxRevisions,
                decided.note());
        return new GateOutcome(saved, gate, decided, dispatch);
    }

    private GateOutcome reject(Task task, GateId gate, GateInvocation decided, Task.Builder builder,
                               String author, Instant now, DispatchResult dispatch) {
        var saved = taskStore.save(builder
                .status(TaskStatus.BLOCKED)
                .blockedFrom(gate.entryStatus())
                .addChangelog(new ChangelogEntry(now, "gate:" + gate.key(), "Gate rejected" + noteSuffix(decided.note()),
                        transition(task.status(), TaskStatus.BLOCKED), author))
                .build());
        log.warn("Gate {} rejected task {}: {}", gate.key(), task.id(), decided.note());

        syncService.syncStatus(saved, TaskStatus.BLOCKED);
        syncService.comment(saved, "Gate `%s` rejected: %s".formatted(gate.key(), decided.note()));
        return new GateOutcome(taskStore.load(task.id()), gate, decided, dispatch);
    }

    /**
     * External calls mapped to the status just entered, then the status mirror, then a
     * comment. Each call reloads the task because earlier calls may have set references.
     */
    private void runSyncPlan(Task task, GateId gate, DispatchResult dispatch) {
        var entered = gate.exitStatus();
        switch (entered) {
            case READY_FOR_IMPLEMENTATION -> syncService.ensureIssue(task);
            case IN_PROGRESS -> syncService.ensureBranch(task);
            case IN_REVIEW -> {
                var draft = dispatch != null && dispatch.artifacts().changeRequest() != null
                        ? dispatch.artifacts().changeRequest()
                        : ChangeRequestDraft.forTask(TaskSnapshot.of(task));
                syncService.openChangeRequest(task, draft);
            }
            case DONE -> syncService.mergeChangeRequest(task).ifPresent(sha ->
                    taskStore.appendChangelog(task.id(), new ChangelogEntry(clock.instant(), "version control",
                            "Change request merged", "merge commit " + sha, SYSTEM)));
            default -> { }
        }
        var current = taskStore.load(task.id());
        syncService.syncStatus(current, entered);
        syncService.comment(current, "Gate `%s` passed: status is now %s".formatted(gate.key(), entered));
    }

    private static String transition(TaskStatus from, TaskStatus to) {
        return "status " + from + " -> " + to;
    }

    private static String noteSuffix(String note) {
        return note == null || note.isBlank() ? "" : ": " + note;
    }
}
