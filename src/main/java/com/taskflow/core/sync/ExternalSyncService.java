package com.taskflow.core.sync;

import com.taskflow.core.audit.ReconciliationLog;
import com.taskflow.core.metrics.TaskflowMetrics;
import com.taskflow.core.model.ChangeRequestDraft;
import com.taskflow.core.model.ExternalSyncRecord;
import com.taskflow.core.model.SyncOperation;
import com.taskflow.core.model.SyncResult;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskSnapshot;
import com.taskflow.core.model.TaskStatus;
import com.taskflow.core.persistence.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * The only caller of the external adapters.
 * <p>
 * Each call appends one {@link ExternalSyncRecord} to the reconciliation log whatever the
 * outcome. Adapter failures are recorded as {@link SyncResult#FAILED} (or
 * {@link SyncResult#UNKNOWN} when the call timed out) and reported as an empty result; they
 * never reach the caller and never roll back task status. References returned by the
 * adapters are written back to the task once.
 */
@Service
public class ExternalSyncService {

    private static final Logger log = LoggerFactory.getLogger(ExternalSyncService.class);

    private final VersionControlAdapter versionControl;
    private final IssueTrackerAdapter issueTracker;
    private final ReconciliationLog reconciliationLog;
    private final TaskStore taskStore;
    private final TaskflowMetrics metrics;
    private final Clock clock;

    public ExternalSyncService(VersionControlAdapter versionControl,
                               IssueTrackerAdapter issueTracker,
                               ReconciliationLog reconciliationLog,
                               TaskStore taskStore,
                               TaskflowMetrics metrics,
                               Clock clock) {
        this.versionControl = versionControl;
        this.issueTracker = issueTracker;
        this.reconciliationLog = reconciliationLog;
        this.taskStore = taskStore;
        this.metrics = metrics;
        this.clock = clock;
    }

    public Optional<String> ensureBranch(Task task) {
        var branch = call(task.id(), SyncOperation.ENSURE_BRANCH, PayloadHash.ensureBranch(task.id()),
                () -> versionControl.ensureBranch(TaskSnapshot.of(task)));
        branch.filter(ref -> !ref.equals(task.branchRef()))
                .ifPresent(ref -> writeBack(task.id(), "branch", t -> t.withBranchRef(ref)));
        return branch;
    }

    public Optional<String> ensureIssue(Task task) {
        var issue = call(task.id(), SyncOperation.ENSURE_ISSUE, PayloadHash.ensureIssue(task.id()),
                () -> issueTracker.ensureIssue(TaskSnapshot.of(task)));
        issue.filter(ref -> !ref.equals(task.issueRef()))
                .ifPresent(ref -> writeBack(task.id(), "issue", t -> t.withIssueRef(ref)));
        return issue;
    }

    /**
     * Mirrors {@code target} into the issue tracker. Does nothing when the task has no issue
     * or the status has no external name. Skips the write when the tracker already reports
     * the mapped status, so replays after a partial failure are cheap.
     */
    public Optional<String> syncStatus(Task task, TaskStatus target) {
        var external = StatusMapping.externalStatus(target);
        if (external.isEmpty()) {
            log.debug("Status {} is not mirrored externally", target);
            return Optional.empty();
        }
        var issueRef = task.issueRef();
        if (issueRef == null) {
            log.debug("Task {} has no issue yet; status {} not mirrored", task.id(), target);
            return Optional.empty();
        }

        var wanted = external.get();
        return call(task.id(), SyncOperation.SYNC_STATUS, PayloadHash.syncStatus(task.id(), wanted), () -> {
            var current = issueTracker.currentStatus(issueRef);
            if (current.filter(wanted::equals).isPresent()) {
                log.debug("Issue #{} already reports '{}'", issueRef, wanted);
                return wanted;
            }
            issueTracker.setStatus(issueRef, wanted);
            return wanted;
        });
    }

    public Optional<String> openChangeRequest(Task task, ChangeRequestDraft draft) {
        var ref = call(task.id(), SyncOperation.OPEN_CHANGE_REQUEST, PayloadHash.openChangeRequest(task.id()),
                () -> versionControl.openChangeRequest(TaskSnapshot.of(task), draft));
        ref.filter(number -> !number.equals(task.changeRequestRef()))
                .ifPresent(number -> writeBack(task.id(), "change request", t -> t.withChangeRequestRef(number)));
        return ref;
    }

    /**
     * @return the merge commit id
     */
    public Optional<String> mergeChangeRequest(Task task) {
        return call(task.id(), SyncOperation.MERGE_CHANGE_REQUEST, PayloadHash.mergeChangeRequest(task.id()),
                () -> versionControl.mergeChangeRequest(TaskSnapshot.of(task)));
    }

    /**
     * Posts a comment on the task's issue. Delivery is at-least-once; a repeated call may
     * leave a duplicate comment.
     */
    public Optional<String> comment(Task task, String body) {
        var issueRef = task.issueRef();
        if (issueRef == null) {
            return Optional.empty();
        }
        return call(task.id(), SyncOperation.COMMENT, PayloadHash.comment(task.id(), body), () -> {
            issueTracker.comment(issueRef, body);
            return issueRef;
        });
    }

    private Optional<String> call(String taskId, SyncOperation operation, String payloadHash,
                                  Supplier<String> action) {
        try {
            var detail = action.get();
            record(taskId, operation, payloadHash, SyncResult.SUCCESS, detail);
            return Optional.ofNullable(detail);
        } catch (ExternalSyncException e) {
            var result = e.isOutcomeUnknown() ? SyncResult.UNKNOWN : SyncResult.FAILED;
            log.warn("{} for task {} {}: {}", operation, taskId, result, e.getMessage());
            record(taskId, operation, payloadHash, result, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("{} for task {} FAILED unexpectedly: {}", operation, taskId, e.getMessage(), e);
            record(taskId, operation, payloadHash, SyncResult.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private void record(String taskId, SyncOperation operation, String payloadHash,
                        SyncResult result, String detail) {
        reconciliationLog.append(new ExternalSyncRecord(UUID.randomUUID().toString(), taskId,
                operation.target(), operation, payloadHash, result, detail, clock.instant()));
        metrics.recordSync(operation, result);
    }

    private void writeBack(String taskId, String what, UnaryOperator<Task> change) {
        try {
            taskStore.update(taskId, change);
        } catch (IllegalStateException e) {
            // set-once violation: the remote returned a different object than the one recorded
            log.error("Refusing to overwrite {} reference of task {}: {}", what, taskId, e.getMessage());
        }
    }
}
