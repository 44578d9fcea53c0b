package com.taskflow.core.audit;

import com.taskflow.core.logging.MdcContext;
import com.taskflow.core.metrics.TaskflowMetrics;
import com.taskflow.core.model.ChangeRequestDraft;
import com.taskflow.core.model.ExternalSyncRecord;
import com.taskflow.core.model.SyncOperation;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskSnapshot;
import com.taskflow.core.model.TaskStatus;
import com.taskflow.core.persistence.TaskStore;
import com.taskflow.core.sync.ExternalSyncService;
import com.taskflow.core.sync.PayloadHash;
import com.taskflow.core.sync.StatusMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Detects and repairs drift between a task's authoritative status and the external
 * systems that mirror it.
 * <p>
 * The expected external state is derived from the task alone. An expectation is satisfied
 * by any {@code SUCCESS} record carrying the same payload hash; anything else is drift.
 * Repair simply re-issues the sync call, which the adapters treat as an idempotent upsert.
 */
@Service
public class Reconciler {

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    static final int MAX_REPAIR_PASSES = 2;

    private final TaskStore taskStore;
    private final ReconciliationLog reconciliationLog;
    private final ExternalSyncService syncService;
    private final TaskflowMetrics metrics;

    public Reconciler(TaskStore taskStore, ReconciliationLog reconciliationLog,
                      ExternalSyncService syncService, TaskflowMetrics metrics) {
        this.taskStore = taskStore;
        this.reconciliationLog = reconciliationLog;
        this.syncService = syncService;
        this.metrics = metrics;
    }

    public List<Drift> detect(Task task) {
        var records = reconciliationLog.recordsFor(task.id());
        var drift = new ArrayList<Drift>();
        for (var expected : expectationsFor(task)) {
            boolean satisfied = isSatisfied(expected, records);
            if (!satisfied) {
                var last = records.stream()
                        .filter(r -> r.operation() == expected.operation()
                                && r.requestPayloadHash().equals(expected.payloadHash()))
                        .max(Comparator.comparing(ExternalSyncRecord::timestamp));
                drift.add(new Drift(task.id(), expected.operation(), expected.description(),
                        last.map(ExternalSyncRecord::result).orElse(null),
                        last.map(ExternalSyncRecord::detail).orElse(null)));
            }
        }
        return drift;
    }

    /**
     * Status mirroring is an upsert, so only the latest successful status write counts;
     * every other expectation is met by any successful record with the same payload.
     */
    private static boolean isSatisfied(ExpectedSync expected, List<ExternalSyncRecord> records) {
        if (expected.operation() == SyncOperation.SYNC_STATUS) {
            ExternalSyncRecord latest = null;
            for (var r : records) {
                if (r.operation() == SyncOperation.SYNC_STATUS && r.succeeded()) {
                    latest = r;
                }
            }
            return latest != null && latest.requestPayloadHash().equals(expected.payloadHash());
        }
        return records.stream()
                .anyMatch(r -> r.succeeded() && r.requestPayloadHash().equals(expected.payloadHash()));
    }

    public ReconciliationReport reconcile(String taskId, boolean repair) {
        MdcContext.setTask(taskId);
        try {
            var task = taskStore.load(taskId);
            var detected = detect(task);
            metrics.recordDriftFound(detected.size());
            if (detected.isEmpty() || !repair) {
                return new ReconciliationReport(taskId, task.status(), detected, detected);
            }

            log.info("Repairing {} drifted expectation(s) for {}", detected.size(), taskId);
            var remaining = detected;
            var after = task;
            // a repaired issue can expose a status expectation that only applies once the issue exists
            for (int pass = 0; pass < MAX_REPAIR_PASSES && !remaining.isEmpty(); pass++) {
                for (var drift : remaining) {
                    // reload each time: a repaired issue or branch changes the refs the next call needs
                    repairOne(taskStore.load(taskId), drift);
                }
                after = taskStore.load(taskId);
                remaining = detect(after);
            }
            if (!remaining.isEmpty()) {
                log.warn("Task {} still has {} unresolved drift(s) after repair", taskId, remaining.size());
            }
            return new ReconciliationReport(taskId, after.status(), detected, remaining);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Reconciles every task that is not archived. A task that fails is logged and left out
     * of the result; the pass continues with the next one.
     */
    public List<ReconciliationReport> reconcileAll(boolean repair) {
        var reports = new ArrayList<ReconciliationReport>();
        int failed = 0;
        for (var task : taskStore.list()) {
            if (task.status() == TaskStatus.ARCHIVED) {
                continue;
            }
            try {
                reports.add(reconcile(task.id(), repair));
            } catch (RuntimeException e) {
                failed++;
                log.error("Reconciling task {} failed: {}", task.id(), e.getMessage(), e);
            }
        }
        if (failed > 0) {
            log.warn("{} task(s) could not be reconciled in this pass", failed);
        }
        return reports;
    }

    private void repairOne(Task task, Drift drift) {
        switch (drift.operation()) {
            case ENSURE_ISSUE -> syncService.ensureIssue(task);
            case ENSURE_BRANCH -> syncService.ensureBranch(task);
            case OPEN_CHANGE_REQUEST ->
                    syncService.openChangeRequest(task, ChangeRequestDraft.forTask(TaskSnapshot.of(task)));
            case MERGE_CHANGE_REQUEST -> syncService.mergeChangeRequest(task);
            case SYNC_STATUS -> syncService.syncStatus(task, task.status());
            case COMMENT -> log.debug("Comments are at-least-once and not reconciled");
        }
    }

    /**
     * External state implied by the task, in the order it must be repaired.
     */
    List<ExpectedSync> expectationsFor(Task task) {
        if (task.status() == TaskStatus.ARCHIVED) {
            return List.of();
        }
        var progress = task.status() == TaskStatus.BLOCKED && task.blockedFrom() != null
                ? task.blockedFrom() : task.status();
        var id = task.id();
        var expected = new ArrayList<ExpectedSync>();

        if (progress.hasReached(TaskStatus.READY_FOR_IMPLEMENTATION) || task.parentTaskId() != null) {
            expected.add(new ExpectedSync(SyncOperation.ENSURE_ISSUE, PayloadHash.ensureIssue(id), "issue exists"));
        }
        if (progress.hasReached(TaskStatus.IN_PROGRESS)) {
            expected.add(new ExpectedSync(SyncOperation.ENSURE_BRANCH, PayloadHash.ensureBranch(id), "branch exists"));
        }
        if (progress.hasReached(TaskStatus.IN_REVIEW)) {
            expected.add(new ExpectedSync(SyncOperation.OPEN_CHANGE_REQUEST, PayloadHash.openChangeRequest(id),
                    "change request open"));
        }
        if (progress == TaskStatus.DONE) {
            expected.add(new ExpectedSync(SyncOperation.MERGE_CHANGE_REQUEST, PayloadHash.mergeChangeRequest(id),
                    "change request merged"));
        }
        if (task.issueRef() != null) {
            StatusMapping.externalStatus(task.status()).ifPresent(external ->
                    expected.add(new ExpectedSync(SyncOperation.SYNC_STATUS, PayloadHash.syncStatus(id, external),
                            "issue status '" + external + "'")));
        }
        return expected;
    }

    record ExpectedSync(SyncOperation operation, String payloadHash, String description) {}
}
