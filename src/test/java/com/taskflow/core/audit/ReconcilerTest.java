package com.taskflow.core.audit;

import com.taskflow.core.TestHarness;
import com.taskflow.core.model.GateId;
import com.taskflow.core.model.SyncOperation;
import com.taskflow.core.model.TaskStatus;
import com.taskflow.core.persistence.TaskStoreException;
import com.taskflow.core.sync.StatusMapping;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ReconcilerTest {

    private TestHarness h;
    private Reconciler reconciler;

    @BeforeEach
    void setUp() {
        h = new TestHarness();
        reconciler = h.reconciler;
    }

    @AfterEach
    void tearDown() {
        h.close();
    }

    private String passUntil(GateId stop) {
        var id = h.newTask().id();
        h.gates.submitDraft(id, "alice");
        for (var gate : GateId.values()) {
            if (gate == stop) {
                break;
            }
            if (gate.isHumanGate()) {
                h.gates.confirmHumanGate(id, gate, "alice");
            } else {
                h.gates.enterGate(id, gate);
            }
        }
        return id;
    }

    @Test
    @DisplayName("A task whose every sync succeeded has no drift")
    void inSync() {
        var id = passUntil(GateId.CHANGE_REQUEST);

        var report = reconciler.reconcile(id, false);

        assertTrue(report.inSync());
        assertTrue(report.detected().isEmpty());
        assertEquals(TaskStatus.IN_PROGRESS, report.status());
    }

    @Test
    @DisplayName("Early gates imply no external state")
    void noExpectationsBeforeReadyForImplementation() {
        var id = passUntil(GateId.TECHNICAL_REVIEW);
        assertTrue(reconciler.expectationsFor(h.store.load(id)).isEmpty());
    }

    @Test
    @DisplayName("A failed issue creation is reported, then repaired together with the status it unblocks")
    void repairsFailedIssue() {
        h.issues.failEnsureIssue = 1;
        var id = passUntil(GateId.IMPLEMENTATION_START);
        assertNull(h.store.load(id).issueRef());

        var detected = reconciler.reconcile(id, false);
        assertEquals(1, detected.detected().size());
        assertEquals(SyncOperation.ENSURE_ISSUE, detected.detected().get(0).operation());
        assertFalse(detected.detected().get(0).neverAttempted());
        assertFalse(detected.inSync());

        var repaired = reconciler.reconcile(id, true);

        assertTrue(repaired.inSync(), () -> "remaining: " + repaired.remaining());
        assertEquals("1", h.store.load(id).issueRef());
        assertEquals(StatusMapping.READY_FOR_IMPLEMENTATION, h.issues.statusOfTask(id));
        assertEquals(1, h.issues.issuesCreated);
    }

    @Test
    @DisplayName("A failed status write is repaired with the current status")
    void repairsStatus() {
        var id = passUntil(GateId.IMPLEMENTATION_START);
        h.issues.failSetStatus = 1;
        h.gates.confirmHumanGate(id, GateId.IMPLEMENTATION_START, "alice");
        assertEquals(StatusMapping.READY_FOR_IMPLEMENTATION, h.issues.statusOfTask(id));

        var report = reconciler.reconcile(id, true);

        assertEquals(1, report.detected().size());
        assertEquals(SyncOperation.SYNC_STATUS, report.detected().get(0).operation());
        assertTrue(report.inSync());
        assertEquals(StatusMapping.IN_PROGRESS, h.issues.statusOfTask(id));
        assertEquals(1, h.issues.issuesCreated);
        assertEquals(1, h.issues.issuesByTask.size());
    }

    @Test
    @DisplayName("An earlier successful status write does not satisfy a later status")
    void latestStatusWins() {
        var id = passUntil(GateId.IMPLEMENTATION_START);
        h.gates.block(id, "waiting", "alice");
        h.issues.failSetStatus = 1;
        h.gates.clearBlock(id, "alice");

        var drift = reconciler.detect(h.store.load(id));

        assertEquals(1, drift.size());
        assertEquals(SyncOperation.SYNC_STATUS, drift.get(0).operation());
    }

    @Test
    @DisplayName("A merge that timed out is retried without merging twice")
    void repairsMerge() {
        h.vcs.failMerge = 1;
        var id = passUntil(null);
        assertEquals(TaskStatus.DONE, h.store.load(id).status());
        assertTrue(h.vcs.merged.isEmpty());

        var report = reconciler.reconcile(id, true);

        assertTrue(report.detected().stream().anyMatch(d -> d.operation() == SyncOperation.MERGE_CHANGE_REQUEST));
        assertTrue(report.inSync());
        assertEquals(1, h.vcs.merges);
    }

    @Test
    @DisplayName("reconcileAll skips archived tasks")
    void reconcileAllSkipsArchived() {
        var active = passUntil(GateId.TEST_PLAN);
        var archived = h.newTask().id();
        h.gates.archive(archived, "alice");

        var reports = reconciler.reconcileAll(false);

        assertEquals(1, reports.size());
        assertEquals(active, reports.get(0).taskId());
    }

    @Test
    @DisplayName("A task that fails to reconcile does not stop the pass")
    void reconcileAllContinuesAfterFailure() {
        var broken = passUntil(GateId.IMPLEMENTATION_START);
        var healthy = passUntil(GateId.IMPLEMENTATION_START);
        h.issues.failSetStatus = 1;
        h.gates.confirmHumanGate(healthy, GateId.IMPLEMENTATION_START, "alice");
        var store = spy(h.store);
        doThrow(new TaskStoreException("row is corrupt", null)).when(store).load(broken);

        var reports = new Reconciler(store, h.syncLog, h.sync, h.metrics).reconcileAll(true);

        assertEquals(1, reports.size());
        assertEquals(healthy, reports.get(0).taskId());
        assertTrue(reports.get(0).inSync());
        assertEquals(StatusMapping.IN_PROGRESS, h.issues.statusOfTask(healthy));
    }
}
