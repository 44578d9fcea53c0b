package com.taskflow.core.gate;

import com.taskflow.core.TestHarness;
import com.taskflow.core.dispatch.WorkerResult;
import com.taskflow.core.model.AgentName;
import com.taskflow.core.model.GateId;
import com.taskflow.core.model.SyncOperation;
import com.taskflow.core.model.SyncResult;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskStatus;
import com.taskflow.core.model.Verdict;
import com.taskflow.core.sync.StatusMapping;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GateControllerTest {

    private TestHarness h;
    private GateController gates;

    @BeforeEach
    void setUp() {
        h = new TestHarness();
        gates = h.gates;
    }

    @AfterEach
    void tearDown() {
        h.close();
    }

    /** Submits the task and passes every gate before {@code target}. */
    private String advanceTo(GateId target) {
        var id = h.newTask().id();
        gates.submitDraft(id, "alice");
        for (var gate : GateId.values()) {
            if (gate == target) {
                break;
            }
            pass(id, gate);
        }
        return id;
    }

    private void pass(String id, GateId gate) {
        var outcome = gate.isHumanGate()
                ? gates.confirmHumanGate(id, gate, "alice")
                : gates.enterGate(id, gate);
        assertTrue(outcome.advanced(), gate + " should approve");
    }

    private Task load(String id) {
        return h.store.load(id);
    }

    private static void assertGatePrefix(Task task) {
        var canonical = Arrays.asList(GateId.values());
        assertEquals(canonical.subList(0, task.gatesPassed().size()), task.gatesPassed());
    }

    // ── Happy path ───────────────────────────────────────────────────────

    @Test
    @DisplayName("Walking every gate in order ends DONE with all external objects created")
    void fullLifecycle() {
        var id = advanceTo(null);
        var task = load(id);

        assertEquals(TaskStatus.DONE, task.status());
        assertEquals(List.of(GateId.values()), task.gatesPassed());
        assertEquals("1", task.issueRef());
        assertEquals("taskflow/" + id.toLowerCase(), task.branchRef());
        assertEquals("101", task.changeRequestRef());
        assertEquals("sha-" + id, h.vcs.merged.get(id));
        assertEquals(StatusMapping.DONE, h.issues.statusOfTask(id));
        assertTrue(task.changelog().stream().anyMatch(e -> e.effect().equals("merge commit sha-" + id)));
        assertTrue(task.openInvocation().isEmpty());
    }

    @Test
    @DisplayName("submitDraft moves DRAFT to REQUIREMENTS_REVIEW and refuses anything else")
    void submitDraft() {
        var id = h.newTask().id();
        var task = gates.submitDraft(id, "alice");
        assertEquals(TaskStatus.REQUIREMENTS_REVIEW, task.status());
        assertEquals("alice", task.changelog().get(task.changelog().size() - 1).author());

        assertThrows(OutOfOrderGateException.class, () -> gates.submitDraft(id, "alice"));
    }

    @Test
    @DisplayName("Operator gate stays open until confirmed")
    void humanGateWaitsForConfirmation() {
        var id = advanceTo(GateId.REQUIREMENTS);

        var outcome = gates.enterGate(id, GateId.REQUIREMENTS);
        assertTrue(outcome.awaitingConfirmation());
        assertEquals(TaskStatus.REQUIREMENTS_REVIEW, load(id).status());

        var confirmed = gates.confirmHumanGate(id, GateId.REQUIREMENTS, "bob");
        assertEquals(Verdict.APPROVED, confirmed.verdict());
        assertEquals("bob", confirmed.invocation().confirmedBy());
        assertEquals(TaskStatus.TEST_PLAN_REVIEW, confirmed.task().status());
        assertEquals(1, load(id).invocationsFor(GateId.REQUIREMENTS).size());
    }

    // ── Revision loop ────────────────────────────────────────────────────

    @Nested
    @DisplayName("Revision loop")
    class RevisionLoop {

        @Test
        @DisplayName("Three NEEDS_REVISION then APPROVED gives four invocations and advances once")
        void revisesThenApproves() {
            var id = advanceTo(GateId.TECHNICAL_REVIEW);
            h.worker(AgentName.PLAN_REVIEWER)
                    .then(Verdict.NEEDS_REVISION, "missing error handling")
                    .then(Verdict.NEEDS_REVISION, "missing metrics")
                    .then(Verdict.NEEDS_REVISION, "unclear rollback");

            for (int i = 1; i <= 3; i++) {
                var outcome = gates.enterGate(id, GateId.TECHNICAL_REVIEW);
                assertEquals(Verdict.NEEDS_REVISION, outcome.verdict());
                assertEquals(TaskStatus.TECHNICAL_REVIEW, outcome.task().status());
                assertEquals(i, outcome.task().revisionCount(GateId.TECHNICAL_REVIEW));
            }
            var outcome = gates.enterGate(id, GateId.TECHNICAL_REVIEW);

            var task = load(id);
            assertTrue(outcome.advanced());
            assertEquals(TaskStatus.SPLIT_EVALUATION, task.status());
            assertEquals(4, task.invocationsFor(GateId.TECHNICAL_REVIEW).size());
            assertEquals(0, task.revisionCount(GateId.TECHNICAL_REVIEW));
            assertEquals(1, task.gatesPassed().stream().filter(g -> g == GateId.TECHNICAL_REVIEW).count());
        }

        @Test
        @DisplayName("The revision past the limit makes the gate stuck until overridden")
        void stuckGate() {
            var id = advanceTo(GateId.TECHNICAL_REVIEW);
            h.worker(AgentName.PLAN_REVIEWER).always(Verdict.NEEDS_REVISION, "still vague");

            for (int i = 0; i < 5; i++) {
                gates.enterGate(id, GateId.TECHNICAL_REVIEW);
            }
            var stuck = assertThrows(StuckGateException.class, () -> gates.enterGate(id, GateId.TECHNICAL_REVIEW));
            assertEquals(6, stuck.getRevisions());

            var task = load(id);
            assertEquals(GateId.TECHNICAL_REVIEW, task.stuckGate());
            assertEquals(TaskStatus.TECHNICAL_REVIEW, task.status());
            assertTrue(task.openInvocation().isEmpty());

            // no further automatic progress
            assertThrows(StuckGateException.class, () -> gates.enterGate(id, GateId.TECHNICAL_REVIEW));
            assertEquals(6, load(id).invocationsFor(GateId.TECHNICAL_REVIEW).size());

            h.worker(AgentName.PLAN_REVIEWER).always(Verdict.APPROVED, "fine now");
            gates.overrideStuckGate(id, GateId.TECHNICAL_REVIEW, "lead");
            assertNull(load(id).stuckGate());
            assertTrue(gates.enterGate(id, GateId.TECHNICAL_REVIEW).advanced());
        }

        @Test
        @DisplayName("Override refuses a gate that is not stuck")
        void overrideRequiresStuckGate() {
            var id = advanceTo(GateId.TECHNICAL_REVIEW);
            assertThrows(OutOfOrderGateException.class,
                    () -> gates.overrideStuckGate(id, GateId.TECHNICAL_REVIEW, "lead"));
        }

        @Test
        @DisplayName("Operator revision requests count toward the same limit")
        void humanRevisions() {
            var id = advanceTo(GateId.REQUIREMENTS);
            gates.enterGate(id, GateId.REQUIREMENTS);
            var outcome = gates.recordVerdict(id, GateId.REQUIREMENTS, Verdict.NEEDS_REVISION, "clarify scope");

            assertEquals(1, outcome.task().revisionCount(GateId.REQUIREMENTS));
            assertTrue(outcome.task().openInvocation().isEmpty());
            assertEquals(TaskStatus.REQUIREMENTS_REVIEW, outcome.task().status());
        }
    }

    // ── Ordering ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Gate ordering")
    class Ordering {

        @Test
        @DisplayName("A gate cannot be entered before its predecessors")
        void outOfOrder() {
            var id = advanceTo(GateId.REQUIREMENTS);
            var before = load(id);

            assertThrows(OutOfOrderGateException.class, () -> gates.enterGate(id, GateId.TECHNICAL_REVIEW));
            assertThrows(OutOfOrderGateException.class, () -> gates.confirmHumanGate(id, GateId.MERGE, "alice"));

            var after = load(id);
            assertEquals(before.version(), after.version());
            assertTrue(h.worker(AgentName.PLAN_REVIEWER).calls.isEmpty());
        }

        @Test
        @DisplayName("A passed gate cannot be entered again")
        void passedGate() {
            var id = advanceTo(GateId.TEST_PLAN);
            assertThrows(OutOfOrderGateException.class, () -> gates.enterGate(id, GateId.REQUIREMENTS));
        }

        @Test
        @DisplayName("Only one invocation may be open at a time")
        void singleOpenInvocation() {
            var id = advanceTo(GateId.REQUIREMENTS);
            gates.enterGate(id, GateId.REQUIREMENTS);
            assertThrows(OutOfOrderGateException.class, () -> gates.enterGate(id, GateId.REQUIREMENTS));
        }

        @Test
        @DisplayName("Verdicts need an open invocation of the same gate")
        void verdictWithoutInvocation() {
            var id = advanceTo(GateId.REQUIREMENTS);
            assertThrows(OutOfOrderGateException.class,
                    () -> gates.recordVerdict(id, GateId.REQUIREMENTS, Verdict.APPROVED, "ok"));
        }

        @Test
        @DisplayName("Agent gates cannot be confirmed by an operator")
        void agentGateConfirmation() {
            var id = advanceTo(GateId.TECHNICAL_REVIEW);
            assertThrows(OutOfOrderGateException.class,
                    () -> gates.confirmHumanGate(id, GateId.TECHNICAL_REVIEW, "alice"));
        }

        @Test
        @DisplayName("Passed gates always form a prefix of the canonical order")
        void prefixInvariant() {
            var id = advanceTo(GateId.CHANGE_REQUEST);
            h.worker(AgentName.PR_CREATOR).then(Verdict.NEEDS_REVISION, "steps open");
            gates.enterGate(id, GateId.CHANGE_REQUEST);
            assertGatePrefix(load(id));
            gates.enterGate(id, GateId.CHANGE_REQUEST);
            assertGatePrefix(load(id));
            assertEquals(6, load(id).gatesPassed().size());
        }
    }

    // ── Failures and side states ─────────────────────────────────────────

    @Nested
    @DisplayName("Failures and side states")
    class Failures {

        @Test
        @DisplayName("A crashing agent is a system-authored NEEDS_REVISION and the task does not advance")
        void dispatchError() {
            var id = advanceTo(GateId.TECHNICAL_REVIEW);
            h.worker(AgentName.PLAN_REVIEWER).thenThrow(new IllegalStateException("model crashed"));

            var outcome = gates.enterGate(id, GateId.TECHNICAL_REVIEW);

            assertEquals(Verdict.NEEDS_REVISION, outcome.verdict());
            assertTrue(outcome.invocation().systemAuthored());
            assertTrue(outcome.invocation().note().contains("model crashed"));
            assertEquals(TaskStatus.TECHNICAL_REVIEW, load(id).status());
            assertFalse(load(id).hasPassed(GateId.TECHNICAL_REVIEW));
        }

        @Test
        @DisplayName("REJECTED blocks the task; clearing the block resumes at the gate")
        void rejected() {
            var id = advanceTo(GateId.TECHNICAL_REVIEW);
            h.worker(AgentName.PLAN_REVIEWER).then(Verdict.REJECTED, "wrong product");

            gates.enterGate(id, GateId.TECHNICAL_REVIEW);
            var task = load(id);
            assertEquals(TaskStatus.BLOCKED, task.status());
            assertEquals(TaskStatus.TECHNICAL_REVIEW, task.blockedFrom());
            assertThrows(OutOfOrderGateException.class, () -> gates.enterGate(id, GateId.TECHNICAL_REVIEW));

            gates.clearBlock(id, "alice");
            assertEquals(TaskStatus.TECHNICAL_REVIEW, load(id).status());
            assertTrue(gates.enterGate(id, GateId.TECHNICAL_REVIEW).advanced());
        }

        @Test
        @DisplayName("Blocking abandons the open invocation")
        void blockAbandonsInvocation() {
            var id = advanceTo(GateId.REQUIREMENTS);
            gates.enterGate(id, GateId.REQUIREMENTS);

            var blocked = gates.block(id, "waiting on legal", "alice");
            assertEquals(TaskStatus.BLOCKED, blocked.status());
            assertTrue(blocked.openInvocation().isEmpty());
            assertTrue(blocked.invocationsFor(GateId.REQUIREMENTS).get(0).abandoned());
            assertSame(blocked.status(), gates.block(id, "again", "alice").status());

            var resumed = gates.clearBlock(id, "alice");
            assertEquals(TaskStatus.REQUIREMENTS_REVIEW, resumed.status());
            assertTrue(gates.confirmHumanGate(id, GateId.REQUIREMENTS, "alice").advanced());
        }

        @Test
        @DisplayName("A verdict arriving after the task was blocked is refused")
        void lateVerdictAfterBlock() {
            var id = advanceTo(GateId.TECHNICAL_REVIEW);
            h.worker(AgentName.PLAN_REVIEWER).thenAnswer(ctx -> {
                gates.block(id, "scope changed", "bob");
                return WorkerResult.of(Verdict.APPROVED, "looks fine");
            });

            var e = assertThrows(OutOfOrderGateException.class, () -> gates.enterGate(id, GateId.TECHNICAL_REVIEW));

            assertTrue(e.getMessage().contains("no open invocation"));
            var task = load(id);
            assertEquals(TaskStatus.BLOCKED, task.status());
            assertFalse(task.hasPassed(GateId.TECHNICAL_REVIEW));
            assertTrue(task.invocationsFor(GateId.TECHNICAL_REVIEW).get(0).abandoned());
        }

        @Test
        @DisplayName("checkReady accepts an open invocation of the same gate and rejects out-of-order gates")
        void checkReady() {
            var id = advanceTo(GateId.REQUIREMENTS);
            gates.checkReady(load(id), GateId.REQUIREMENTS);
            assertThrows(OutOfOrderGateException.class, () -> gates.checkReady(load(id), GateId.MERGE));

            gates.enterGate(id, GateId.REQUIREMENTS);
            gates.checkReady(load(id), GateId.REQUIREMENTS);
            assertThrows(OutOfOrderGateException.class, () -> gates.checkReady(load(id), GateId.TEST_PLAN));
        }

        @Test
        @DisplayName("Blocked and unblocked status is mirrored to the issue")
        void blockMirrorsStatus() {
            var id = advanceTo(GateId.IMPLEMENTATION_START);
            assertEquals(StatusMapping.READY_FOR_IMPLEMENTATION, h.issues.statusOfTask(id));

            gates.block(id, "dependency missing", "alice");
            assertEquals(StatusMapping.BLOCKED, h.issues.statusOfTask(id));

            gates.clearBlock(id, "alice");
            assertEquals(StatusMapping.READY_FOR_IMPLEMENTATION, h.issues.statusOfTask(id));
        }

        @Test
        @DisplayName("A failed external call is recorded but never rolls back the transition")
        void syncFailureKeepsTransition() {
            var id = advanceTo(GateId.SPLIT_EVALUATION);
            h.issues.failEnsureIssue = 1;

            var outcome = gates.enterGate(id, GateId.SPLIT_EVALUATION);

            assertTrue(outcome.advanced());
            var task = load(id);
            assertEquals(TaskStatus.READY_FOR_IMPLEMENTATION, task.status());
            assertNull(task.issueRef());
            assertTrue(h.syncLog.recordsFor(id).stream().anyMatch(r ->
                    r.operation() == SyncOperation.ENSURE_ISSUE && r.result() == SyncResult.FAILED));
        }

        @Test
        @DisplayName("Archiving abandons open work and is idempotent")
        void archive() {
            var id = advanceTo(GateId.REQUIREMENTS);
            gates.enterGate(id, GateId.REQUIREMENTS);

            var archived = gates.archive(id, "alice");
            assertEquals(TaskStatus.ARCHIVED, archived.status());
            assertTrue(archived.openInvocation().isEmpty());
            assertEquals(archived.version(), gates.archive(id, "alice").version());
            assertThrows(OutOfOrderGateException.class, () -> gates.block(id, "late", "alice"));
        }
    }
}
