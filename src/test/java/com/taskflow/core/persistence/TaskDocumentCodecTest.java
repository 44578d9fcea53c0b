package com.taskflow.core.persistence;

import com.taskflow.core.TestHarness;
import com.taskflow.core.TestTasks;
import com.taskflow.core.model.GateId;
import com.taskflow.core.model.GateInvocation;
import com.taskflow.core.model.HandoverNote;
import com.taskflow.core.model.SplitReference;
import com.taskflow.core.model.Step;
import com.taskflow.core.model.StepState;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskStatus;
import com.taskflow.core.model.Verdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskDocumentCodecTest {

    private final TaskDocumentCodec codec = new TaskDocumentCodec();

    @Test
    @DisplayName("A task with invocations, split references and a handover survives encoding")
    void fullDocument() {
        var draft = Task.draft("TASK-abc", TestTasks.spec(), TestHarness.NOW)
                .toBuilder().status(TaskStatus.TECHNICAL_REVIEW).build();
        var invocation = GateInvocation.open(draft, GateId.TECHNICAL_REVIEW, TestHarness.NOW)
                .decide(Verdict.NEEDS_REVISION, "Missing error handling", null, false, TestHarness.NOW);
        var delegated = new Step("Document the limit", "README explains", StepState.PENDING, null,
                new SplitReference("TASK-child", "Docs", List.of("Document the limit")));
        var task = draft.toBuilder()
                .addInvocation(invocation)
                .incrementRevisions(GateId.TECHNICAL_REVIEW)
                .steps(List.of(draft.steps().get(0), draft.steps().get(1), delegated))
                .handover(new HandoverNote("alice", TestHarness.NOW, "Filter done",
                        List.of("Wire config"), List.of("Per-user limits?")))
                .build()
                .withBranchRef("taskflow/task-abc");

        var json = codec.encode(task);
        var decoded = codec.decode(json);

        assertEquals(task, decoded);
        assertTrue(json.contains("\"TECHNICAL_REVIEW\""));
        assertTrue(json.contains("2026-03-01T10:00:00Z"));
    }

    @Test
    @DisplayName("Unknown fields in a stored document are ignored")
    void unknownFields() {
        var task = Task.draft("TASK-abc", TestTasks.spec(), TestHarness.NOW);
        var json = codec.encode(task);
        var withExtra = "{\"legacyField\":1," + json.substring(1);

        assertEquals(task, codec.decode(withExtra));
    }

    @Test
    @DisplayName("Malformed documents fail loudly")
    void malformed() {
        assertThrows(IllegalStateException.class, () -> codec.decode("{not json"));
    }
}
