package com.taskflow.core.dispatch.workers;

import com.taskflow.core.TestHarness;
import com.taskflow.core.TestTasks;
import com.taskflow.core.dispatch.AgentContext;
import com.taskflow.core.llm.LlmService;
import com.taskflow.core.model.AgentName;
import com.taskflow.core.model.StepState;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskSnapshot;
import com.taskflow.core.model.TaskSpec;
import com.taskflow.core.model.Verdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class WorkersTest {

    private LlmService llmService;
    private Task task;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        task = Task.draft("TASK-1", TestTasks.spec(), TestHarness.NOW);
    }

    private AgentContext context(Task t) {
        return AgentContext.of(TaskSnapshot.of(t));
    }

    // ── Reviewers ───────────────────────────────────────────────────────

    @Nested
    class Review {

        @Test
        @DisplayName("The verdict and issues of the model become the worker result")
        void mapsVerdict() {
            when(llmService.structuredCall(eq(WorkerConfig.PLAN_REVIEWER_PROMPT), anyString(), eq(ReviewOutput.class)))
                    .thenReturn(new ReviewOutput(Verdict.NEEDS_REVISION, "Criteria vague", List.of("step 1")));
            var worker = new WorkerConfig().planReviewerWorker(llmService);

            var result = worker.evaluate(context(task));

            assertEquals(AgentName.PLAN_REVIEWER, worker.name());
            assertEquals(Verdict.NEEDS_REVISION, result.verdict());
            assertEquals("Criteria vague", result.note());
            assertEquals(List.of("step 1"), result.artifacts().reviewNotes());
        }

        @Test
        @DisplayName("Missing issues are an empty list")
        void nullIssues() {
            when(llmService.structuredCall(anyString(), anyString(), eq(ReviewOutput.class)))
                    .thenReturn(new ReviewOutput(Verdict.APPROVED, "ok", null));

            var result = new ReviewWorker(AgentName.VALIDATOR, "p", llmService).evaluate(context(task));

            assertTrue(result.artifacts().reviewNotes().isEmpty());
        }

        @Test
        @DisplayName("The brief sent to the model names the task and its steps")
        void briefContent() {
            when(llmService.structuredCall(anyString(), anyString(), eq(ReviewOutput.class)))
                    .thenReturn(new ReviewOutput(Verdict.APPROVED, "ok", List.of()));

            new ReviewWorker(AgentName.DOC_UPDATER, "p", llmService).evaluate(context(task));

            verify(llmService).structuredCall(eq("p"),
                    argThat(brief -> brief.contains("TASK-1") && brief.contains("Add token bucket filter")),
                    eq(ReviewOutput.class));
        }
    }

    // ── Splitter ────────────────────────────────────────────────────────

    @Nested
    class Split {

        @Test
        @DisplayName("Two or more children become a split proposal")
        void proposesChildren() {
            var steps = List.of(new TaskSpec.StepSpec("a", "b"));
            when(llmService.structuredCall(anyString(), anyString(), eq(SplitOutput.class)))
                    .thenReturn(new SplitOutput(true, "two pieces", List.of(
                            new SplitOutput.ChildProposal("Filter", "r", "t", steps, List.of(0, 1)),
                            new SplitOutput.ChildProposal("Docs", "r", "t", steps, List.of(2)))));

            var result = new SplitEvaluationWorker(llmService).evaluate(context(task));

            assertEquals(Verdict.APPROVED, result.verdict());
            assertEquals(2, result.artifacts().childTasks().size());
            assertEquals("Docs", result.artifacts().childTasks().get(1).spec().title());
            assertEquals(List.of(2), result.artifacts().childTasks().get(1).supersededSteps());
        }

        @Test
        @DisplayName("A single proposed child is reported as no split")
        void singleChild() {
            when(llmService.structuredCall(anyString(), anyString(), eq(SplitOutput.class)))
                    .thenReturn(new SplitOutput(true, "one piece", List.of(
                            new SplitOutput.ChildProposal("Only", "r", "t", List.of(), List.of(0)))));

            var result = new SplitEvaluationWorker(llmService).evaluate(context(task));

            assertEquals(Verdict.APPROVED, result.verdict());
            assertTrue(result.artifacts().childTasks().isEmpty());
            assertTrue(result.note().startsWith("No split"));
        }

        @Test
        void noSplit() {
            when(llmService.structuredCall(anyString(), anyString(), eq(SplitOutput.class)))
                    .thenReturn(new SplitOutput(false, "small enough", null));

            var worker = new SplitEvaluationWorker(llmService);
            var result = worker.evaluate(context(task));

            assertTrue(result.artifacts().childTasks().isEmpty());
            assertEquals(AgentName.SPLITTER, worker.name());
        }
    }

    // ── PR creator ──────────────────────────────────────────────────────

    @Nested
    class ChangeRequest {

        @Test
        @DisplayName("Unfinished steps need revision without asking the model")
        void unfinishedSteps() {
            var result = new ChangeRequestWorker(llmService).evaluate(context(task.withStep(0, StepState.DONE, "abc")));

            assertEquals(Verdict.NEEDS_REVISION, result.verdict());
            assertEquals(2, result.artifacts().reviewNotes().size());
            verifyNoInteractions(llmService);
        }

        @Test
        @DisplayName("A ready answer carries the draft")
        void ready() {
            var done = task.withStep(0, StepState.DONE, "a").withStep(1, StepState.DONE, "b")
                    .withStep(2, StepState.SKIPPED, "n/a");
            when(llmService.structuredCall(anyString(), anyString(), eq(ChangeRequestOutput.class)))
                    .thenReturn(new ChangeRequestOutput(true, "Add rate limiting", "Body", List.of()));

            var result = new ChangeRequestWorker(llmService).evaluate(context(done));

            assertEquals(Verdict.APPROVED, result.verdict());
            assertEquals("Add rate limiting", result.artifacts().changeRequest().title());
            assertEquals("Body", result.artifacts().changeRequest().body());
        }

        @Test
        void notReady() {
            var done = task.withStep(0, StepState.DONE, "a").withStep(1, StepState.DONE, "b")
                    .withStep(2, StepState.DONE, "c");
            when(llmService.structuredCall(anyString(), anyString(), eq(ChangeRequestOutput.class)))
                    .thenReturn(new ChangeRequestOutput(false, null, null, List.of("tests missing")));

            var result = new ChangeRequestWorker(llmService).evaluate(context(done));

            assertEquals(Verdict.NEEDS_REVISION, result.verdict());
            assertEquals(List.of("tests missing"), result.artifacts().reviewNotes());
            assertNull(result.artifacts().changeRequest());
        }
    }

    // ── Changelog writer ────────────────────────────────────────────────

    @Nested
    class Changelog {

        @Test
        void writesEntryForFocusStep() {
            var done = task.withStep(1, StepState.DONE, "commit 9f8e7d");
            when(llmService.structuredCall(anyString(), anyString(), eq(ChangelogOutput.class)))
                    .thenReturn(new ChangelogOutput("config", "Limit is configurable", "Operators can tune it"));

            var result = new ChangelogWriterWorker(llmService).evaluate(new AgentContext(TaskSnapshot.of(done), 1));

            assertEquals("config", result.artifacts().changelogEntry().component());
            assertEquals("CHANGELOG_WRITER", result.artifacts().changelogEntry().author());
            verify(llmService).structuredCall(anyString(), contains("commit 9f8e7d"), eq(ChangelogOutput.class));
        }

        @Test
        void requiresFocusStep() {
            assertThrows(IllegalArgumentException.class,
                    () -> new ChangelogWriterWorker(llmService).evaluate(context(task)));
        }
    }
}
