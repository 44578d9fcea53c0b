package com.taskflow.core.dispatch.workers;

import com.taskflow.core.dispatch.AgentContext;
import com.taskflow.core.dispatch.Artifacts;
import com.taskflow.core.dispatch.ChildTaskSpec;
import com.taskflow.core.dispatch.Worker;
import com.taskflow.core.dispatch.WorkerResult;
import com.taskflow.core.llm.LlmService;
import com.taskflow.core.model.AgentName;
import com.taskflow.core.model.TaskSpec;
import com.taskflow.core.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides whether a task is too large for one change request and, if so, proposes child
 * tasks. The verdict is APPROVED either way; a proposal of fewer than two children is
 * reported as "no split".
 */
@Component
public class SplitEvaluationWorker implements Worker {

    private static final Logger log = LoggerFactory.getLogger(SplitEvaluationWorker.class);

    static final String SYSTEM_PROMPT =
            "You decide whether a software task should be split before implementation. Split only when the " +
            "steps form two or more independently mergeable pieces of work, each small enough for a single " +
            "change request. Never split into a single child.\n\n" +
            "When splitting, give every child a title, its own requirements, a test plan and steps, and list in " +
            "supersedesSteps the zero-based indexes of the parent steps it takes over. Every unfinished parent " +
            "step must be taken over by exactly one child.";

    private final LlmService llmService;

    public SplitEvaluationWorker(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public AgentName name() {
        return AgentName.SPLITTER;
    }

    @Override
    public WorkerResult evaluate(AgentContext context) {
        var task = context.task();
        var output = llmService.structuredCall(SYSTEM_PROMPT, TaskBrief.render(task), SplitOutput.class);

        var proposals = output.children() == null ? List.<SplitOutput.ChildProposal>of() : output.children();
        if (!output.split() || proposals.size() < 2) {
            log.info("Task {} stays whole: {}", task.id(), output.rationale());
            return WorkerResult.of(Verdict.APPROVED, "No split: " + output.rationale());
        }

        var children = proposals.stream()
                .map(p -> new ChildTaskSpec(
                        new TaskSpec(p.title(), p.requirements(), p.testPlan(), p.steps(), null),
                        p.supersedesSteps()))
                .toList();
        log.info("Task {} split into {} children", task.id(), children.size());
        return new WorkerResult(Verdict.APPROVED,
                "Split into %d child tasks: %s".formatted(children.size(), output.rationale()),
                Artifacts.split(children));
    }
}
