package com.taskflow.core.dispatch.workers;

import com.taskflow.core.dispatch.AgentContext;
import com.taskflow.core.dispatch.Artifacts;
import com.taskflow.core.dispatch.Worker;
import com.taskflow.core.dispatch.WorkerResult;
import com.taskflow.core.llm.LlmService;
import com.taskflow.core.model.AgentName;
import com.taskflow.core.model.ChangeRequestDraft;
import com.taskflow.core.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Prepares the change request once implementation is complete. Unfinished steps are a
 * NEEDS_REVISION without asking the model.
 */
@Component
public class ChangeRequestWorker implements Worker {

    private static final Logger log = LoggerFactory.getLogger(ChangeRequestWorker.class);

    static final String SYSTEM_PROMPT =
            "You write the pull request for a completed task. The title is one line in the imperative mood. " +
            "The body summarises the change, lists each step with its evidence and explains how the test plan " +
            "was carried out. Set ready to false and list blockers if anything in the brief shows the work is " +
            "not finished.";

    private final LlmService llmService;

    public ChangeRequestWorker(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public AgentName name() {
        return AgentName.PR_CREATOR;
    }

    @Override
    public WorkerResult evaluate(AgentContext context) {
        var task = context.task();
        var unfinished = task.steps().stream()
                .filter(s -> !s.delegated() && !s.state().isFinished())
                .map(s -> "Step not finished: " + s.description())
                .toList();
        if (!unfinished.isEmpty()) {
            log.info("Task {} has {} unfinished step(s); not opening a change request", task.id(), unfinished.size());
            return new WorkerResult(Verdict.NEEDS_REVISION,
                    unfinished.size() + " step(s) still open", Artifacts.review(unfinished));
        }

        var output = llmService.structuredCall(SYSTEM_PROMPT, TaskBrief.render(task), ChangeRequestOutput.class);
        var blockers = output.blockers() == null ? List.<String>of() : output.blockers();
        if (!output.ready()) {
            return new WorkerResult(Verdict.NEEDS_REVISION, "Not ready for review", Artifacts.review(blockers));
        }
        var draft = new ChangeRequestDraft(output.title(), output.body());
        return new WorkerResult(Verdict.APPROVED, "Change request prepared: " + output.title(),
                Artifacts.changeRequest(draft, blockers));
    }
}
