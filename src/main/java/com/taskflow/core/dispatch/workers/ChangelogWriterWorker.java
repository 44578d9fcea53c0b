package com.taskflow.core.dispatch.workers;

import com.taskflow.core.dispatch.AgentContext;
import com.taskflow.core.dispatch.Artifacts;
import com.taskflow.core.dispatch.Worker;
import com.taskflow.core.dispatch.WorkerResult;
import com.taskflow.core.llm.LlmService;
import com.taskflow.core.model.AgentName;
import com.taskflow.core.model.ChangelogEntry;
import com.taskflow.core.model.Verdict;
import org.springframework.stereotype.Component;

/**
 * Writes the changelog entry for the step in focus.
 */
@Component
public class ChangelogWriterWorker implements Worker {

    static final String SYSTEM_PROMPT =
            "You maintain the changelog of a software task. Describe the completed step in focus as one entry: " +
            "component is the part of the system touched, summary is what changed in one sentence, effect is " +
            "the observable consequence for users or operators. Base the entry on the step's evidence only.";

    private final LlmService llmService;

    public ChangelogWriterWorker(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public AgentName name() {
        return AgentName.CHANGELOG_WRITER;
    }

    @Override
    public WorkerResult evaluate(AgentContext context) {
        if (context.focusStep() == null) {
            throw new IllegalArgumentException("Changelog writer needs a step in focus");
        }
        var step = context.task().steps().get(context.focusStep());
        var prompt = TaskBrief.render(context.task())
                + "\n## Step In Focus\n\n" + context.focusStep() + ". " + step.description()
                + "\n- evidence: " + (step.evidence() == null ? "(none)" : step.evidence()) + "\n";

        var output = llmService.structuredCall(SYSTEM_PROMPT, prompt, ChangelogOutput.class);
        var entry = new ChangelogEntry(null, output.component(), output.summary(), output.effect(),
                AgentName.CHANGELOG_WRITER.name());
        return new WorkerResult(Verdict.APPROVED, output.summary(), Artifacts.changelog(entry));
    }
}
