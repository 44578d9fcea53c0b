package com.taskflow.core.dispatch.workers;

import com.taskflow.core.dispatch.AgentContext;
import com.taskflow.core.dispatch.Artifacts;
import com.taskflow.core.dispatch.Worker;
import com.taskflow.core.dispatch.WorkerResult;
import com.taskflow.core.llm.LlmService;
import com.taskflow.core.model.AgentName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * A reviewing agent: reads the task brief and answers with a verdict and a list of issues.
 * One instance per reviewing role, each with its own system prompt (see {@link WorkerConfig}).
 */
public class ReviewWorker implements Worker {

    private static final Logger log = LoggerFactory.getLogger(ReviewWorker.class);

    private final AgentName name;
    private final String systemPrompt;
    private final LlmService llmService;

    public ReviewWorker(AgentName name, String systemPrompt, LlmService llmService) {
        this.name = name;
        this.systemPrompt = systemPrompt;
        this.llmService = llmService;
    }

    @Override
    public AgentName name() {
        return name;
    }

    @Override
    public WorkerResult evaluate(AgentContext context) {
        var output = llmService.structuredCall(systemPrompt, TaskBrief.render(context.task()), ReviewOutput.class);
        var issues = output.issues() == null ? List.<String>of() : output.issues();
        log.info("{} review of {}: {} ({} issue(s))", name, context.task().id(), output.verdict(), issues.size());
        return new WorkerResult(output.verdict(), output.summary(), Artifacts.review(issues));
    }
}
