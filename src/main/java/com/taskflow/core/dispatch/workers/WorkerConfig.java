package com.taskflow.core.dispatch.workers;

import com.taskflow.core.dispatch.Worker;
import com.taskflow.core.llm.LlmService;
import com.taskflow.core.model.AgentName;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the reviewing agents. They share {@link ReviewWorker} and differ only in prompt.
 */
@Configuration
public class WorkerConfig {

    static final String PLAN_REVIEWER_PROMPT =
            "You are a senior engineer reviewing the technical plan of a task before implementation starts. " +
            "Check that every requirement is covered by at least one step, that each step has acceptance " +
            "criteria that can be verified, and that the test plan exercises the acceptance criteria.\n\n" +
            "Answer APPROVED when the plan can be implemented as written, NEEDS_REVISION when steps or " +
            "criteria must be reworked (list each problem in issues), and REJECTED only when the requirements " +
            "themselves are contradictory or impossible.";

    static final String VALIDATOR_PROMPT =
            "You are the validator of a finished implementation. Every step should be DONE or delegated " +
            "and carry evidence. Compare the evidence against each step's acceptance criteria and the test plan.\n\n" +
            "Answer APPROVED when all criteria are demonstrably met, NEEDS_REVISION when evidence is missing " +
            "or a criterion is not met (list each gap in issues), and REJECTED only when the work contradicts " +
            "the requirements.";

    static final String DOC_UPDATER_PROMPT =
            "You check whether the documentation impact of a task has been handled before merge. Read the " +
            "requirements, steps and changelog and decide whether user-facing or operator-facing documentation " +
            "must change.\n\n" +
            "Answer APPROVED when no documentation change is needed or the changelog shows it was made, and " +
            "NEEDS_REVISION otherwise, listing each document to update in issues.";

    @Bean
    public Worker planReviewerWorker(LlmService llmService) {
        return new ReviewWorker(AgentName.PLAN_REVIEWER, PLAN_REVIEWER_PROMPT, llmService);
    }

    @Bean
    public Worker validatorWorker(LlmService llmService) {
        return new ReviewWorker(AgentName.VALIDATOR, VALIDATOR_PROMPT, llmService);
    }

    @Bean
    public Worker docUpdaterWorker(LlmService llmService) {
        return new ReviewWorker(AgentName.DOC_UPDATER, DOC_UPDATER_PROMPT, llmService);
    }
}
