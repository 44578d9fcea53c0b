package com.taskflow.core.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskflow.core.model.TaskSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link IssueTrackerAdapter} on GitHub issues.
 * <p>
 * An issue belongs to a task through the label {@code taskflow:<taskId>}, which is looked
 * up on the remote before anything is created. The external status is the single
 * {@code status: <name>} label on the issue; setting it replaces the whole label set, and
 * {@value StatusMapping#DONE} also closes the issue.
 */
@Component
public class GitHubIssueTrackerAdapter implements IssueTrackerAdapter {

    private static final Logger log = LoggerFactory.getLogger(GitHubIssueTrackerAdapter.class);

    static final String TASK_LABEL_PREFIX = "taskflow:";
    static final String STATUS_LABEL_PREFIX = "status: ";

    private final GitHubApiClient gitHub;

    public GitHubIssueTrackerAdapter(GitHubApiClient gitHub) {
        this.gitHub = gitHub;
    }

    @Override
    public String ensureIssue(TaskSnapshot task) {
        var taskLabel = TASK_LABEL_PREFIX + task.id();
        var found = gitHub.get(gitHub.repoPath("/issues?state=all&labels=" + GitHubApiClient.encode(taskLabel)));
        for (JsonNode issue : found) {
            // the issues endpoint also lists pull requests
            if (!issue.has("pull_request")) {
                var number = issue.path("number").asText();
                log.info("Issue #{} already exists for {}", number, task.id());
                return number;
            }
        }

        var body = gitHub.newBody();
        body.put("title", "[" + task.id() + "] " + task.title());
        body.put("body", issueBody(task));
        body.putArray("labels").add(taskLabel);
        var created = gitHub.post(gitHub.repoPath("/issues"), body);
        var number = created.path("number").asText();
        log.info("Created issue #{} for {}", number, task.id());
        return number;
    }

    @Override
    public Optional<String> currentStatus(String issueRef) {
        var issue = gitHub.get(gitHub.repoPath("/issues/" + issueRef));
        for (JsonNode label : issue.path("labels")) {
            var name = label.path("name").asText();
            if (name.startsWith(STATUS_LABEL_PREFIX)) {
                return Optional.of(name.substring(STATUS_LABEL_PREFIX.length()));
            }
        }
        return Optional.empty();
    }

    @Override
    public void setStatus(String issueRef, String externalStatus) {
        var issue = gitHub.get(gitHub.repoPath("/issues/" + issueRef));

        List<String> labels = new ArrayList<>();
        for (JsonNode label : issue.path("labels")) {
            var name = label.path("name").asText();
            if (!name.startsWith(STATUS_LABEL_PREFIX)) {
                labels.add(name);
            }
        }
        labels.add(STATUS_LABEL_PREFIX + externalStatus);

        var labelBody = gitHub.newBody();
        var array = labelBody.putArray("labels");
        labels.forEach(array::add);
        gitHub.put(gitHub.repoPath("/issues/" + issueRef + "/labels"), labelBody);

        var desiredState = StatusMapping.DONE.equals(externalStatus) ? "closed" : "open";
        if (!desiredState.equals(issue.path("state").asText())) {
            var stateBody = gitHub.newBody();
            stateBody.put("state", desiredState);
            gitHub.patch(gitHub.repoPath("/issues/" + issueRef), stateBody);
        }
        log.info("Issue #{} status set to '{}'", issueRef, externalStatus);
    }

    @Override
    public void comment(String issueRef, String body) {
        var comment = gitHub.newBody();
        comment.put("body", body);
        gitHub.post(gitHub.repoPath("/issues/" + issueRef + "/comments"), comment);
    }

    private static String issueBody(TaskSnapshot task) {
        var sb = new StringBuilder();
        sb.append("## Requirements\n\n").append(nullToEmpty(task.requirements())).append("\n\n");
        if (!task.steps().isEmpty()) {
            sb.append("## Steps\n\n");
            for (var step : task.steps()) {
                sb.append("- [ ] ").append(step.description()).append('\n');
            }
        }
        return sb.toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
