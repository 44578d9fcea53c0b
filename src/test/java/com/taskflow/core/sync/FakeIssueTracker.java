package com.taskflow.core.sync;

import com.taskflow.core.model.TaskSnapshot;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory issue tracker. Failures can be scripted per operation.
 */
public class FakeIssueTracker implements IssueTrackerAdapter {

    public final Map<String, String> issuesByTask = new HashMap<>();
    public final Map<String, String> statuses = new HashMap<>();
    public final List<String> comments = new ArrayList<>();
    public int issuesCreated;
    public int statusWrites;

    public int failEnsureIssue;
    public int failSetStatus;
    public boolean unknownOutcome;

    @Override
    public String ensureIssue(TaskSnapshot task) {
        if (failEnsureIssue > 0) {
            failEnsureIssue--;
            throw new ExternalSyncException("issue tracker unavailable", null, unknownOutcome);
        }
        return issuesByTask.computeIfAbsent(task.id(), id -> String.valueOf(++issuesCreated));
    }

    @Override
    public Optional<String> currentStatus(String issueRef) {
        return Optional.ofNullable(statuses.get(issueRef));
    }

    @Override
    public void setStatus(String issueRef, String externalStatus) {
        if (failSetStatus > 0) {
            failSetStatus--;
            throw new ExternalSyncException("status write rejected");
        }
        statusWrites++;
        statuses.put(issueRef, externalStatus);
    }

    @Override
    public void comment(String issueRef, String body) {
        comments.add(issueRef + ": " + body);
    }

    public String statusOfTask(String taskId) {
        return statuses.get(issuesByTask.get(taskId));
    }
}
