package com.taskflow.core.sync;

import com.taskflow.core.model.TaskSnapshot;

import java.util.Optional;

/**
 * Mirrors a task into the issue tracker. Status writes are upserts, so replaying them
 * in any order converges on the last one applied.
 */
public interface IssueTrackerAdapter {

    /**
     * Finds the issue for the task on the remote, or creates it.
     *
     * @return the issue reference
     */
    String ensureIssue(TaskSnapshot task);

    /** The external status the tracker currently reports for the issue, if any. */
    Optional<String> currentStatus(String issueRef);

    void setStatus(String issueRef, String externalStatus);

    void comment(String issueRef, String body);
}
