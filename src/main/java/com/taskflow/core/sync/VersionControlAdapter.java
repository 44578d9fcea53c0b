package com.taskflow.core.sync;

import com.taskflow.core.model.ChangeRequestDraft;
import com.taskflow.core.model.TaskSnapshot;

/**
 * Mirrors a task into the version control system.
 * <p>
 * Every operation is idempotent against the remote: it first looks the object up on the
 * remote and only creates it when absent, so repeating a call after a restart or a
 * partial failure never creates a second branch or change request.
 */
public interface VersionControlAdapter {

    /**
     * @return the branch name, existing or newly pushed
     */
    String ensureBranch(TaskSnapshot task);

    /**
     * @return the change request reference (pull request number), existing or newly opened
     */
    String openChangeRequest(TaskSnapshot task, ChangeRequestDraft draft);

    /**
     * @return the merge commit id; an already merged change request returns its existing merge commit
     */
    String mergeChangeRequest(TaskSnapshot task);

    /** The branch name this adapter uses for the task. */
    String branchNameFor(String taskId);
}
