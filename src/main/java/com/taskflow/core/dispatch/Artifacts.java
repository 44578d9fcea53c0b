package com.taskflow.core.dispatch;

import com.taskflow.core.model.ChangeRequestDraft;
import com.taskflow.core.model.ChangelogEntry;

import java.util.List;

/**
 * Typed bag of worker output. Which fields are filled depends on the agent:
 * reviewers fill {@code reviewNotes}, the splitter {@code childTasks}, the PR creator
 * {@code changeRequest} and the changelog writer {@code changelogEntry}.
 */
public record Artifacts(
    List<String> reviewNotes,
    List<ChildTaskSpec> childTasks,
    ChangeRequestDraft changeRequest,
    ChangelogEntry changelogEntry
) {

    public Artifacts {
        reviewNotes = reviewNotes == null ? List.of() : List.copyOf(reviewNotes);
        childTasks = childTasks == null ? List.of() : List.copyOf(childTasks);
    }

    public static Artifacts none() {
        return new Artifacts(List.of(), List.of(), null, null);
    }

    public static Artifacts review(List<String> notes) {
        return new Artifacts(notes, List.of(), null, null);
    }

    public static Artifacts split(List<ChildTaskSpec> children) {
        return new Artifacts(List.of(), children, null, null);
    }

    public static Artifacts changeRequest(ChangeRequestDraft draft, List<String> notes) {
        return new Artifacts(notes, List.of(), draft, null);
    }

    public static Artifacts changelog(ChangelogEntry entry) {
        return new Artifacts(List.of(), List.of(), null, entry);
    }
}
