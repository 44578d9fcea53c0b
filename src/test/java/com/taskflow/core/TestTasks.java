package com.taskflow.core;

import com.taskflow.core.model.TaskSpec;

import java.util.List;

/**
 * Task fixtures.
 */
public final class TestTasks {

    private TestTasks() {}

    public static TaskSpec spec() {
        return new TaskSpec(
                "Add rate limiting to the public API",
                "Anonymous clients are limited to 60 requests per minute per IP.",
                "Integration test hammering /api with 61 requests expects one 429.",
                List.of(
                        new TaskSpec.StepSpec("Add token bucket filter", "Filter rejects the 61st request"),
                        new TaskSpec.StepSpec("Expose limit in configuration", "Limit configurable via properties"),
                        new TaskSpec.StepSpec("Document the limit", "README explains the 429 response")),
                null);
    }

    public static TaskSpec childSpec(String title) {
        return new TaskSpec(title, "Part of a split", "Covered by parent test plan",
                List.of(new TaskSpec.StepSpec(title + " work", "Done when merged")), null);
    }
}
