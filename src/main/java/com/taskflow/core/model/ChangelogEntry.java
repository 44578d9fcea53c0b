package com.taskflow.core.model;

import java.time.Instant;

/**
 * A single append-only changelog line of a task.
 *
 * @param timestamp when the entry was written
 * @param component the part of the system touched (or the lifecycle area, e.g. "gate:merge")
 * @param summary   what happened
 * @param effect    the observable consequence
 * @param author    operator identity, agent name or "system"
 */
public record ChangelogEntry(
    Instant timestamp,
    String component,
    String summary,
    String effect,
    String author
) {}
