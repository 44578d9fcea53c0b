package com.taskflow.core.health;

import java.util.Collection;
import java.util.Map;

/**
 * Result of one health check.
 * <p>
 * DEGRADED means tasks still move through their gates but something is lost: durability
 * across restarts, mirroring to the issue tracker, or one of the sub-agents. DOWN means
 * lifecycle commands touching that component will fail.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    /** Ordered by severity. */
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DOWN, detail, metadata);
    }

    public boolean blocksLifecycle() {
        return status == Status.DOWN;
    }

    /** The most severe status among {@code checks}; UP when there are none. */
    public static Status overall(Collection<HealthStatus> checks) {
        var worst = Status.UP;
        for (var check : checks) {
            if (check.status().compareTo(worst) > 0) {
                worst = check.status();
            }
        }
        return worst;
    }
}
