package com.taskflow.core.sync;

import com.taskflow.core.model.TaskStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed internal status to issue tracker status vocabulary.
 * {@link TaskStatus#ARCHIVED} has no external counterpart and is never mirrored.
 */
public final class StatusMapping {

    public static final String BUSINESS_REVIEW = "Business Review";
    public static final String READY_FOR_IMPLEMENTATION = "Ready for Implementation";
    public static final String IN_PROGRESS = "In Progress";
    public static final String IN_REVIEW = "In Review";
    public static final String READY_TO_MERGE = "Ready to Merge";
    public static final String DONE = "Done";
    public static final String BLOCKED = "Blocked";

    private static final Map<TaskStatus, String> EXTERNAL;

    static {
        var map = new EnumMap<TaskStatus, String>(TaskStatus.class);
        map.put(TaskStatus.DRAFT, BUSINESS_REVIEW);
        map.put(TaskStatus.REQUIREMENTS_REVIEW, BUSINESS_REVIEW);
        map.put(TaskStatus.TEST_PLAN_REVIEW, BUSINESS_REVIEW);
        map.put(TaskStatus.TECHNICAL_REVIEW, BUSINESS_REVIEW);
        map.put(TaskStatus.SPLIT_EVALUATION, BUSINESS_REVIEW);
        map.put(TaskStatus.READY_FOR_IMPLEMENTATION, READY_FOR_IMPLEMENTATION);
        map.put(TaskStatus.IN_PROGRESS, IN_PROGRESS);
        map.put(TaskStatus.IN_REVIEW, IN_REVIEW);
        map.put(TaskStatus.DOCUMENTATION_UPDATE, IN_REVIEW);
        map.put(TaskStatus.READY_TO_MERGE, READY_TO_MERGE);
        map.put(TaskStatus.DONE, DONE);
        map.put(TaskStatus.BLOCKED, BLOCKED);
        EXTERNAL = Collections.unmodifiableMap(map);
    }

    private StatusMapping() {}

    public static Optional<String> externalStatus(TaskStatus status) {
        return Optional.ofNullable(EXTERNAL.get(status));
    }
}
