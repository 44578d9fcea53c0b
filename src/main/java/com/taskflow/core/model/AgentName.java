package com.taskflow.core.model;

/**
 * The fixed roster of sub-agents a gate can delegate to.
 */
public enum AgentName {
    PLAN_REVIEWER,
    SPLITTER,
    VALIDATOR,
    PR_CREATOR,
    DOC_UPDATER,
    CHANGELOG_WRITER
}
