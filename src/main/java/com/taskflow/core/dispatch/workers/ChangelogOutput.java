package com.taskflow.core.dispatch.workers;

public record ChangelogOutput(String component, String summary, String effect) {}
