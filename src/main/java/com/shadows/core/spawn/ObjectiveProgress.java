package com.shadows.core.spawn;

/**
 * @param progress "collected/total", e.g. "1/2"
 */
public record ObjectiveProgress(String id, String progress, boolean completed) {}
