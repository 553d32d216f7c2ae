package com.casewright.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Progress snapshot of a running task. {@code percent} is derived from current/total.
 */
public record Progress(
        String stage,
        int current,
        int total,
        String message,
        int percent,
        @JsonProperty("current_item") String currentItem
) {

    public static final Progress INITIAL = new Progress("pending", 0, 0, "Task queued", 0, null);

    public static Progress of(String stage, int current, int total, String message, String currentItem) {
        if (total < 0 || current < 0 || current > total) {
            throw new IllegalArgumentException(
                    "Progress must satisfy 0 <= current <= total, got " + current + "/" + total);
        }
        int percent = total == 0 ? 0 : (int) ((long) current * 100 / total);
        return new Progress(stage, current, total, message, percent, currentItem);
    }
}
