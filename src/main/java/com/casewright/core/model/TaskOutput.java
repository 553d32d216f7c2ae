package com.casewright.core.model;

/**
 * Marker for values a task can publish as its partial or final result.
 */
public interface TaskOutput {
}
