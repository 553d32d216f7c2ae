package com.casewright.core.stages;

import com.casewright.core.model.FunctionPointOutcome;
import com.casewright.core.model.TaskOutput;

/**
 * Channel from a running stage back to whoever tracks the task.
 * Stages call it from worker threads; implementations must be thread-safe.
 */
public interface ProgressReporter {

    void progress(String stage, int current, int total, String message, String currentItem);

    void partialResult(TaskOutput partial);

    /** Called once per function point when generation for it resolves. */
    default void unitResolved(FunctionPointOutcome outcome) {
    }

    /** Reporter for synchronous calls that have no task to update. */
    ProgressReporter NONE = new ProgressReporter() {
        @Override
        public void progress(String stage, int current, int total, String message, String currentItem) {
        }

        @Override
        public void partialResult(TaskOutput partial) {
        }
    };
}
