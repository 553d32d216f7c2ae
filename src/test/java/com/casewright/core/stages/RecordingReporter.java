package com.casewright.core.stages;

import com.casewright.core.model.FunctionPointOutcome;
import com.casewright.core.model.TaskOutput;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Captures everything a stage reports, in call order. */
class RecordingReporter implements ProgressReporter {

    record Update(String stage, int current, int total, String message, String currentItem) {}

    final List<Update> updates = Collections.synchronizedList(new ArrayList<>());
    final List<TaskOutput> partials = Collections.synchronizedList(new ArrayList<>());
    final List<FunctionPointOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void progress(String stage, int current, int total, String message, String currentItem) {
        updates.add(new Update(stage, current, total, message, currentItem));
    }

    @Override
    public void partialResult(TaskOutput partial) {
        partials.add(partial);
    }

    @Override
    public void unitResolved(FunctionPointOutcome outcome) {
        outcomes.add(outcome);
    }
}
