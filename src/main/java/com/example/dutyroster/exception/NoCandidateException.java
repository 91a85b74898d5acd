package com.example.dutyroster.exception;

import com.example.dutyroster.schedule.ScheduleResult;

/**
 * A slot could not be filled. Carries the partial result so callers can show
 * the committed assignments and the per-member diagnostic.
 */
public class NoCandidateException extends ScheduleGenerationException {

    private final transient ScheduleResult result;

    public NoCandidateException(ScheduleResult result) {
        super("NO_CANDIDATE", "No candidate for " + result.failure().slot().label() + ": " + result.failure().digest(),
                result.failure().slot());
        this.result = result;
    }

    public ScheduleResult getResult() {
        return result;
    }
}
