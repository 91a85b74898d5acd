package com.example.dutyroster.exception;

import java.util.List;

/**
 * Raised when the run configuration refers to members that are not on the
 * roster, or is otherwise self-contradictory. Detected before slot processing.
 */
public class ConfigInconsistencyException extends ScheduleGenerationException {

    private final List<String> problems;

    public ConfigInconsistencyException(List<String> problems) {
        super("CONFIG_INCONSISTENCY", "Configuration is inconsistent: " + String.join("; ", problems),
                problems.toArray());
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
