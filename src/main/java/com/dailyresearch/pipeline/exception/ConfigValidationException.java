package com.dailyresearch.pipeline.exception;

import java.util.List;

/** Pipeline configuration is unusable; collects every problem found. */
public class ConfigValidationException extends PipelineException {
    private final List<String> problems;

    public ConfigValidationException(List<String> problems) {
        super(PipelineStage.CONFIG, "Invalid research configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
