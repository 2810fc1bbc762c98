package com.deploypilot.engine.definition;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed, immutable pipeline definition: the ordered steps of the
 * {@code default} pipeline. Step order is the order of the source document.
 */
public record PipelineDefinition(List<StepDefinition> steps) {

    public static final String DEFAULT_IMAGE = "atlassian/default-image:3";

    public PipelineDefinition {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * Structural problems that make the definition unrunnable.
     * An empty list means the definition is valid.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (steps.isEmpty()) {
            errors.add("Pipeline defines no steps");
        }
        for (int i = 0; i < steps.size(); i++) {
            StepDefinition step = steps.get(i);
            if (step.commands().isEmpty()) {
                errors.add("Step %d ('%s') has no script commands".formatted(i + 1, step.name()));
            }
            if (step.image() == null || step.image().isBlank()) {
                errors.add("Step %d ('%s') has no image".formatted(i + 1, step.name()));
            }
        }
        return errors;
    }
}
