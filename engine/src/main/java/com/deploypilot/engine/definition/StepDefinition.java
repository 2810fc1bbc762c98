package com.deploypilot.engine.definition;

import java.util.List;

/**
 * One named step of a pipeline definition.
 *
 * @param name     display name, used in transcript headers
 * @param image    container image the step runs in
 * @param commands shell commands, run in order under {@code set -e}
 */
public record StepDefinition(String name, String image, List<String> commands) {

    public StepDefinition {
        commands = commands == null ? List.of() : List.copyOf(commands);
    }
}
