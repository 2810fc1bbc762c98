package com.deploypilot.engine.definition;

import java.util.List;

/**
 * Outcome of parsing a pipeline document: either a valid definition or the
 * list of reasons it was rejected. Bad input is reported here, not thrown.
 */
public record DefinitionParseResult(PipelineDefinition definition, List<String> errors) {

    public DefinitionParseResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static DefinitionParseResult valid(PipelineDefinition definition) {
        return new DefinitionParseResult(definition, List.of());
    }

    public static DefinitionParseResult invalid(List<String> errors) {
        return new DefinitionParseResult(null, errors);
    }

    public boolean isValid() {
        return definition != null && errors.isEmpty();
    }

    /** Errors joined into one line, for error_message columns. */
    public String errorSummary() {
        return String.join("; ", errors);
    }
}
