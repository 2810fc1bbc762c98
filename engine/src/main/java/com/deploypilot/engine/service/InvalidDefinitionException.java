package com.deploypilot.engine.service;

import java.util.List;

/**
 * A pipeline document was rejected at a service boundary. The parser
 * itself reports problems as values; this is how the service refuses them.
 */
public class InvalidDefinitionException extends RuntimeException {

    private final List<String> errors;

    public InvalidDefinitionException(List<String> errors) {
        super("Invalid pipeline configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() { return errors; }
}
