package org.neuralchilli.flotilla.service;

import java.util.List;

/**
 * Thrown when a submitted workflow cannot be accepted as defined.
 */
public class ValidationException extends RuntimeException {

    private final List<String> errors;

    public ValidationException(String workflowName, List<String> errors) {
        super("Workflow validation failed for '" + workflowName + "':\n" + String.join("\n", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
