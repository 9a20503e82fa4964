package org.neuralchilli.flotilla.service;

/**
 * Thrown when a workflow's task or group dependencies form a cycle, or a
 * dependency names a task the workflow does not define.
 * Unchecked: it is a submission error raised while building the DAG.
 */
public class CyclicDependencyException extends RuntimeException {

    public CyclicDependencyException(String message) {
        super(message);
    }

    public CyclicDependencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
