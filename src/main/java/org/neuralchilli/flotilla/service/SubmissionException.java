package org.neuralchilli.flotilla.service;

import java.util.UUID;

/**
 * A workflow was rejected at submission. The rejection is kept in history
 * under {@link #workflowId()} with status FAILED_SUBMISSION.
 */
public class SubmissionException extends RuntimeException {

    private final UUID workflowId;

    public SubmissionException(UUID workflowId, String message, Throwable cause) {
        super(message, cause);
        this.workflowId = workflowId;
    }

    public UUID workflowId() {
        return workflowId;
    }
}
