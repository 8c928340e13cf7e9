package com.contentcuration.curator.exception;

import java.time.Duration;

/**
 * An external tool exceeded its time bound. Recoverable: the unit is skipped and logged.
 */
public class CollaboratorTimeoutException extends CuratorException {

    private final String collaborator;
    private final Duration timeout;

    public CollaboratorTimeoutException(String collaborator, Duration timeout) {
        super("COLLABORATOR_TIMEOUT", collaborator + " timed out after " + timeout.toSeconds() + "s");
        this.collaborator = collaborator;
        this.timeout = timeout;
    }

    public String getCollaborator() {
        return collaborator;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
