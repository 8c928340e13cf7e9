package com.contentcuration.curator.exception;

/**
 * Transport failure of an external tool: it could not be started, or it exited with an error.
 */
public class CollaboratorException extends CuratorException {

    public CollaboratorException(String message) {
        super("COLLABORATOR_ERROR", message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super("COLLABORATOR_ERROR", message, cause);
    }

    public static CollaboratorException exitCode(String collaborator, int exitCode, String stderr) {
        String detail = stderr == null ? "" : stderr.strip();
        if (detail.length() > 200) {
            detail = detail.substring(0, 200) + "...";
        }
        return new CollaboratorException(collaborator + " exited with code " + exitCode
                + (detail.isEmpty() ? "" : ": " + detail));
    }
}
