package com.contentcuration.curator.exception;

/**
 * Unknown source name or id. Aborts only the operation that asked for it.
 */
public class SourceNotFoundException extends CuratorException {

    public SourceNotFoundException(String message) {
        super("SOURCE_NOT_FOUND", message);
    }

    public static SourceNotFoundException byName(String name) {
        return new SourceNotFoundException("Source not found: " + name);
    }

    public static SourceNotFoundException byId(Long id) {
        return new SourceNotFoundException("Source not found: id=" + id);
    }
}
