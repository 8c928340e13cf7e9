package com.contentcuration.curator.exception;

/**
 * The publication step could not mark every selected item; its transaction is rolled back.
 */
public class DigestPublicationException extends CuratorException {

    public DigestPublicationException(String message) {
        super("DIGEST_PUBLICATION_FAILED", message);
    }

    public static DigestPublicationException partialMarking(int selected, int marked) {
        return new DigestPublicationException(
                "Marked " + marked + " of " + selected + " selected items as published; rolling back digest");
    }
}
