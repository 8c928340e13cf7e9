package com.contentcuration.curator.exception;

/**
 * Missing or malformed settings. Fatal: raised while the context starts, before any pipeline step.
 */
public class CuratorConfigurationException extends CuratorException {

    public CuratorConfigurationException(String message) {
        super("CONFIGURATION_ERROR", message);
    }
}
