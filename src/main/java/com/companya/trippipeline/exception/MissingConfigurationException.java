package com.companya.trippipeline.exception;

/**
 * Raised at the start of an invocation when a required stage setting is blank.
 */
public class MissingConfigurationException extends RuntimeException {

    public MissingConfigurationException(String property) {
        super("Required configuration '" + property + "' is not set");
    }
}
