package com.groupdispatch.sandbox;

/**
 * The sandbox process could not be spawned. Fatal to the current turn only.
 */
public class SandboxStartException extends RuntimeException {

    public SandboxStartException(String message) {
        super(message);
    }

    public SandboxStartException(String message, Throwable cause) {
        super(message, cause);
    }
}
