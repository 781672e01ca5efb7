package com.modelpack.core.remote;

/**
 * A registry call failed; usually transient and retried by the processor.
 */
public class RemoteRegistryException extends RuntimeException {

    public RemoteRegistryException(String message) {
        super(message);
    }

    public RemoteRegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
