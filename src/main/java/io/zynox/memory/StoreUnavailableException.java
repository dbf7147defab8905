package io.zynox.memory;

/**
 * The persistence layer could not be reached or rejected a statement.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
