package org.introspect.runtime;

/**
 * Raised when interpreted code terminates the process, either through {@code abort()} or through the assertion
 * failure function.
 */
public class AbortException extends RuntimeException {

    public AbortException(String message) {
        super(message);
    }
}
