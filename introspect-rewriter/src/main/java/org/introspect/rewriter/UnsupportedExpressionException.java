package org.introspect.rewriter;

/**
 * Thrown when an assertion condition contains a node kind or a value type that cannot be reported. The
 * assertion is left as it was and the rest of the unit is still rewritten.
 */
public class UnsupportedExpressionException extends RuntimeException {

    public UnsupportedExpressionException(String message) {
        super(message);
    }
}
