package org.qed.algebra;

/**
 * Raised for invalid operations requested by a caller, such as a division by zero or a power of zero with a
 * non-positive exponent. Broken kernel invariants are reported through {@link com.google.common.base.VerifyException}
 * instead and are never meant to be caught.
 */
public class SymbolicException extends RuntimeException {
    public SymbolicException(String message) {
        super(message);
    }
}
