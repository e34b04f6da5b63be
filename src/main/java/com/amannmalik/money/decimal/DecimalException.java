package com.amannmalik.money.decimal;

import com.amannmalik.money.util.Ensure;

/**
 * Raised when a {@link Decimal} cannot be constructed or an operation on it has no defined result.
 */
public final class DecimalException extends RuntimeException {
    private final Reason reason;

    public DecimalException(Reason reason, String message) {
        super(message);
        this.reason = Ensure.notNull("reason", reason);
    }

    public DecimalException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Ensure.notNull("reason", reason);
    }

    public Reason reason() {
        return reason;
    }

    public enum Reason {
        /** A floating-point input was NaN or infinite. */
        INVALID_NUMBER,
        /** A string input did not parse to a finite decimal. */
        INVALID_FORMAT,
        /** The input was none of the accepted shapes. */
        INVALID_TYPE,
        DIVISION_BY_ZERO,
        EMPTY_SEQUENCE
    }
}
