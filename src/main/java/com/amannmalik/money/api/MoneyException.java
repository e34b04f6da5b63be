package com.amannmalik.money.api;

import com.amannmalik.money.util.Ensure;

/**
 * Raised when a {@link Money} operation violates a currency or minor-unit invariant. Failures of the
 * underlying number surface as {@link com.amannmalik.money.decimal.DecimalException} instead.
 */
public final class MoneyException extends RuntimeException {
    static final String COMPARE_MISMATCH = "Cannot compare Money instances with different currencies";
    static final String SUM_MISMATCH = "Cannot sum Money instances with different currencies";

    private final Reason reason;
    private final Operation operation;

    private MoneyException(Reason reason, Operation operation, String message) {
        super(message);
        this.reason = Ensure.notNull("reason", reason);
        this.operation = operation;
    }

    static MoneyException invalidCurrency(Object code) {
        return new MoneyException(Reason.INVALID_CURRENCY, null, "Invalid currency code: " + code);
    }

    static MoneyException invalidCents(double cents) {
        return new MoneyException(Reason.INVALID_CENTS, null, "Cents must be an integer: " + cents);
    }

    static MoneyException centsOutOfRange(Object amount) {
        return new MoneyException(Reason.CENTS_OUT_OF_RANGE, null, "Amount exceeds the minor unit range: " + amount);
    }

    static MoneyException currencyMismatch(Operation operation) {
        var message = switch (operation) {
            case ADD -> "Cannot add money with different currency codes";
            case SUBTRACT -> "Cannot subtract money with different currency codes";
            case COMPARE -> COMPARE_MISMATCH;
            case SUM -> SUM_MISMATCH;
        };
        return new MoneyException(Reason.CURRENCY_MISMATCH, operation, message);
    }

    public Reason reason() {
        return reason;
    }

    /**
     * The operation that detected a currency mismatch, or {@code null} for other reasons.
     */
    public Operation operation() {
        return operation;
    }

    public enum Reason {
        INVALID_CURRENCY,
        CURRENCY_MISMATCH,
        INVALID_CENTS,
        /** {@link Money#toCents()} result does not fit in a {@code long}. */
        CENTS_OUT_OF_RANGE
    }

    public enum Operation {
        ADD,
        SUBTRACT,
        COMPARE,
        SUM
    }
}
