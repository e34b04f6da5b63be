package com.amannmalik.money.api;

import com.amannmalik.money.decimal.Decimal;
import com.amannmalik.money.decimal.DecimalException;
import com.amannmalik.money.util.Ensure;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Immutable monetary amount tagged with a currency.
 *
 * <p>Operations that combine several amounts require them to share one currency and throw
 * {@link MoneyException} with reason {@code CURRENCY_MISMATCH} otherwise. Rounding and scale defaults
 * follow {@link Decimal}. Minor units are {@code long}; {@link #toCents()} fails with
 * {@code CENTS_OUT_OF_RANGE} beyond that range.
 */
public record Money(Decimal amount, CurrencyCode currency) {
    private static final int CENTS_SCALE = 2;
    private static final BigDecimal MIN_CENTS = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal MAX_CENTS = BigDecimal.valueOf(Long.MAX_VALUE);

    public Money {
        amount = Ensure.notNull("money.amount", amount);
        if (currency == null) {
            throw MoneyException.invalidCurrency(null);
        }
    }

    /**
     * @param value anything {@link Decimal#from(Object)} accepts; its failures propagate unchanged
     */
    public static Money create(Object value, CurrencyCode currency) {
        if (currency == null) {
            throw MoneyException.invalidCurrency(null);
        }
        return new Money(Decimal.from(value), currency);
    }

    public static Money create(Object value, String currencyCode) {
        var currency = CurrencyCode.parse(currencyCode);
        return new Money(Decimal.from(value), currency);
    }

    public static Money zero(CurrencyCode currency) {
        return new Money(Decimal.ZERO, currency);
    }

    public static Money fromCents(long cents, CurrencyCode currency) {
        return new Money(Decimal.of(BigDecimal.valueOf(cents, CENTS_SCALE)), currency);
    }

    /**
     * @throws MoneyException {@code INVALID_CENTS} unless {@code cents} is a finite whole number
     */
    public static Money fromCents(double cents, CurrencyCode currency) {
        if (!Double.isFinite(cents) || cents != Math.rint(cents)) {
            throw MoneyException.invalidCents(cents);
        }
        return new Money(Decimal.of(BigDecimal.valueOf(cents).movePointLeft(CENTS_SCALE)), currency);
    }

    /**
     * Reads a transfer record. The amount goes through the decimal string parser and the currency through
     * {@link CurrencyCode#parse(String)}.
     */
    public static Money fromRecord(MoneyTransfer record) {
        Ensure.notNull("record", record);
        var amount = Decimal.of(record.amount());
        return new Money(amount, CurrencyCode.parse(record.currency()));
    }

    public static Money sum(Money... values) {
        return sum(Arrays.asList(Ensure.notNull("values", values)));
    }

    public static Money sum(Collection<Money> values) {
        var currency = sharedCurrency(values, "Cannot sum empty array", MoneyException.Operation.SUM);
        return new Money(Decimal.sum(amounts(values)), currency);
    }

    public static Money min(Money... values) {
        return min(Arrays.asList(Ensure.notNull("values", values)));
    }

    public static Money min(Collection<Money> values) {
        var currency = sharedCurrency(values, "Cannot get min of empty array", MoneyException.Operation.COMPARE);
        return new Money(Decimal.min(amounts(values)), currency);
    }

    public static Money max(Money... values) {
        return max(Arrays.asList(Ensure.notNull("values", values)));
    }

    public static Money max(Collection<Money> values) {
        var currency = sharedCurrency(values, "Cannot get max of empty array", MoneyException.Operation.COMPARE);
        return new Money(Decimal.max(amounts(values)), currency);
    }

    public String getCurrencyCode() {
        return currency.name();
    }

    public Money add(Money other) {
        requireSameCurrency(other, MoneyException.Operation.ADD);
        return new Money(amount.add(other.amount), currency);
    }

    public Money subtract(Money other) {
        requireSameCurrency(other, MoneyException.Operation.SUBTRACT);
        return new Money(amount.subtract(other.amount), currency);
    }

    public Money multiplyThenRound(double multiplier) {
        return new Money(amount.multiplyThenRoundTo(multiplier), currency);
    }

    public Money multiplyThenRound(double multiplier, int scale) {
        return new Money(amount.multiplyThenRoundTo(multiplier, scale), currency);
    }

    public Money divideThenRound(double divisor) {
        return new Money(amount.divideThenRoundTo(divisor), currency);
    }

    public Money divideThenRound(double divisor, int scale) {
        return new Money(amount.divideThenRoundTo(divisor, scale), currency);
    }

    public Money round() {
        return new Money(amount.roundTo(), currency);
    }

    public Money round(int scale) {
        return new Money(amount.roundTo(scale), currency);
    }

    /**
     * Never throws: anything other than a {@link Money} in the same currency with the same value is unequal.
     */
    public boolean isEqual(Object other) {
        return other instanceof Money money
                && currency == money.currency
                && amount.isEqual(money.amount);
    }

    public boolean isLessThan(Money other) {
        requireSameCurrency(other, MoneyException.Operation.COMPARE);
        return amount.isLessThan(other.amount);
    }

    public boolean isLessThanOrEqual(Money other) {
        requireSameCurrency(other, MoneyException.Operation.COMPARE);
        return amount.isLessThanOrEqual(other.amount);
    }

    public boolean isGreaterThan(Money other) {
        requireSameCurrency(other, MoneyException.Operation.COMPARE);
        return amount.isGreaterThan(other.amount);
    }

    public boolean isGreaterThanOrEqual(Money other) {
        requireSameCurrency(other, MoneyException.Operation.COMPARE);
        return amount.isGreaterThanOrEqual(other.amount);
    }

    /** Returns whichever instance is smaller, this one on a tie. */
    public Money min(Money other) {
        requireSameCurrency(other, MoneyException.Operation.COMPARE);
        return other.amount.isLessThan(amount) ? other : this;
    }

    /** Returns whichever instance is larger, this one on a tie. */
    public Money max(Money other) {
        requireSameCurrency(other, MoneyException.Operation.COMPARE);
        return other.amount.isGreaterThan(amount) ? other : this;
    }

    public boolean isZero() {
        return amount.isZero();
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    /**
     * Amount in minor units, rounded half-up in decimal arithmetic.
     *
     * @throws MoneyException {@code CENTS_OUT_OF_RANGE} when the result does not fit in a {@code long}
     */
    public long toCents() {
        var cents = amount.multiplyThenRoundTo(100, 0).toBigDecimal();
        if (cents.compareTo(MIN_CENTS) < 0 || cents.compareTo(MAX_CENTS) > 0) {
            throw MoneyException.centsOutOfRange(amount);
        }
        return cents.longValue();
    }

    public MoneyTransfer toRecord() {
        return new MoneyTransfer(amount.toString(), currency.name());
    }

    public double toNumber() {
        return amount.toNumber();
    }

    public BigDecimal toBigDecimal() {
        return amount.toBigDecimal();
    }

    public String toString(int radix) {
        return amount.toString(radix);
    }

    @Override
    public String toString() {
        return amount.toString();
    }

    private void requireSameCurrency(Money other, MoneyException.Operation operation) {
        Ensure.notNull("other", other);
        if (currency != other.currency) {
            throw MoneyException.currencyMismatch(operation);
        }
    }

    private static CurrencyCode sharedCurrency(
            Collection<Money> values, String emptyMessage, MoneyException.Operation operation) {
        if (Ensure.notNull("values", values).isEmpty()) {
            throw new DecimalException(DecimalException.Reason.EMPTY_SEQUENCE, emptyMessage);
        }
        CurrencyCode currency = null;
        for (var value : values) {
            Ensure.notNull("value", value);
            if (currency == null) {
                currency = value.currency;
            } else if (value.currency != currency) {
                throw MoneyException.currencyMismatch(operation);
            }
        }
        return currency;
    }

    private static List<Decimal> amounts(Collection<Money> values) {
        return values.stream().map(Money::amount).toList();
    }
}
