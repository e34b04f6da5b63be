package com.amannmalik.money.decimal;

import com.amannmalik.money.util.Ensure;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.regex.Pattern;

/**
 * Immutable, arbitrary-precision signed decimal number.
 *
 * <p>Instances are always finite. Every arithmetic or rounding operation returns a new instance;
 * rounding is always {@link RoundingMode#HALF_UP}, i.e. ties move away from zero. Equality and
 * ordering are by numeric value, so {@code 1.50} equals {@code 1.5}.
 */
public final class Decimal implements Comparable<Decimal> {
    public static final Decimal ZERO = new Decimal(BigDecimal.ZERO);

    static final long MAX_EXPONENT = 1_000_000_000L;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    // ASCII digits only; BigDecimal alone also accepts any Unicode digit
    private static final Pattern LITERAL = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");
    private static final BigDecimal HALF = new BigDecimal("0.5");
    private static final BigInteger TWO = BigInteger.valueOf(2);
    private static final BigInteger FIVE = BigInteger.valueOf(5);

    private final BigDecimal value;

    private Decimal(BigDecimal value) {
        this.value = value.stripTrailingZeros();
    }

    /**
     * Accepts a {@link Decimal}, a {@link BigDecimal} or {@link BigInteger}, a boxed primitive number, or a
     * decimal string.
     *
     * @throws DecimalException {@code INVALID_NUMBER} for a NaN or infinite floating-point value,
     *                          {@code INVALID_FORMAT} for an unparseable string and {@code INVALID_TYPE}
     *                          for anything else, including {@code null}
     */
    public static Decimal from(Object value) {
        if (value instanceof Decimal decimal) {
            return decimal;
        }
        if (value instanceof String string) {
            return of(string);
        }
        if (value instanceof Number number) {
            var decimal = fromNumber(number);
            if (decimal != null) {
                return decimal;
            }
        }
        throw new DecimalException(DecimalException.Reason.INVALID_TYPE,
                "Invalid decimal input type: must be Decimal, BigDecimal, number, or string");
    }

    public static Decimal of(double value) {
        return new Decimal(finite(value, "Invalid decimal number value: must be finite and not NaN"));
    }

    public static Decimal of(long value) {
        return new Decimal(BigDecimal.valueOf(value));
    }

    public static Decimal of(BigDecimal value) {
        return new Decimal(Ensure.notNull("value", value));
    }

    /**
     * Parses an optionally signed decimal literal, with or without a fractional part or exponent
     * ({@code "-12.5"}, {@code ".5"}, {@code "1e10"}). Whitespace, {@code "NaN"} and {@code "Infinity"} are rejected.
     */
    public static Decimal of(String value) {
        Ensure.notNull("value", value);
        if (!LITERAL.matcher(value).matches()) {
            throw new DecimalException(DecimalException.Reason.INVALID_FORMAT,
                    "Invalid decimal string format: must be finite and not NaN");
        }
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new DecimalException(DecimalException.Reason.INVALID_FORMAT,
                    "Invalid decimal string format: must be finite and not NaN", e);
        }
        if (parsed.signum() != 0 && Math.abs((long) parsed.precision() - parsed.scale() - 1) > MAX_EXPONENT) {
            throw new DecimalException(DecimalException.Reason.INVALID_FORMAT,
                    "Invalid decimal string format: exponent out of range");
        }
        return new Decimal(parsed);
    }

    public static Decimal sum(Decimal... values) {
        return sum(Arrays.asList(Ensure.notNull("values", values)));
    }

    public static Decimal sum(Collection<Decimal> values) {
        var iterator = nonEmpty(values, "Cannot sum empty sequence");
        var total = Ensure.notNull("value", iterator.next());
        while (iterator.hasNext()) {
            total = total.add(iterator.next());
        }
        return total;
    }

    public static Decimal min(Decimal... values) {
        return min(Arrays.asList(Ensure.notNull("values", values)));
    }

    /** Returns the first of the smallest values. */
    public static Decimal min(Collection<Decimal> values) {
        var iterator = nonEmpty(values, "Cannot get min of empty sequence");
        var result = Ensure.notNull("value", iterator.next());
        while (iterator.hasNext()) {
            var candidate = Ensure.notNull("value", iterator.next());
            if (candidate.compareTo(result) < 0) {
                result = candidate;
            }
        }
        return result;
    }

    public static Decimal max(Decimal... values) {
        return max(Arrays.asList(Ensure.notNull("values", values)));
    }

    /** Returns the first of the largest values. */
    public static Decimal max(Collection<Decimal> values) {
        var iterator = nonEmpty(values, "Cannot get max of empty sequence");
        var result = Ensure.notNull("value", iterator.next());
        while (iterator.hasNext()) {
            var candidate = Ensure.notNull("value", iterator.next());
            if (candidate.compareTo(result) > 0) {
                result = candidate;
            }
        }
        return result;
    }

    public Decimal add(Decimal other) {
        return new Decimal(value.add(Ensure.notNull("other", other).value));
    }

    public Decimal subtract(Decimal other) {
        return new Decimal(value.subtract(Ensure.notNull("other", other).value));
    }

    public Decimal multiply(double multiplier) {
        return new Decimal(value.multiply(operand(multiplier)));
    }

    /**
     * Divides and rounds the quotient to the process-wide default scale.
     */
    public Decimal divide(double divisor) {
        return divide(divisor, DecimalContext.current());
    }

    public Decimal divide(double divisor, DecimalContext context) {
        return divideThenRoundTo(divisor, Ensure.notNull("context", context).defaultScale());
    }

    public Decimal roundTo() {
        return roundTo(DecimalContext.current().defaultScale());
    }

    public Decimal roundTo(int scale) {
        if (value.scale() <= scale(scale)) {
            return this;
        }
        return new Decimal(value.setScale(scale, ROUNDING));
    }

    public Decimal multiplyThenRoundTo(double multiplier) {
        return multiplyThenRoundTo(multiplier, DecimalContext.current().defaultScale());
    }

    public Decimal multiplyThenRoundTo(double multiplier, int scale) {
        var product = value.multiply(operand(multiplier));
        if (product.scale() <= scale(scale)) {
            return new Decimal(product);
        }
        return new Decimal(product.setScale(scale, ROUNDING));
    }

    public Decimal divideThenRoundTo(double divisor) {
        return divideThenRoundTo(divisor, DecimalContext.current().defaultScale());
    }

    public Decimal divideThenRoundTo(double divisor, int scale) {
        var operand = operand(divisor);
        if (operand.signum() == 0) {
            throw new DecimalException(DecimalException.Reason.DIVISION_BY_ZERO, "Division by zero");
        }
        scale(scale);
        if (terminates(value.unscaledValue(), operand.unscaledValue())) {
            return new Decimal(value.divide(operand)).roundTo(scale);
        }
        return new Decimal(value.divide(operand, scale, ROUNDING));
    }

    public Decimal negate() {
        return new Decimal(value.negate());
    }

    public Decimal abs() {
        return signum() < 0 ? negate() : this;
    }

    public int signum() {
        return value.signum();
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    /**
     * Compares by numeric value. Numbers are converted first; any other object, and a NaN or infinite
     * floating-point number, is simply unequal.
     */
    public boolean isEqual(Object other) {
        Decimal operand = null;
        if (other instanceof Decimal decimal) {
            operand = decimal;
        } else if (other instanceof Number number && isFinite(number)) {
            operand = fromNumber(number);
        }
        return operand != null && compareTo(operand) == 0;
    }

    public boolean isLessThan(Decimal other) {
        return compareTo(other) < 0;
    }

    public boolean isLessThan(double other) {
        return compareTo(of(other)) < 0;
    }

    public boolean isLessThanOrEqual(Decimal other) {
        return compareTo(other) <= 0;
    }

    public boolean isLessThanOrEqual(double other) {
        return compareTo(of(other)) <= 0;
    }

    public boolean isGreaterThan(Decimal other) {
        return compareTo(other) > 0;
    }

    public boolean isGreaterThan(double other) {
        return compareTo(of(other)) > 0;
    }

    public boolean isGreaterThanOrEqual(Decimal other) {
        return compareTo(other) >= 0;
    }

    public boolean isGreaterThanOrEqual(double other) {
        return compareTo(of(other)) >= 0;
    }

    /** Returns the smaller value, or this instance when both are equal. */
    public Decimal min(Decimal other) {
        return compareTo(other) > 0 ? other : this;
    }

    /** Returns the larger value, or this instance when both are equal. */
    public Decimal max(Decimal other) {
        return compareTo(other) < 0 ? other : this;
    }

    @Override
    public int compareTo(Decimal other) {
        return value.compareTo(Ensure.notNull("other", other).value);
    }

    /**
     * Lossy for values beyond double precision.
     */
    public double toNumber() {
        return value.doubleValue();
    }

    public BigDecimal toBigDecimal() {
        return value;
    }

    /**
     * Canonical form: plain notation without exponent and without trailing fractional zeros.
     * The result parses back to an equal value through {@link #of(String)}.
     */
    @Override
    public String toString() {
        return value.toPlainString();
    }

    /**
     * Renders the value in the given radix. Integer digits are exact; fractional digits are rounded
     * half-up to the process-wide default scale, counted in digits of the target radix.
     */
    public String toString(int radix) {
        Ensure.inRange("radix", radix, Character.MIN_RADIX, Character.MAX_RADIX);
        if (radix == 10) {
            return toString();
        }
        var magnitude = value.abs();
        var integer = magnitude.toBigInteger();
        var fraction = magnitude.subtract(new BigDecimal(integer));
        var limit = DecimalContext.current().defaultScale();
        var base = BigDecimal.valueOf(radix);
        var digits = new StringBuilder();
        while (fraction.signum() != 0 && digits.length() < limit) {
            fraction = fraction.multiply(base);
            var digit = fraction.intValue();
            digits.append(Character.forDigit(digit, radix));
            fraction = fraction.subtract(BigDecimal.valueOf(digit));
        }
        if (fraction.compareTo(HALF) >= 0) {
            // carried positions become zero and are trailing, so they are dropped
            var i = digits.length() - 1;
            while (i >= 0 && Character.digit(digits.charAt(i), radix) == radix - 1) {
                digits.setLength(i--);
            }
            if (i >= 0) {
                digits.setCharAt(i, Character.forDigit(Character.digit(digits.charAt(i), radix) + 1, radix));
            } else {
                integer = integer.add(BigInteger.ONE);
            }
        }
        var fractionDigits = stripTrailingZeros(digits.toString());
        if (integer.signum() == 0 && fractionDigits.isEmpty()) {
            return "0";
        }
        var sign = value.signum() < 0 ? "-" : "";
        var integerDigits = integer.toString(radix);
        return fractionDigits.isEmpty() ? sign + integerDigits : sign + integerDigits + "." + fractionDigits;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Decimal other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    private static Decimal fromNumber(Number number) {
        if (number instanceof BigDecimal bigDecimal) {
            return of(bigDecimal);
        }
        if (number instanceof BigInteger bigInteger) {
            return new Decimal(new BigDecimal(bigInteger));
        }
        if (number instanceof Double || number instanceof Float) {
            var floating = number.doubleValue();
            finite(floating, "Invalid decimal number value: must be finite and not NaN");
            // Float.toString keeps 0.1f as 0.1 instead of its widened double expansion
            return number instanceof Float f ? new Decimal(new BigDecimal(f.toString())) : of(floating);
        }
        if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return of(number.longValue());
        }
        return null;
    }

    private static boolean isFinite(Number number) {
        return !(number instanceof Double || number instanceof Float) || Double.isFinite(number.doubleValue());
    }

    private static BigDecimal finite(double value, String message) {
        if (!Double.isFinite(value)) {
            throw new DecimalException(DecimalException.Reason.INVALID_NUMBER, message);
        }
        return BigDecimal.valueOf(value);
    }

    private static BigDecimal operand(double value) {
        return finite(value, "Invalid operand: must be finite and not NaN");
    }

    /**
     * Whether {@code numerator / denominator} has a finite decimal expansion, i.e. the reduced denominator
     * has no prime factors other than 2 and 5.
     */
    private static boolean terminates(BigInteger numerator, BigInteger denominator) {
        var reduced = denominator.abs().divide(denominator.gcd(numerator));
        for (var factor : new BigInteger[]{TWO, FIVE}) {
            while (reduced.mod(factor).signum() == 0) {
                reduced = reduced.divide(factor);
            }
        }
        return reduced.equals(BigInteger.ONE);
    }

    private static int scale(int scale) {
        return Ensure.inRange("scale", scale, 0, DecimalContext.MAX_SCALE);
    }

    private static Iterator<Decimal> nonEmpty(Collection<Decimal> values, String message) {
        if (Ensure.notNull("values", values).isEmpty()) {
            throw new DecimalException(DecimalException.Reason.EMPTY_SEQUENCE, message);
        }
        return values.iterator();
    }

    private static String stripTrailingZeros(String digits) {
        var end = digits.length();
        while (end > 0 && digits.charAt(end - 1) == '0') {
            end--;
        }
        return digits.substring(0, end);
    }
}
