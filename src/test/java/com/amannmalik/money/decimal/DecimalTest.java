package com.amannmalik.money.decimal;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class DecimalTest {
    private static DecimalException.Reason failureOf(Object input) {
        return assertThrows(DecimalException.class, () -> Decimal.from(input)).reason();
    }

    @Test
    void from_acceptsEverySupportedShape() {
        assertEquals("100.5", Decimal.from(100.5).toString());
        assertEquals("100.5", Decimal.from("100.50").toString());
        assertEquals("100.5", Decimal.from(new BigDecimal("100.500")).toString());
        assertEquals("12345678901234567890", Decimal.from(new BigInteger("12345678901234567890")).toString());
        assertEquals("42", Decimal.from(42).toString());
        assertEquals("42", Decimal.from(42L).toString());
        assertEquals("0.1", Decimal.from(0.1f).toString());
    }

    @Test
    void from_returnsExistingDecimal() {
        var original = Decimal.of("7.25");
        assertSame(original, Decimal.from(original));
    }

    @Test
    void from_rejectsNonFiniteNumbers() {
        assertEquals(DecimalException.Reason.INVALID_NUMBER, failureOf(Double.NaN));
        assertEquals(DecimalException.Reason.INVALID_NUMBER, failureOf(Double.POSITIVE_INFINITY));
        assertEquals(DecimalException.Reason.INVALID_NUMBER, failureOf(Double.NEGATIVE_INFINITY));
        assertEquals(DecimalException.Reason.INVALID_NUMBER, failureOf(Float.NaN));
    }

    @Test
    void from_rejectsMalformedStrings() {
        for (var input : new String[]{"", "abc", "1.2.3", "1 000", " 1", "1 ", "NaN", "Infinity", "-Infinity", "12abc",
                "\u0661\u0662", "\u0661\u0662.\u0665", "\uFF11\uFF10", "1\uFF10"}) {
            assertEquals(DecimalException.Reason.INVALID_FORMAT, failureOf(input), input);
        }
    }

    @Test
    void rounding_atLargeScalesKeepsExactValuesWithoutPadding() {
        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            assertEquals("0.1", Decimal.of("0.1").roundTo(1_000_000).toString());
            assertEquals("150", Decimal.of(100).multiplyThenRoundTo(1.5, 1_000_000).toString());
            assertEquals("0.25", Decimal.of(1).divideThenRoundTo(4, 1_000_000).toString());
            assertEquals("-2.5", Decimal.of(-10).divideThenRoundTo(4, DecimalContext.MAX_SCALE).toString());
        });
    }

    @Test
    void divideThenRoundTo_roundsNonTerminatingQuotients() {
        assertEquals("0.333", Decimal.of(1).divideThenRoundTo(3, 3).toString());
        assertEquals("0.7", Decimal.of(2).divideThenRoundTo(3, 1).toString());
        assertEquals("0.13", Decimal.of(1).divideThenRoundTo(8, 2).toString());
    }

    @Test
    void from_rejectsExponentsBeyondRange() {
        assertEquals(DecimalException.Reason.INVALID_FORMAT, failureOf("1e2000000000"));
        assertEquals(DecimalException.Reason.INVALID_FORMAT, failureOf("1e99999999999"));
    }

    @Test
    void from_rejectsUnsupportedTypes() {
        assertEquals(DecimalException.Reason.INVALID_TYPE, failureOf(null));
        assertEquals(DecimalException.Reason.INVALID_TYPE, failureOf(new Object()));
        assertEquals(DecimalException.Reason.INVALID_TYPE, failureOf(true));
        assertEquals(DecimalException.Reason.INVALID_TYPE, failureOf(new java.util.concurrent.atomic.AtomicLong(1)));
    }

    @Test
    void of_acceptsExponentAndSignVariants() {
        assertEquals("10000000000", Decimal.of("1e10").toString());
        assertEquals("0.00012", Decimal.of("1.2E-4").toString());
        assertEquals("5", Decimal.of("+5").toString());
        assertEquals("0.5", Decimal.of(".5").toString());
        assertEquals("-12.5", Decimal.of("-12.50").toString());
    }

    @Test
    void of_doubleUsesShortestDecimalForm() {
        assertEquals("0.1", Decimal.of(0.1).toString());
        assertEquals("100.005", Decimal.of(100.005).toString());
        assertEquals("0", Decimal.of(-0.0).toString());
    }

    @Test
    void toString_isCanonical() {
        assertEquals("100.5", Decimal.of("100.5000").toString());
        assertEquals("100", Decimal.of("100.00").toString());
        assertEquals("1000", Decimal.of("1E+3").toString());
        assertEquals("0", Decimal.of("-0.000").toString());
        assertEquals("0.000001", Decimal.of("0.0000010").toString());
    }

    @Test
    void toString_roundTripsThroughParser() {
        for (var input : new String[]{"0", "1", "-1", "100.5", "0.01", "-0.0001", "123456789012345678901234567890.123456789"}) {
            var printed = Decimal.of(input).toString();
            assertEquals(input, printed);
            assertEquals(Decimal.of(input), Decimal.of(printed));
        }
    }

    @Test
    void toString_rendersOtherRadixes() {
        assertEquals("1010", Decimal.of(10).toString(2));
        assertEquals("ff", Decimal.of(255).toString(16));
        assertEquals("0.1", Decimal.of("0.5").toString(2));
        assertEquals("-2.4", Decimal.of("-2.25").toString(16));
        assertEquals("100.5", Decimal.of("100.5").toString(10));
        assertThrows(IllegalArgumentException.class, () -> Decimal.of(1).toString(1));
        assertThrows(IllegalArgumentException.class, () -> Decimal.of(1).toString(37));
    }

    @Test
    void addAndSubtractAreExact() {
        var a = Decimal.of("0.1");
        var b = Decimal.of("0.2");
        assertEquals("0.3", a.add(b).toString());
        assertEquals("-0.1", a.subtract(b).toString());
        assertEquals("1999999999999998", Decimal.of("999999999999999").add(Decimal.of("999999999999999")).toString());
    }

    @Test
    void arithmeticLeavesOperandsUnchanged() {
        var a = Decimal.of("10.5");
        var b = Decimal.of("2.25");
        a.add(b);
        a.subtract(b);
        a.multiply(3);
        a.divide(7);
        a.roundTo(0);
        assertEquals("10.5", a.toString());
        assertEquals("2.25", b.toString());
    }

    @Test
    void multiplyByNativeNumber() {
        assertEquals("123.456789", Decimal.of(100).multiply(1.23456789).toString());
        assertEquals("-50", Decimal.of(100).multiply(-0.5).toString());
        assertEquals("0", Decimal.of(100).multiply(0).toString());
        assertEquals(DecimalException.Reason.INVALID_NUMBER,
                assertThrows(DecimalException.class, () -> Decimal.of(1).multiply(Double.NaN)).reason());
    }

    @Test
    void divide_roundsNonTerminatingQuotientToDefaultScale() {
        assertEquals("0.33333333333333333333", Decimal.of(1).divide(3).toString());
        assertEquals("2.5", Decimal.of(10).divide(4).toString());
        assertEquals("0.3333", Decimal.of(1).divide(3, new DecimalContext(4)).toString());
    }

    @Test
    void divide_rejectsZeroOfEitherSign() {
        for (var divisor : new double[]{0.0, -0.0}) {
            var e = assertThrows(DecimalException.class, () -> Decimal.of(10).divide(divisor));
            assertEquals(DecimalException.Reason.DIVISION_BY_ZERO, e.reason());
            assertEquals("Division by zero", e.getMessage());
            assertThrows(DecimalException.class, () -> Decimal.of(10).divideThenRoundTo(divisor, 2));
        }
    }

    @Test
    void roundTo_roundsHalfAwayFromZero() {
        assertEquals("104.5", Decimal.of("104.45").roundTo(1).toString());
        assertEquals("104.4", Decimal.of("104.44").roundTo(1).toString());
        assertEquals("-104.5", Decimal.of("-104.45").roundTo(1).toString());
        assertEquals("3", Decimal.of("2.5").roundTo(0).toString());
        assertEquals("-3", Decimal.of("-2.5").roundTo(0).toString());
        assertEquals("100", Decimal.of("99.995").roundTo(2).toString());
    }

    @Test
    void roundTo_rejectsNegativeScale() {
        assertThrows(IllegalArgumentException.class, () -> Decimal.of(1).roundTo(-1));
    }

    @Test
    void multiplyThenRoundTo_andDivideThenRoundTo() {
        assertEquals("104.5", Decimal.of(100).multiplyThenRoundTo(1.045, 2).toString());
        assertEquals("104.4", Decimal.of(100).multiplyThenRoundTo(1.044, 2).toString());
        assertEquals("33.3333", Decimal.of(100).divideThenRoundTo(3, 4).toString());
        assertEquals("-33.3333", Decimal.of(100).divideThenRoundTo(-3, 4).toString());
        assertEquals("0.001", Decimal.of(100).multiplyThenRoundTo(0.00001, 10).toString());
    }

    @Test
    void comparisonIgnoresRepresentation() {
        var a = Decimal.of("1.50");
        var b = Decimal.of("1.5");
        assertTrue(a.isEqual(b));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(0, a.compareTo(b));
        assertTrue(a.isLessThanOrEqual(b));
        assertTrue(a.isGreaterThanOrEqual(b));
        assertFalse(a.isLessThan(b));
        assertFalse(a.isGreaterThan(b));
    }

    @Test
    void comparisonAcceptsNativeNumbers() {
        var value = Decimal.of("10.25");
        assertTrue(value.isGreaterThan(10));
        assertTrue(value.isLessThan(10.5));
        assertTrue(value.isLessThanOrEqual(10.25));
        assertTrue(value.isGreaterThanOrEqual(-1));
        assertTrue(value.isEqual(10.25));
        assertTrue(Decimal.of(3).isEqual(3L));
        assertTrue(Decimal.of(3).isEqual(new BigDecimal("3.000")));
    }

    @Test
    void isEqual_treatsForeignValuesAsUnequal() {
        var value = Decimal.of(1);
        assertFalse(value.isEqual("1"));
        assertFalse(value.isEqual(null));
        assertFalse(value.isEqual(Double.NaN));
        assertFalse(value.isEqual(new Object()));
    }

    @Test
    void instanceMinAndMaxPreferReceiverOnTie() {
        var a = Decimal.of("2.0");
        var b = Decimal.of("2");
        var c = Decimal.of("1");
        assertSame(a, a.min(b));
        assertSame(a, a.max(b));
        assertSame(c, a.min(c));
        assertSame(a, a.max(c));
    }

    @Test
    void toNumberIsLossyEscapeHatch() {
        assertEquals(100.5, Decimal.of("100.5").toNumber());
        assertEquals(0.3333333333333333, Decimal.of("0.33333333333333333333").toNumber());
    }

    @Test
    void signHelpers() {
        assertTrue(Decimal.ZERO.isZero());
        assertEquals(-1, Decimal.of("-0.01").signum());
        assertEquals("0.01", Decimal.of("-0.01").abs().toString());
        assertEquals("-5", Decimal.of(5).negate().toString());
    }
}
