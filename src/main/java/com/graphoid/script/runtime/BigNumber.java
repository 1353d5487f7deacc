package com.graphoid.script.runtime;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

import com.graphoid.script.errors.GraphoidException;

/**
 * High-precision number. Integer kinds hold a BigInteger that is kept within the kind's range;
 * results that leave the range of INT64/UINT64 grow into BIGINT.
 */
public final class BigNumber implements Comparable<BigNumber> {
    public enum Kind { INT64, UINT64, FLOAT128, BIGINT }

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);
    private static final BigInteger ULONG_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);
    private static final BigInteger MAX_EXPONENT = BigInteger.valueOf(999_999_999);

    public final Kind kind;
    private final BigInteger integer;
    private final BigDecimal decimal;

    private BigNumber(Kind kind, BigInteger integer, BigDecimal decimal) {
        this.kind = kind;
        this.integer = integer;
        this.decimal = decimal;
    }

    public static BigNumber float128(BigDecimal d) {
        return new BigNumber(Kind.FLOAT128, null, d.round(MathContext.DECIMAL128));
    }

    public static BigNumber bigint(BigInteger i) {
        return new BigNumber(Kind.BIGINT, i, null);
    }

    /** INT64 when the value fits, BIGINT otherwise. */
    public static BigNumber int64(BigInteger i) {
        return fit(Kind.INT64, i);
    }

    /** UINT64 when the value fits, BIGINT above the range; negative values are rejected. */
    public static BigNumber uint64(BigInteger i) {
        return fit(Kind.UINT64, i);
    }

    public static BigNumber fromDouble(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw GraphoidException.runtime("Cannot convert " + Value.formatNumber(d) + " to bignum");
        }
        return float128(new BigDecimal(Double.toString(d)));
    }

    /** Parses a numeric literal exactly. */
    public static BigDecimal parseLexeme(String lexeme) {
        try {
            return new BigDecimal(lexeme);
        } catch (NumberFormatException e) {
            throw GraphoidException.runtime("Invalid numeric literal: " + lexeme);
        }
    }

    private static BigNumber fit(Kind kind, BigInteger i) {
        switch (kind) {
            case INT64:
                if (i.compareTo(LONG_MIN) >= 0 && i.compareTo(LONG_MAX) <= 0) return new BigNumber(Kind.INT64, i, null);
                return bigint(i);
            case UINT64:
                if (i.signum() < 0) throw GraphoidException.runtime("Unsigned integer underflow: " + i);
                if (i.compareTo(ULONG_MAX) <= 0) return new BigNumber(Kind.UINT64, i, null);
                return bigint(i);
            case BIGINT:
                return bigint(i);
            default:
                return float128(new BigDecimal(i));
        }
    }

    public boolean isInteger() {
        return kind != Kind.FLOAT128 || decimal.stripTrailingZeros().scale() <= 0;
    }

    public boolean isZero() {
        return (kind == Kind.FLOAT128) ? decimal.signum() == 0 : integer.signum() == 0;
    }

    public BigDecimal toBigDecimal() {
        return (kind == Kind.FLOAT128) ? decimal : new BigDecimal(integer);
    }

    public BigInteger toBigInteger() {
        return (kind == Kind.FLOAT128) ? decimal.toBigInteger() : integer;
    }

    public double toDouble() {
        return (kind == Kind.FLOAT128) ? decimal.doubleValue() : integer.doubleValue();
    }

    // -------------------------
    // Arithmetic
    // -------------------------

    private static Kind resultKind(BigNumber a, BigNumber b) {
        if (a.kind == Kind.FLOAT128 || b.kind == Kind.FLOAT128) return Kind.FLOAT128;
        if (a.kind == Kind.BIGINT || b.kind == Kind.BIGINT) return Kind.BIGINT;
        if (a.kind == Kind.UINT64 && b.kind == Kind.UINT64) return Kind.UINT64;
        return Kind.INT64;
    }

    public BigNumber add(BigNumber o) {
        Kind k = resultKind(this, o);
        if (k == Kind.FLOAT128) return float128(toBigDecimal().add(o.toBigDecimal(), MathContext.DECIMAL128));
        return fit(k, integer.add(o.integer));
    }

    public BigNumber subtract(BigNumber o) {
        Kind k = resultKind(this, o);
        if (k == Kind.FLOAT128) return float128(toBigDecimal().subtract(o.toBigDecimal(), MathContext.DECIMAL128));
        return fit(k, integer.subtract(o.integer));
    }

    public BigNumber multiply(BigNumber o) {
        Kind k = resultKind(this, o);
        if (k == Kind.FLOAT128) return float128(toBigDecimal().multiply(o.toBigDecimal(), MathContext.DECIMAL128));
        return fit(k, integer.multiply(o.integer));
    }

    /** Integer kinds divide with truncation; FLOAT128 divides to 34 significant digits. */
    public BigNumber divide(BigNumber o) {
        if (o.isZero()) throw GraphoidException.runtime("Division by zero");
        Kind k = resultKind(this, o);
        if (k == Kind.FLOAT128) return float128(toBigDecimal().divide(o.toBigDecimal(), MathContext.DECIMAL128));
        return fit(k, integer.divide(o.integer));
    }

    public BigNumber floorDivide(BigNumber o) {
        if (o.isZero()) throw GraphoidException.runtime("Division by zero");
        Kind k = resultKind(this, o);
        if (k == Kind.FLOAT128) {
            return float128(toBigDecimal().divide(o.toBigDecimal(), 0, RoundingMode.FLOOR));
        }
        BigInteger[] qr = integer.divideAndRemainder(o.integer);
        BigInteger q = qr[0];
        if (qr[1].signum() != 0 && (qr[1].signum() != o.integer.signum())) q = q.subtract(BigInteger.ONE);
        return fit(k, q);
    }

    public BigNumber remainder(BigNumber o) {
        if (o.isZero()) throw GraphoidException.runtime("Modulo by zero");
        Kind k = resultKind(this, o);
        if (k == Kind.FLOAT128) return float128(toBigDecimal().remainder(o.toBigDecimal(), MathContext.DECIMAL128));
        return fit(k, integer.remainder(o.integer));
    }

    public BigNumber pow(BigNumber exponent) {
        if (exponent.isInteger()) {
            int e = exponentInt(exponent);
            if (kind != Kind.FLOAT128 && e >= 0) return fit(resultKind(this, this), integer.pow(e));
            if (e < 0 && isZero()) throw GraphoidException.runtime("Division by zero");
            return float128(toBigDecimal().pow(e, MathContext.DECIMAL128));
        }
        double r = Math.pow(toDouble(), exponent.toDouble());
        if (Double.isNaN(r)) throw GraphoidException.runtime("Cannot raise negative number to fractional power");
        if (Double.isInfinite(r)) throw GraphoidException.runtime("Numeric overflow in exponentiation");
        return float128(new BigDecimal(r, MathContext.DECIMAL128));
    }

    // BigDecimal.pow accepts |e| up to 999999999.
    private static int exponentInt(BigNumber exponent) {
        BigInteger e = exponent.toBigInteger();
        if (e.abs().compareTo(MAX_EXPONENT) > 0) {
            throw GraphoidException.runtime("Exponent too large: " + e);
        }
        return e.intValue();
    }

    public BigNumber negate() {
        if (kind == Kind.FLOAT128) return float128(decimal.negate());
        if (kind == Kind.UINT64) return fit(Kind.INT64, integer.negate());
        return fit(kind, integer.negate());
    }

    public BigNumber abs() {
        if (kind == Kind.FLOAT128) return float128(decimal.abs());
        return fit(kind, integer.abs());
    }

    /** Rounds FLOAT128 to the given decimal places; integer kinds are unchanged. */
    public BigNumber round(int places) {
        if (kind != Kind.FLOAT128) return this;
        return float128(decimal.setScale(places, RoundingMode.HALF_UP));
    }

    public BigNumber truncate() {
        if (kind != Kind.FLOAT128) return this;
        return int64(decimal.toBigInteger());
    }

    @Override
    public int compareTo(BigNumber o) {
        if (kind == Kind.FLOAT128 || o.kind == Kind.FLOAT128) return toBigDecimal().compareTo(o.toBigDecimal());
        return integer.compareTo(o.integer);
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof BigNumber) && compareTo((BigNumber) o) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(toDouble());
    }

    @Override
    public String toString() {
        if (kind != Kind.FLOAT128) return integer.toString();
        BigDecimal stripped = decimal.stripTrailingZeros();
        if (stripped.scale() < 0) stripped = stripped.setScale(0);
        return stripped.toPlainString();
    }
}
