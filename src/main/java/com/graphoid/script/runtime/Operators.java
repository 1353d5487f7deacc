package com.graphoid.script.runtime;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import com.graphoid.script.config.PrecisionMode;
import com.graphoid.script.config.RuntimeConfig;
import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.parser.TokenType;

/**
 * Arithmetic, comparison and numeric coercion. Numeric representation follows the active
 * {@link RuntimeConfig}: plain doubles by default, big numbers under {@code :high}/{@code :extended}.
 */
public final class Operators {
    private Operators() {}

    // -------------------------
    // Literals and coercion
    // -------------------------

    /** Interprets a numeric literal lexeme under the given configuration. */
    public static Value numberLiteral(String lexeme, RuntimeConfig cfg) {
        if (cfg.precision == PrecisionMode.STANDARD) {
            return Value.number(Double.parseDouble(lexeme));
        }
        BigDecimal exact = BigNumber.parseLexeme(lexeme);
        boolean integral = exact.stripTrailingZeros().scale() <= 0;
        if (cfg.precision == PrecisionMode.EXTENDED) {
            return integral ? Value.bignum(BigNumber.bigint(exact.toBigIntegerExact())) : Value.bignum(BigNumber.float128(exact));
        }
        if (cfg.integerMode) {
            BigInteger truncated = exact.toBigInteger();
            return Value.bignum(cfg.unsignedMode ? BigNumber.uint64(truncated) : BigNumber.int64(truncated));
        }
        return Value.bignum(BigNumber.float128(exact));
    }

    /** Conversion done by {@code bignum x = v} and {@code to_bignum()}. */
    public static BigNumber toBigNumber(Value v, RuntimeConfig cfg) {
        if (v.type == Value.Type.BIGNUM) return v.asBigNumber();
        if (v.type == Value.Type.STRING) {
            BigDecimal d = BigNumber.parseLexeme(v.asString().trim());
            return fromDecimal(d, cfg);
        }
        if (v.type != Value.Type.NUMBER) {
            throw GraphoidException.type("Cannot convert " + v.typeName() + " to bignum");
        }
        double d = v.asNumber();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw GraphoidException.runtime("Cannot convert " + Value.formatNumber(d) + " to bignum");
        }
        return fromDecimal(new BigDecimal(Double.toString(d)), cfg);
    }

    private static BigNumber fromDecimal(BigDecimal d, RuntimeConfig cfg) {
        if (cfg.integerMode) {
            return cfg.unsignedMode ? BigNumber.uint64(d.toBigInteger()) : BigNumber.int64(d.toBigInteger());
        }
        if (cfg.precision == PrecisionMode.EXTENDED && d.stripTrailingZeros().scale() <= 0) {
            return BigNumber.bigint(d.toBigIntegerExact());
        }
        return BigNumber.float128(d);
    }

    /**
     * Rounding and truncation applied when a number is stored in a variable: integer mode truncates
     * toward zero, {@code decimal_places} rounds half up.
     */
    public static Value onAssignment(Value v, RuntimeConfig cfg) {
        if (v.type == Value.Type.NUMBER) {
            double d = v.asNumber();
            if (cfg.integerMode && cfg.precision == PrecisionMode.STANDARD) d = (d < 0) ? Math.ceil(d) : Math.floor(d);
            if (cfg.decimalPlaces != null) d = roundTo(d, cfg.decimalPlaces);
            return (d == v.asNumber()) ? v : Value.number(d);
        }
        if (v.type == Value.Type.BIGNUM && cfg.decimalPlaces != null) {
            return Value.bignum(v.asBigNumber().round(cfg.decimalPlaces));
        }
        return v;
    }

    public static double roundTo(double d, int places) {
        if (Double.isNaN(d) || Double.isInfinite(d)) return d;
        return new BigDecimal(Double.toString(d)).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    // -------------------------
    // Binary operators
    // -------------------------

    public static Value binary(TokenType op, Value left, Value right) {
        switch (op) {
            case PLUS: return add(left, right);
            case MINUS:
            case STAR:
            case SLASH:
            case SLASH_SLASH:
            case PERCENT:
            case STAR_STAR:
                return arithmetic(op, left, right);
            case EQUAL_EQUAL: return Value.bool(left.valueEquals(right));
            case BANG_EQUAL: return Value.bool(!left.valueEquals(right));
            case LESS: return Value.bool(compare(left, right, "<") < 0);
            case LESS_EQUAL: return Value.bool(compare(left, right, "<=") <= 0);
            case GREATER: return Value.bool(compare(left, right, ">") > 0);
            case GREATER_EQUAL: return Value.bool(compare(left, right, ">=") >= 0);
            case DOT_PLUS: return elementWise(TokenType.PLUS, left, right);
            case DOT_MINUS: return elementWise(TokenType.MINUS, left, right);
            case DOT_STAR: return elementWise(TokenType.STAR, left, right);
            case DOT_SLASH: return elementWise(TokenType.SLASH, left, right);
            case DOT_SLASH_SLASH: return elementWise(TokenType.SLASH_SLASH, left, right);
            case DOT_PERCENT: return elementWise(TokenType.PERCENT, left, right);
            case DOT_CARET: return elementWise(TokenType.STAR_STAR, left, right);
            case DOT_EQUAL_EQUAL: return elementWise(TokenType.EQUAL_EQUAL, left, right);
            case DOT_BANG_EQUAL: return elementWise(TokenType.BANG_EQUAL, left, right);
            case DOT_LESS: return elementWise(TokenType.LESS, left, right);
            case DOT_LESS_EQUAL: return elementWise(TokenType.LESS_EQUAL, left, right);
            case DOT_GREATER: return elementWise(TokenType.GREATER, left, right);
            case DOT_GREATER_EQUAL: return elementWise(TokenType.GREATER_EQUAL, left, right);
            default:
                throw new IllegalStateException("Internal error: unhandled binary operator " + op);
        }
    }

    /**
     * Applies {@code op} item by item. Two lists are zipped to the shorter length; a scalar on
     * either side is broadcast over the list.
     */
    private static Value elementWise(TokenType op, Value left, Value right) {
        boolean leftList = left.type == Value.Type.LIST;
        boolean rightList = right.type == Value.Type.LIST;
        if (!leftList && !rightList) {
            throw GraphoidException.runtime("Element-wise operations require at least one list, got "
                    + left.typeName() + " and " + right.typeName());
        }
        List<Value> out = new ArrayList<>();
        if (leftList && rightList) {
            List<Value> a = left.asList().items();
            List<Value> b = right.asList().items();
            int n = Math.min(a.size(), b.size());
            for (int i = 0; i < n; i++) out.add(binary(op, a.get(i), b.get(i)));
        } else if (leftList) {
            for (Value item : left.asList().items()) out.add(binary(op, item, right));
        } else {
            for (Value item : right.asList().items()) out.add(binary(op, left, item));
        }
        return Value.list(out);
    }

    private static Value add(Value left, Value right) {
        if (left.type == Value.Type.STRING || right.type == Value.Type.STRING) {
            return Value.string(left.toDisplayString() + right.toDisplayString());
        }
        if (left.type == Value.Type.LIST && right.type == Value.Type.LIST) {
            List<Value> items = new ArrayList<>(Value.copyAll(left.asList().items()));
            items.addAll(Value.copyAll(right.asList().items()));
            return Value.list(left.asList().derive(items));
        }
        return arithmetic(TokenType.PLUS, left, right);
    }

    private static Value arithmetic(TokenType op, Value left, Value right) {
        if (!left.isNumeric() || !right.isNumeric()) {
            throw GraphoidException.type("Unsupported operand types for " + symbol(op) + ": "
                    + left.typeName() + " and " + right.typeName());
        }
        if (left.type == Value.Type.BIGNUM || right.type == Value.Type.BIGNUM) {
            BigNumber a = promote(left, right);
            BigNumber b = promote(right, left);
            switch (op) {
                case PLUS: return Value.bignum(a.add(b));
                case MINUS: return Value.bignum(a.subtract(b));
                case STAR: return Value.bignum(a.multiply(b));
                case SLASH: return Value.bignum(a.divide(b));
                case SLASH_SLASH: return Value.bignum(a.floorDivide(b));
                case PERCENT: return Value.bignum(a.remainder(b));
                case STAR_STAR: return Value.bignum(a.pow(b));
                default: throw new IllegalStateException("Internal error: unhandled arithmetic operator " + op);
            }
        }
        double a = left.asNumber();
        double b = right.asNumber();
        switch (op) {
            case PLUS: return Value.number(a + b);
            case MINUS: return Value.number(a - b);
            case STAR: return Value.number(a * b);
            case SLASH:
                if (b == 0) throw GraphoidException.runtime("Division by zero");
                return Value.number(a / b);
            case SLASH_SLASH:
                if (b == 0) throw GraphoidException.runtime("Division by zero");
                return Value.number(Math.floor(a / b));
            case PERCENT:
                if (b == 0) throw GraphoidException.runtime("Modulo by zero");
                return Value.number(a % b);
            case STAR_STAR: return Value.number(Math.pow(a, b));
            default: throw new IllegalStateException("Internal error: unhandled arithmetic operator " + op);
        }
    }

    /** Big-number form of {@code v}; an integral num next to an integer big number stays an integer. */
    private static BigNumber promote(Value v, Value peer) {
        if (v.type == Value.Type.BIGNUM) return v.asBigNumber();
        double d = v.asNumber();
        BigNumber other = peer.asBigNumber();
        if (other.kind != BigNumber.Kind.FLOAT128 && d == Math.rint(d) && !Double.isInfinite(d)) {
            BigInteger i = new BigDecimal(Double.toString(d)).toBigInteger();
            switch (other.kind) {
                case UINT64: return (i.signum() >= 0) ? BigNumber.uint64(i) : BigNumber.int64(i);
                case BIGINT: return BigNumber.bigint(i);
                default: return BigNumber.int64(i);
            }
        }
        return BigNumber.fromDouble(d);
    }

    public static int compare(Value left, Value right, String op) {
        if (left.isNumeric() && right.isNumeric()) {
            if (left.type == Value.Type.NUMBER && right.type == Value.Type.NUMBER) {
                return compareNumbers(left.asNumber(), right.asNumber());
            }
            return promote(left, right).compareTo(promote(right, left));
        }
        if (left.type == Value.Type.STRING && right.type == Value.Type.STRING) {
            return left.asString().compareTo(right.asString());
        }
        throw GraphoidException.type("Cannot compare " + left.typeName() + " and " + right.typeName() + " with " + op);
    }

    /** Numeric ordering where -0.0 equals 0.0; NaN sorts last. */
    public static int compareNumbers(double a, double b) {
        if (a < b) return -1;
        if (a > b) return 1;
        if (a == b) return 0;
        return Double.compare(a, b);
    }

    // -------------------------
    // Unary operators
    // -------------------------

    public static Value negate(Value v) {
        if (v.type == Value.Type.NUMBER) return Value.number(-v.asNumber());
        if (v.type == Value.Type.BIGNUM) return Value.bignum(v.asBigNumber().negate());
        throw GraphoidException.type("Cannot negate " + v.typeName());
    }

    private static String symbol(TokenType op) {
        switch (op) {
            case PLUS: return "+";
            case MINUS: return "-";
            case STAR: return "*";
            case SLASH: return "/";
            case SLASH_SLASH: return "//";
            case PERCENT: return "%";
            case STAR_STAR: return "**";
            default: return op.name();
        }
    }
}
