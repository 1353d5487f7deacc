package com.graphoid.script.config;

import com.graphoid.script.errors.GraphoidException;

/**
 * One frame of runtime configuration. Settings arrive from {@code configure { ... }} blocks,
 * {@code precision N { ... }} blocks or host JSON, always as a key plus a raw value
 * (symbol name as String, Boolean or Double).
 */
public final class RuntimeConfig {
    public ErrorMode errorMode = ErrorMode.STRICT;
    public BoundsCheckingMode boundsChecking = BoundsCheckingMode.STRICT;
    public PrecisionMode precision = PrecisionMode.STANDARD;
    public boolean integerMode = false;
    public boolean unsignedMode = false;
    public Integer decimalPlaces = null;
    public boolean skipNone = false;
    public boolean strictTypes = false;

    public RuntimeConfig copy() {
        RuntimeConfig c = new RuntimeConfig();
        c.errorMode = errorMode;
        c.boundsChecking = boundsChecking;
        c.precision = precision;
        c.integerMode = integerMode;
        c.unsignedMode = unsignedMode;
        c.decimalPlaces = decimalPlaces;
        c.skipNone = skipNone;
        c.strictTypes = strictTypes;
        return c;
    }

    public void set(String key, Object raw) {
        switch (key) {
            case "error_mode":
                errorMode = parseEnum(ErrorMode.class, key, raw);
                break;
            case "bounds_checking":
                boundsChecking = parseEnum(BoundsCheckingMode.class, key, raw);
                break;
            case "precision":
                if (raw instanceof Double) {
                    decimalPlaces = places(key, raw);
                } else if ("int".equals(raw)) {
                    decimalPlaces = 0;
                } else {
                    precision = parseEnum(PrecisionMode.class, key, raw);
                }
                break;
            case "integer":
                integerMode = flag(key, raw, "integer");
                break;
            case "unsigned":
                unsignedMode = flag(key, raw, "unsigned");
                break;
            case "decimal_places":
                decimalPlaces = (raw == null) ? null : places(key, raw);
                break;
            case "skip_none":
                skipNone = flag(key, raw, "skip_none");
                break;
            case "strict_types":
                strictTypes = flag(key, raw, "strict_types");
                break;
            default:
                throw GraphoidException.config("Unknown configuration key: " + key);
        }
    }

    /** Standalone symbol inside a configure block, e.g. {@code configure { :integer, :high }}. */
    public void setFlag(String symbol) {
        switch (symbol) {
            case "integer":
            case "unsigned":
            case "skip_none":
            case "strict_types":
                set(symbol, Boolean.TRUE);
                break;
            case "standard":
            case "high":
            case "extended":
                precision = parseEnum(PrecisionMode.class, "precision", symbol);
                break;
            case "strict":
            case "lenient":
            case "collect":
                errorMode = parseEnum(ErrorMode.class, "error_mode", symbol);
                break;
            default:
                throw GraphoidException.config("Unknown configuration flag: :" + symbol);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, Object raw) {
        if (raw instanceof String) {
            for (E e : type.getEnumConstants()) {
                if (e.name().equalsIgnoreCase((String) raw)) return e;
            }
        }
        throw GraphoidException.config("Invalid value for " + key + ": " + describe(raw));
    }

    private static boolean flag(String key, Object raw, String positiveSymbol) {
        if (raw instanceof Boolean) return (Boolean) raw;
        if (positiveSymbol.equals(raw)) return true;
        throw GraphoidException.config("Invalid value for " + key + ": " + describe(raw));
    }

    private static int places(String key, Object raw) {
        if (raw instanceof Double) {
            double d = (Double) raw;
            if (d >= 0 && d == Math.floor(d)) return (int) d;
        }
        throw GraphoidException.config("Invalid value for " + key + ": " + describe(raw));
    }

    private static String describe(Object raw) {
        if (raw instanceof String) return ":" + raw;
        return String.valueOf(raw);
    }
}
