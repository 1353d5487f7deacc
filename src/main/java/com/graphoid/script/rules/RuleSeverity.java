package com.graphoid.script.rules;

/** How a rejected operation is reported. The operation is rejected in every case. */
public enum RuleSeverity {
    SILENT,
    WARNING,
    ERROR;

    public static RuleSeverity fromSymbol(String symbol) {
        switch (symbol) {
            case "silent": return SILENT;
            case "warning": return WARNING;
            case "error": return ERROR;
            default: return null;
        }
    }
}
