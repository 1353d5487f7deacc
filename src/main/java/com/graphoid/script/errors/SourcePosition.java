package com.graphoid.script.errors;

public final class SourcePosition {
    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0, null);

    public final int line;
    public final int column;
    public final String file;

    public SourcePosition(int line, int column, String file) {
        this.line = line;
        this.column = column;
        this.file = file;
    }

    public boolean isKnown() {
        return line > 0;
    }

    public SourcePosition inFile(String file) {
        return new SourcePosition(line, column, file);
    }

    @Override
    public String toString() {
        String s = "line " + line + ", column " + column;
        return file == null ? s : s + " in " + file;
    }
}
