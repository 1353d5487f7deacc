package com.graphoid.script.parser;

import com.graphoid.script.errors.SourcePosition;

public class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal;
    public final int line;
    public final int column;

    public Token(TokenType type, String lexeme, Object literal, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
    }

    /** Identifier token for nodes the runtime builds itself (synthesized accessors). */
    public static Token synthetic(String name, int line) {
        return new Token(TokenType.IDENTIFIER, name, null, line, 0);
    }

    public SourcePosition position() {
        return new SourcePosition(line, column, null);
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' @" + line + ":" + column;
    }
}
