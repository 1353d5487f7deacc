package com.graphoid.script.parser;

public enum TokenType {
    // Single-character tokens.
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, DOT, COLON, SEMICOLON, PIPE, PLUS, MINUS, STAR, SLASH, PERCENT,

    // One or two character tokens.
    BANG, BANG_EQUAL, EQUAL, EQUAL_EQUAL, GREATER, GREATER_EQUAL, LESS, LESS_EQUAL,
    AND_AND, OR_OR, SLASH_SLASH, STAR_STAR, ARROW, ELLIPSIS,

    // Element-wise operators.
    DOT_PLUS, DOT_MINUS, DOT_STAR, DOT_SLASH, DOT_SLASH_SLASH, DOT_PERCENT, DOT_CARET,
    DOT_EQUAL_EQUAL, DOT_BANG_EQUAL, DOT_LESS, DOT_LESS_EQUAL, DOT_GREATER, DOT_GREATER_EQUAL,

    // Literals.
    IDENTIFIER, STRING, NUMBER, SYMBOL,

    // Keywords.
    FN, RETURN, IF, ELSE, UNLESS, WHILE, FOR, IN, BREAK, CONTINUE, TRUE, FALSE, NONE,
    GRAPH, TREE, FROM, RULE, CONFIGURE, PRECISION, TRY, CATCH, FINALLY, AS, RAISE, MATCH,
    IMPORT, LOAD, MODULE, PRIV, STATIC, SET, WHEN, SUPER, AND, OR, NOT,

    NEWLINE, EOF
}
