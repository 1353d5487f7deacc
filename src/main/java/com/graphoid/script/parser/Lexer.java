package com.graphoid.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.errors.SourcePosition;

public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int startLine = 1;
    private int startColumn = 1;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("fn", TokenType.FN);
        map.put("return", TokenType.RETURN);
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("unless", TokenType.UNLESS);
        map.put("while", TokenType.WHILE);
        map.put("for", TokenType.FOR);
        map.put("in", TokenType.IN);
        map.put("break", TokenType.BREAK);
        map.put("continue", TokenType.CONTINUE);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        map.put("none", TokenType.NONE);
        map.put("graph", TokenType.GRAPH);
        map.put("tree", TokenType.TREE);
        map.put("from", TokenType.FROM);
        map.put("rule", TokenType.RULE);
        map.put("configure", TokenType.CONFIGURE);
        map.put("precision", TokenType.PRECISION);
        map.put("try", TokenType.TRY);
        map.put("catch", TokenType.CATCH);
        map.put("finally", TokenType.FINALLY);
        map.put("as", TokenType.AS);
        map.put("raise", TokenType.RAISE);
        map.put("match", TokenType.MATCH);
        map.put("import", TokenType.IMPORT);
        map.put("load", TokenType.LOAD);
        map.put("module", TokenType.MODULE);
        map.put("priv", TokenType.PRIV);
        map.put("static", TokenType.STATIC);
        map.put("set", TokenType.SET);
        map.put("when", TokenType.WHEN);
        map.put("super", TokenType.SUPER);
        map.put("and", TokenType.AND);
        map.put("or", TokenType.OR);
        map.put("not", TokenType.NOT);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = current - lineStart + 1;
            scanToken();
        }
        startLine = line;
        startColumn = current - lineStart + 1;
        start = current;
        tokens.add(new Token(TokenType.EOF, "", null, startLine, startColumn));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '.':
                if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    addToken(TokenType.ELLIPSIS);
                } else {
                    addToken(elementWise());
                }
                break;
            case ':':
                if (isAlpha(peek()) && symbolAllowedAt(start)) symbol();
                else addToken(TokenType.COLON);
                break;
            case '*': addToken(match('*') ? TokenType.STAR_STAR : TokenType.STAR); break;
            case '/': addToken(match('/') ? TokenType.SLASH_SLASH : TokenType.SLASH); break;
            case '#':
                while (!isAtEnd() && peek() != '\n') advance();
                break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '=':
                if (match('=')) addToken(TokenType.EQUAL_EQUAL);
                else if (match('>')) addToken(TokenType.ARROW);
                else addToken(TokenType.EQUAL);
                break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '&':
                if (match('&')) addToken(TokenType.AND_AND);
                else throw error("Unexpected '&'");
                break;
            case '|': addToken(match('|') ? TokenType.OR_OR : TokenType.PIPE); break;
            case ' ': case '\r': case '\t':
                break;
            case '\n':
                addToken(TokenType.NEWLINE);
                line++;
                lineStart = current;
                break;
            case '"':
            case '\'':
                string(c);
                break;
            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else throw error("Unexpected character: " + c);
        }
    }

    /** Operator after a '.', or plain DOT. {@code .=} and {@code .!} stay a DOT followed by their own tokens. */
    private TokenType elementWise() {
        switch (peek()) {
            case '+': advance(); return TokenType.DOT_PLUS;
            case '-': advance(); return TokenType.DOT_MINUS;
            case '*': advance(); return TokenType.DOT_STAR;
            case '%': advance(); return TokenType.DOT_PERCENT;
            case '^': advance(); return TokenType.DOT_CARET;
            case '/':
                advance();
                return match('/') ? TokenType.DOT_SLASH_SLASH : TokenType.DOT_SLASH;
            case '<':
                advance();
                return match('=') ? TokenType.DOT_LESS_EQUAL : TokenType.DOT_LESS;
            case '>':
                advance();
                return match('=') ? TokenType.DOT_GREATER_EQUAL : TokenType.DOT_GREATER;
            case '=':
                if (peekNext() != '=') return TokenType.DOT;
                advance();
                advance();
                return TokenType.DOT_EQUAL_EQUAL;
            case '!':
                if (peekNext() != '=') return TokenType.DOT;
                advance();
                advance();
                return TokenType.DOT_BANG_EQUAL;
            default:
                return TokenType.DOT;
        }
    }

    /** ':' starts a symbol only after whitespace, an opening bracket, a comma or at the start of input. */
    private boolean symbolAllowedAt(int colon) {
        if (colon == 0) return true;
        char prev = source.charAt(colon - 1);
        return prev == ' ' || prev == '\t' || prev == '\n' || prev == '\r'
                || prev == '(' || prev == '[' || prev == '{' || prev == ',';
    }

    private void symbol() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.SYMBOL, source.substring(start + 1, current));
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        addToken(type);
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }
        if (peek() == 'e' || peek() == 'E') {
            int save = current;
            advance();
            if (peek() == '+' || peek() == '-') advance();
            if (isDigit(peek())) {
                while (isDigit(peek())) advance();
            } else {
                current = save;
            }
        }
        double value = Double.parseDouble(source.substring(start, current));
        addToken(TokenType.NUMBER, value);
    }

    private void string(char quote) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\n') {
                line++;
                lineStart = current;
            }
            if (c == '\\' && !isAtEnd()) {
                char esc = advance();
                switch (esc) {
                    case 'n': sb.append('\n'); break;
                    case 't': sb.append('\t'); break;
                    case 'r': sb.append('\r'); break;
                    case '0': sb.append('\0'); break;
                    case '\\': sb.append('\\'); break;
                    case '"': sb.append('"'); break;
                    case '\'': sb.append('\''); break;
                    default: sb.append('\\').append(esc);
                }
            } else {
                sb.append(c);
            }
        }
        if (isAtEnd()) throw error("Unterminated string");
        advance();
        addToken(TokenType.STRING, sb.toString());
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c) || c == '?';
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn));
    }

    private GraphoidException error(String msg) {
        return GraphoidException.syntax(msg, new SourcePosition(startLine, startColumn, null));
    }
}
