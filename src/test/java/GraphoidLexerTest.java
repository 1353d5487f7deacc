import com.graphoid.script.errors.ErrorKind;
import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.parser.Lexer;
import com.graphoid.script.parser.Token;
import com.graphoid.script.parser.TokenType;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GraphoidLexerTest {

    private static List<TokenType> types(String src) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(src).tokenize()) out.add(t.type);
        return out;
    }

    @Test
    void colonAfterIdentifierIsPunctuation_afterSpaceIsSymbol() {
        List<Token> tokens = new Lexer("{a: :b}").tokenize();

        assertEquals(TokenType.LEFT_BRACE, tokens.get(0).type);
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type);
        assertEquals(TokenType.COLON, tokens.get(2).type);
        assertEquals(TokenType.SYMBOL, tokens.get(3).type);
        assertEquals("b", tokens.get(3).literal);
        assertEquals(TokenType.RIGHT_BRACE, tokens.get(4).type);
    }

    @Test
    void symbolAllowedAfterOpeningBracketAndComma() {
        List<Token> tokens = new Lexer("f(:x,:y)").tokenize();

        assertEquals(TokenType.SYMBOL, tokens.get(2).type);
        assertEquals("x", tokens.get(2).literal);
        assertEquals(TokenType.SYMBOL, tokens.get(4).type);
        assertEquals("y", tokens.get(4).literal);
    }

    @Test
    void multiCharacterOperators() {
        assertEquals(
                List.of(TokenType.STAR_STAR, TokenType.SLASH_SLASH, TokenType.ELLIPSIS, TokenType.ARROW,
                        TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.AND_AND, TokenType.OR_OR,
                        TokenType.PIPE, TokenType.EOF),
                types("** // ... => == != && || |"));
    }

    @Test
    void keywordsAndIdentifiers() {
        List<Token> tokens = new Lexer("fn valid? graph rule unless").tokenize();

        assertEquals(TokenType.FN, tokens.get(0).type);
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type);
        assertEquals("valid?", tokens.get(1).lexeme);
        assertEquals(TokenType.GRAPH, tokens.get(2).type);
        assertEquals(TokenType.RULE, tokens.get(3).type);
        assertEquals(TokenType.UNLESS, tokens.get(4).type);
    }

    @Test
    void numbersAreDoubles() {
        List<Token> tokens = new Lexer("42 3.5 1e3").tokenize();

        assertEquals(42.0, (Double) tokens.get(0).literal, 1e-9);
        assertEquals(3.5, (Double) tokens.get(1).literal, 1e-9);
        assertEquals(1000.0, (Double) tokens.get(2).literal, 1e-9);
    }

    @Test
    void stringEscapesInBothQuoteStyles() {
        List<Token> tokens = new Lexer("\"a\\tb\\n\" 'it\\'s'").tokenize();

        assertEquals("a\tb\n", tokens.get(0).literal);
        assertEquals("it's", tokens.get(1).literal);
    }

    @Test
    void commentsRunToEndOfLine() {
        assertEquals(
                List.of(TokenType.IDENTIFIER, TokenType.NEWLINE, TokenType.IDENTIFIER, TokenType.EOF),
                types("x # ignored := stuff\ny"));
    }

    @Test
    void tokensCarryLineAndColumn() {
        List<Token> tokens = new Lexer("a\n  b").tokenize();

        Token b = tokens.get(2);
        assertEquals("b", b.lexeme);
        assertEquals(2, b.line);
        assertEquals(3, b.column);
    }

    @Test
    void loneAmpersandIsSyntaxError() {
        GraphoidException ex = assertThrows(GraphoidException.class, () -> new Lexer("a & b").tokenize());
        assertEquals(ErrorKind.SYNTAX, ex.getKind());
        assertEquals("Unexpected '&'", ex.getDetail());
    }

    @Test
    void unknownCharacterIsSyntaxError() {
        GraphoidException ex = assertThrows(GraphoidException.class, () -> new Lexer("x = $").tokenize());
        assertEquals("Unexpected character: $", ex.getDetail());
        assertEquals(1, ex.getPosition().line);
        assertEquals(5, ex.getPosition().column);
    }

    @Test
    void unterminatedString() {
        GraphoidException ex = assertThrows(GraphoidException.class, () -> new Lexer("\"open").tokenize());
        assertEquals("Unterminated string", ex.getDetail());
    }

    @Test
    void dotFollowedByOperatorIsElementWise() {
        assertEquals(
                List.of(TokenType.IDENTIFIER, TokenType.DOT_PLUS, TokenType.IDENTIFIER, TokenType.DOT_SLASH_SLASH,
                        TokenType.NUMBER, TokenType.DOT_LESS_EQUAL, TokenType.NUMBER, TokenType.EOF),
                types("a .+ b .// 2 .<= 3"));
        assertEquals(
                List.of(TokenType.IDENTIFIER, TokenType.DOT_EQUAL_EQUAL, TokenType.NUMBER, TokenType.EOF),
                types("xs .== 1"));
        assertEquals(
                List.of(TokenType.IDENTIFIER, TokenType.DOT, TokenType.IDENTIFIER, TokenType.LEFT_PAREN,
                        TokenType.RIGHT_PAREN, TokenType.EOF),
                types("xs.size()"));
    }

    @Test
    void treeIsAKeyword() {
        assertEquals(List.of(TokenType.TREE, TokenType.LEFT_BRACE, TokenType.RIGHT_BRACE, TokenType.EOF), types("tree {}"));
    }
}
