package com.graphoid.script.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.parser.Expr.Argument;
import com.graphoid.script.parser.Expr.ExprInterface;
import com.graphoid.script.parser.Expr.MatchArm;
import com.graphoid.script.parser.Expr.Param;
import com.graphoid.script.parser.Expr.PatternClause;
import com.graphoid.script.parser.Statement.CatchClause;
import com.graphoid.script.parser.Statement.FunctionDecl;
import com.graphoid.script.parser.Statement.GraphBody;
import com.graphoid.script.parser.Statement.RuleDecl;
import com.graphoid.script.parser.Statement.Stmt;

public class Parser {
    private static final Set<String> TYPE_NAMES =
            Collections.unmodifiableSet(new HashSet<>(Arrays.asList("num", "string", "bool", "list", "map", "bignum")));

    private final List<Token> tokens;
    private int current = 0;
    // Set while parsing conditions, so `if flag {` is not read as an instantiation of `flag`.
    private boolean noInstantiation = false;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public static List<Stmt> parseSource(String source) {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<>();
        skipSeparators();
        while (!isAtEnd()) {
            statements.add(declaration());
            endStatement();
            skipSeparators();
        }
        return statements;
    }

    // -------------------------
    // Declarations
    // -------------------------

    private Stmt declaration() {
        if (check(TokenType.FN) && peekNext().type != TokenType.LEFT_PAREN) {
            advance();
            return functionDeclaration(false, false, false);
        }
        if (match(TokenType.PRIV)) {
            if (match(TokenType.FN)) return functionDeclaration(false, false, true);
            return varDeclaration(true);
        }
        if (check(TokenType.GRAPH) && peekNext().type == TokenType.IDENTIFIER) {
            Token keyword = advance();
            Token name = advance();
            return new Statement.GraphDecl(name, graphBody(keyword));
        }
        if (isTypedDeclaration()) return varDeclaration(false);
        return statement();
    }

    private boolean isTypedDeclaration() {
        return check(TokenType.IDENTIFIER)
                && TYPE_NAMES.contains(peek().lexeme)
                && peekNext().type == TokenType.IDENTIFIER
                && peekAt(2).type == TokenType.EQUAL;
    }

    private Stmt varDeclaration(boolean isPrivate) {
        Token typeName = null;
        if (isTypedDeclaration()) typeName = advance();
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name.");
        consume(TokenType.EQUAL, "Expect '=' after variable name.");
        ExprInterface initializer = expression();
        return new Statement.VarDecl(typeName, name, initializer, isPrivate);
    }

    /** Parses after 'fn' (or 'set') has been consumed. */
    private FunctionDecl functionDeclaration(boolean isStatic, boolean isSetter, boolean isPrivate) {
        Token name = consumeWord("Expect function name.");
        Token receiver = null;
        if (match(TokenType.DOT)) {
            receiver = name;
            name = consumeWord("Expect method name after '.'.");
        }

        List<Param> params = new ArrayList<>();
        if (match(TokenType.LEFT_PAREN)) params = parameters();

        ExprInterface guard = null;
        if (match(TokenType.WHEN)) guard = condition();

        consume(TokenType.LEFT_BRACE, "Expect '{' before function body.");
        skipNewlines();
        if (check(TokenType.PIPE)) {
            List<PatternClause> clauses = patternClauses();
            return new FunctionDecl(name, receiver, params, null, clauses, guard, isStatic, isSetter, isPrivate);
        }
        List<Stmt> body = blockBody();
        return new FunctionDecl(name, receiver, params, body, null, guard, isStatic, isSetter, isPrivate);
    }

    /** Parses after '(' has been consumed, through the closing ')'. */
    private List<Param> parameters() {
        List<Param> params = new ArrayList<>();
        boolean sawVariadic = false;
        skipNewlines();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                skipNewlines();
                if (match(TokenType.ELLIPSIS)) {
                    if (sawVariadic) throw error(previous(), "Only one variadic parameter is allowed.");
                    sawVariadic = true;
                    params.add(new Param(consume(TokenType.IDENTIFIER, "Expect parameter name after '...'."), null, true));
                } else {
                    Token name = consume(TokenType.IDENTIFIER, "Expect parameter name.");
                    ExprInterface defaultValue = null;
                    if (match(TokenType.EQUAL)) defaultValue = expression();
                    params.add(new Param(name, defaultValue, false));
                }
                skipNewlines();
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");
        return params;
    }

    /** Parses clauses after '{' up to and including '}'. */
    private List<PatternClause> patternClauses() {
        List<PatternClause> clauses = new ArrayList<>();
        while (true) {
            skipSeparatorsAndCommas();
            if (check(TokenType.RIGHT_BRACE) || isAtEnd()) break;
            consume(TokenType.PIPE, "Expect '|' to start a pattern clause.");
            Pattern pattern = pattern();
            consume(TokenType.PIPE, "Expect '|' after pattern.");
            ExprInterface guard = null;
            if (match(TokenType.IF)) guard = expression();
            consume(TokenType.ARROW, "Expect '=>' after pattern.");
            clauses.add(new PatternClause(pattern, guard, expression()));
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after pattern clauses.");
        return clauses;
    }

    private GraphBody graphBody(Token keyword) {
        return graphBody(keyword, null);
    }

    private GraphBody graphBody(Token keyword, String defaultType) {
        String graphType = defaultType;
        if (match(TokenType.LEFT_PAREN)) {
            graphType = (String) consume(TokenType.SYMBOL, "Expect graph type symbol.").literal;
            consume(TokenType.RIGHT_PAREN, "Expect ')' after graph type.");
        }
        ExprInterface parent = null;
        if (match(TokenType.FROM)) {
            boolean saved = noInstantiation;
            noInstantiation = true;
            try {
                parent = call();
            } finally {
                noInstantiation = saved;
            }
        }

        LinkedHashMap<String, ExprInterface> properties = new LinkedHashMap<>();
        List<RuleDecl> rules = new ArrayList<>();
        List<FunctionDecl> methods = new ArrayList<>();
        List<String> readable = new ArrayList<>();
        List<String> writable = new ArrayList<>();

        consume(TokenType.LEFT_BRACE, "Expect '{' to start graph body.");
        while (true) {
            skipSeparatorsAndCommas();
            if (check(TokenType.RIGHT_BRACE) || isAtEnd()) break;

            if (match(TokenType.FN)) {
                methods.add(functionDeclaration(false, false, false));
            } else if (match(TokenType.PRIV)) {
                consume(TokenType.FN, "Expect 'fn' after 'priv' in graph body.");
                methods.add(functionDeclaration(false, false, true));
            } else if (match(TokenType.STATIC)) {
                consume(TokenType.FN, "Expect 'fn' after 'static'.");
                methods.add(functionDeclaration(true, false, false));
            } else if (match(TokenType.SET)) {
                methods.add(functionDeclaration(false, true, false));
            } else if (match(TokenType.RULE)) {
                Token ruleName = consume(TokenType.SYMBOL, "Expect rule symbol after 'rule'.");
                ExprInterface param = null;
                if (check(TokenType.COMMA) && startsExpression(peekNext())) {
                    advance();
                    param = expression();
                }
                rules.add(new RuleDecl(ruleName, param));
            } else if (match(TokenType.CONFIGURE)) {
                graphConfigure(readable, writable);
            } else if (isWord(peek()) && peekNext().type == TokenType.COLON) {
                Token name = advance();
                advance();
                properties.put(name.lexeme, expression());
            } else {
                throw error(peek(), "Unexpected token in graph body: '" + peek().lexeme + "'.");
            }
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after graph body.");
        return new GraphBody(keyword, parent, graphType, properties, rules, methods, readable, writable);
    }

    private boolean startsExpression(Token t) {
        switch (t.type) {
            case NEWLINE:
            case RIGHT_BRACE:
            case RULE:
            case FN:
            case EOF:
                return false;
            default:
                return !(isWord(t) && peekAt(2).type == TokenType.COLON);
        }
    }

    /** {@code configure { readable: :x, writable: [:y, :z], accessible: :w }} inside a graph body. */
    private void graphConfigure(List<String> readable, List<String> writable) {
        consume(TokenType.LEFT_BRACE, "Expect '{' after 'configure'.");
        while (true) {
            skipSeparatorsAndCommas();
            if (check(TokenType.RIGHT_BRACE) || isAtEnd()) break;
            Token key = consumeWord("Expect configuration key.");
            consume(TokenType.COLON, "Expect ':' after configuration key.");
            List<String> names = new ArrayList<>();
            if (match(TokenType.LEFT_BRACKET)) {
                skipNewlines();
                if (!check(TokenType.RIGHT_BRACKET)) {
                    do {
                        skipNewlines();
                        names.add((String) consume(TokenType.SYMBOL, "Expect property symbol.").literal);
                        skipNewlines();
                    } while (match(TokenType.COMMA) && !check(TokenType.RIGHT_BRACKET));
                }
                consume(TokenType.RIGHT_BRACKET, "Expect ']' after property list.");
            } else {
                names.add((String) consume(TokenType.SYMBOL, "Expect property symbol.").literal);
            }
            switch (key.lexeme) {
                case "readable":
                    readable.addAll(names);
                    break;
                case "writable":
                    writable.addAll(names);
                    break;
                case "accessible":
                    readable.addAll(names);
                    writable.addAll(names);
                    break;
                default:
                    throw error(key, "Unknown graph configuration key '" + key.lexeme + "'.");
            }
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after graph configuration.");
    }

    // -------------------------
    // Statements
    // -------------------------

    private Stmt statement() {
        if (match(TokenType.IF)) return ifStatement(previous(), false);
        if (match(TokenType.UNLESS)) return ifStatement(previous(), true);
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.BREAK)) return new Statement.Break(previous());
        if (match(TokenType.CONTINUE)) return new Statement.Continue(previous());
        if (match(TokenType.TRY)) return tryStatement();
        if (match(TokenType.CONFIGURE)) return configureStatement();
        if (match(TokenType.PRECISION)) return precisionStatement();
        if (match(TokenType.IMPORT)) return importStatement();
        if (match(TokenType.LOAD)) {
            Token keyword = previous();
            Token path = consume(TokenType.STRING, "Expect file path after 'load'.");
            return new Statement.Load(keyword, (String) path.literal);
        }
        if (match(TokenType.MODULE)) return moduleStatement();
        return expressionOrAssignment();
    }

    private Stmt ifStatement(Token keyword, boolean negate) {
        ExprInterface cond = condition();
        if (negate) cond = new Expr.Unary(new Token(TokenType.NOT, "not", null, keyword.line, keyword.column), cond);
        List<Stmt> thenBranch = block();
        List<Stmt> elseBranch = null;
        if (matchAfterNewlines(TokenType.ELSE)) {
            if (match(TokenType.IF)) {
                elseBranch = Collections.singletonList(ifStatement(previous(), false));
            } else {
                elseBranch = block();
            }
        }
        return new Statement.If(keyword, cond, thenBranch, elseBranch);
    }

    private Stmt whileStatement() {
        Token keyword = previous();
        ExprInterface cond = condition();
        return new Statement.While(keyword, cond, block());
    }

    private Stmt forStatement() {
        Token variable = consume(TokenType.IDENTIFIER, "Expect loop variable after 'for'.");
        consume(TokenType.IN, "Expect 'in' after loop variable.");
        ExprInterface iterable = condition();
        return new Statement.For(variable, iterable, block());
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        ExprInterface value = null;
        if (!check(TokenType.NEWLINE) && !check(TokenType.SEMICOLON) && !check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            value = expression();
        }
        return new Statement.Return(keyword, value);
    }

    private Stmt tryStatement() {
        Token keyword = previous();
        List<Stmt> body = block();
        List<CatchClause> catches = new ArrayList<>();
        while (matchAfterNewlines(TokenType.CATCH)) {
            Token errorType = null;
            Token variable = null;
            if (check(TokenType.IDENTIFIER)) errorType = advance();
            if (match(TokenType.AS)) variable = consume(TokenType.IDENTIFIER, "Expect variable name after 'as'.");
            catches.add(new CatchClause(errorType, variable, block()));
        }
        List<Stmt> finallyBody = null;
        if (matchAfterNewlines(TokenType.FINALLY)) finallyBody = block();
        if (catches.isEmpty() && finallyBody == null) {
            throw error(keyword, "Expect 'catch' or 'finally' after try block.");
        }
        return new Statement.Try(keyword, body, catches, finallyBody);
    }

    private Stmt configureStatement() {
        Token keyword = previous();
        LinkedHashMap<String, ExprInterface> settings = new LinkedHashMap<>();
        List<String> flags = new ArrayList<>();
        consume(TokenType.LEFT_BRACE, "Expect '{' after 'configure'.");
        while (true) {
            skipSeparatorsAndCommas();
            if (check(TokenType.RIGHT_BRACE) || isAtEnd()) break;
            if (check(TokenType.SYMBOL)) {
                flags.add((String) advance().literal);
            } else {
                Token key = consumeWord("Expect configuration key.");
                consume(TokenType.COLON, "Expect ':' after configuration key.");
                settings.put(key.lexeme, expression());
            }
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after configuration.");
        List<Stmt> body = check(TokenType.LEFT_BRACE) ? block() : null;
        return new Statement.Configure(keyword, settings, flags, body);
    }

    private Stmt precisionStatement() {
        Token keyword = previous();
        int places;
        if (match(TokenType.NUMBER)) {
            places = (int) (double) (Double) previous().literal;
        } else if (check(TokenType.SYMBOL) && "int".equals(peek().literal)) {
            advance();
            places = 0;
        } else {
            throw error(peek(), "Expect number of decimal places or :int after 'precision'.");
        }
        return new Statement.Precision(keyword, places, block());
    }

    private Stmt importStatement() {
        Token keyword = previous();
        Token path = consume(TokenType.STRING, "Expect module path after 'import'.");
        String alias = null;
        if (match(TokenType.AS)) alias = consume(TokenType.IDENTIFIER, "Expect alias after 'as'.").lexeme;
        return new Statement.Import(keyword, (String) path.literal, alias);
    }

    private Stmt moduleStatement() {
        Token keyword = previous();
        Token name = consume(TokenType.IDENTIFIER, "Expect module name.");
        String alias = null;
        if (check(TokenType.IDENTIFIER) && "alias".equals(peek().lexeme)) {
            advance();
            alias = consume(TokenType.IDENTIFIER, "Expect identifier after 'alias'.").lexeme;
        } else if (match(TokenType.AS)) {
            alias = consume(TokenType.IDENTIFIER, "Expect identifier after 'as'.").lexeme;
        }
        return new Statement.ModuleDecl(keyword, name.lexeme, alias);
    }

    private Stmt expressionOrAssignment() {
        ExprInterface expr = expression();
        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            if (!(expr instanceof Expr.Variable || expr instanceof Expr.Index || expr instanceof Expr.Get)) {
                throw error(equals, "Invalid assignment target.");
            }
            return new Statement.Assign(expr, equals, expression());
        }
        return new Statement.ExprStmt(expr);
    }

    private List<Stmt> block() {
        consume(TokenType.LEFT_BRACE, "Expect '{' before block.");
        return blockBody();
    }

    /** Parses statements after '{' through the closing '}'. */
    private List<Stmt> blockBody() {
        List<Stmt> statements = new ArrayList<>();
        boolean saved = noInstantiation;
        noInstantiation = false;
        try {
            skipSeparators();
            while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
                statements.add(declaration());
                endStatement();
                skipSeparators();
            }
        } finally {
            noInstantiation = saved;
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
        return statements;
    }

    private void endStatement() {
        if (match(TokenType.NEWLINE) || match(TokenType.SEMICOLON)) return;
        if (check(TokenType.RIGHT_BRACE) || isAtEnd()) return;
        throw error(peek(), "Expect newline after statement, got '" + peek().lexeme + "'.");
    }

    // -------------------------
    // Expressions
    // -------------------------

    private ExprInterface condition() {
        boolean saved = noInstantiation;
        noInstantiation = true;
        try {
            return expression();
        } finally {
            noInstantiation = saved;
        }
    }

    private ExprInterface expression() {
        ExprInterface expr = or();
        if (match(TokenType.IF)) {
            Token keyword = previous();
            ExprInterface cond = or();
            ExprInterface otherwise = match(TokenType.ELSE) ? expression() : null;
            return new Expr.Conditional(expr, keyword, cond, otherwise, false);
        }
        if (match(TokenType.UNLESS)) {
            Token keyword = previous();
            ExprInterface cond = or();
            return new Expr.Conditional(expr, keyword, cond, null, true);
        }
        return expr;
    }

    private ExprInterface or() {
        ExprInterface expr = and();
        while (match(TokenType.OR, TokenType.OR_OR)) {
            Token operator = previous();
            expr = new Expr.Logical(expr, operator, and());
        }
        return expr;
    }

    private ExprInterface and() {
        ExprInterface expr = equality();
        while (match(TokenType.AND, TokenType.AND_AND)) {
            Token operator = previous();
            expr = new Expr.Logical(expr, operator, equality());
        }
        return expr;
    }

    private ExprInterface equality() {
        ExprInterface expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.DOT_EQUAL_EQUAL, TokenType.DOT_BANG_EQUAL)) {
            Token operator = previous();
            expr = new Expr.Binary(expr, operator, comparison());
        }
        return expr;
    }

    private ExprInterface comparison() {
        ExprInterface expr = term();
        while (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL,
                TokenType.DOT_LESS, TokenType.DOT_LESS_EQUAL, TokenType.DOT_GREATER, TokenType.DOT_GREATER_EQUAL)) {
            Token operator = previous();
            expr = new Expr.Binary(expr, operator, term());
        }
        return expr;
    }

    private ExprInterface term() {
        ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS, TokenType.DOT_PLUS, TokenType.DOT_MINUS)) {
            Token operator = previous();
            expr = new Expr.Binary(expr, operator, factor());
        }
        return expr;
    }

    private ExprInterface factor() {
        ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.SLASH_SLASH, TokenType.PERCENT,
                TokenType.DOT_STAR, TokenType.DOT_SLASH, TokenType.DOT_SLASH_SLASH, TokenType.DOT_PERCENT)) {
            Token operator = previous();
            expr = new Expr.Binary(expr, operator, unary());
        }
        return expr;
    }

    private ExprInterface unary() {
        if (match(TokenType.BANG, TokenType.MINUS, TokenType.NOT)) {
            Token operator = previous();
            return new Expr.Unary(operator, unary());
        }
        return power();
    }

    private ExprInterface power() {
        ExprInterface expr = call();
        if (match(TokenType.STAR_STAR, TokenType.DOT_CARET)) {
            Token operator = previous();
            return new Expr.Binary(expr, operator, unary());
        }
        return expr;
    }

    private ExprInterface call() {
        ExprInterface expr = primary();
        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                Token paren = previous();
                expr = new Expr.Call(expr, paren, arguments());
            } else if (match(TokenType.DOT)) {
                Token name = consumeWord("Expect property or method name after '.'.");
                if (check(TokenType.BANG) && peekNext().type == TokenType.LEFT_PAREN) {
                    advance();
                    advance();
                    expr = new Expr.MethodCall(expr, name, arguments(), true);
                } else if (match(TokenType.LEFT_PAREN)) {
                    expr = new Expr.MethodCall(expr, name, arguments(), false);
                } else {
                    expr = new Expr.Get(expr, name);
                }
            } else if (match(TokenType.LEFT_BRACKET)) {
                Token bracket = previous();
                ExprInterface index = nested();
                consume(TokenType.RIGHT_BRACKET, "Expect ']' after index.");
                expr = new Expr.Index(expr, bracket, index);
            } else if (check(TokenType.LEFT_BRACE) && expr instanceof Expr.Variable && looksLikeInstantiation((Expr.Variable) expr)) {
                advance();
                expr = new Expr.Instantiate(((Expr.Variable) expr).name, fieldInitializers("instantiation"));
            } else {
                break;
            }
        }
        return expr;
    }

    private boolean looksLikeInstantiation(Expr.Variable var) {
        if (noInstantiation) return false;
        String name = var.name.lexeme;
        if (name.isEmpty() || !Character.isUpperCase(name.charAt(0))) return false;
        int i = current + 1;
        while (tokens.get(i).type == TokenType.NEWLINE) i++;
        Token first = tokens.get(i);
        return first.type == TokenType.RIGHT_BRACE
                || (isWord(first) && tokens.get(i + 1).type == TokenType.COLON);
    }

    /** Parses after '(' through ')'. */
    private List<Argument> arguments() {
        List<Argument> args = new ArrayList<>();
        boolean saved = noInstantiation;
        noInstantiation = false;
        try {
            skipNewlines();
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    skipNewlines();
                    if (check(TokenType.RIGHT_PAREN)) break;
                    String name = null;
                    if (isWord(peek()) && peekNext().type == TokenType.COLON) {
                        name = advance().lexeme;
                        advance();
                    }
                    ExprInterface value = expression();
                    boolean mutable = false;
                    if (check(TokenType.BANG)) {
                        TokenType after = peekNext().type;
                        if (after == TokenType.COMMA || after == TokenType.RIGHT_PAREN || after == TokenType.NEWLINE) {
                            advance();
                            mutable = true;
                        }
                    }
                    args.add(new Argument(name, value, mutable));
                    skipNewlines();
                } while (match(TokenType.COMMA));
            }
        } finally {
            noInstantiation = saved;
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return args;
    }

    /** Expression inside brackets or parentheses, where instantiation is always allowed. */
    private ExprInterface nested() {
        boolean saved = noInstantiation;
        noInstantiation = false;
        try {
            skipNewlines();
            ExprInterface expr = expression();
            skipNewlines();
            return expr;
        } finally {
            noInstantiation = saved;
        }
    }

    private ExprInterface primary() {
        if (match(TokenType.NUMBER, TokenType.STRING)) return new Expr.Literal(previous(), previous().literal);
        if (match(TokenType.TRUE)) return new Expr.Literal(previous(), Boolean.TRUE);
        if (match(TokenType.FALSE)) return new Expr.Literal(previous(), Boolean.FALSE);
        if (match(TokenType.NONE)) return new Expr.Literal(previous(), null);
        if (match(TokenType.SYMBOL)) return new Expr.SymbolLiteral(previous(), (String) previous().literal);

        if (match(TokenType.IDENTIFIER)) {
            Token name = previous();
            if (match(TokenType.ARROW)) {
                List<Param> params = new ArrayList<>();
                params.add(new Param(name, null, false));
                return lambdaBody(name, params);
            }
            return new Expr.Variable(name);
        }

        if (match(TokenType.SUPER)) {
            Token keyword = previous();
            consume(TokenType.DOT, "Expect '.' after 'super'.");
            Token method = consumeWord("Expect method name after 'super.'.");
            consume(TokenType.LEFT_PAREN, "Expect '(' after super method name.");
            return new Expr.SuperCall(keyword, method, arguments());
        }

        if (match(TokenType.LEFT_PAREN)) {
            Token paren = previous();
            if (isLambdaParameterList()) {
                List<Param> params = parameters();
                consume(TokenType.ARROW, "Expect '=>' after lambda parameters.");
                return lambdaBody(paren, params);
            }
            ExprInterface expr = nested();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        if (match(TokenType.LEFT_BRACKET)) return listLiteral(previous());
        if (match(TokenType.LEFT_BRACE)) {
            Token brace = previous();
            return new Expr.MapLiteral(brace, fieldInitializers("map literal"));
        }

        if (match(TokenType.FN)) {
            Token keyword = previous();
            consume(TokenType.LEFT_PAREN, "Expect '(' after 'fn'.");
            List<Param> params = parameters();
            return new Expr.Lambda(keyword, params, null, block());
        }

        if (match(TokenType.GRAPH)) return new Expr.GraphLiteral(graphBody(previous()));
        if (match(TokenType.TREE)) return new Expr.GraphLiteral(graphBody(previous(), "tree"));
        if (match(TokenType.MATCH)) return matchExpression();
        if (match(TokenType.RAISE)) {
            Token keyword = previous();
            return new Expr.Raise(keyword, expression());
        }

        throw error(peek(), "Expect expression, got '" + peek().lexeme + "'.");
    }

    private ExprInterface lambdaBody(Token token, List<Param> params) {
        if (check(TokenType.LEFT_BRACE) && !looksLikeMapLiteral()) {
            return new Expr.Lambda(token, params, null, block());
        }
        return new Expr.Lambda(token, params, expression(), null);
    }

    /** At '(' already consumed: true when the matching ')' is followed by '=>'. */
    private boolean isLambdaParameterList() {
        int depth = 1;
        int i = current;
        while (i < tokens.size() && depth > 0) {
            TokenType t = tokens.get(i).type;
            if (t == TokenType.LEFT_PAREN) depth++;
            else if (t == TokenType.RIGHT_PAREN) depth--;
            else if (t == TokenType.EOF) return false;
            i++;
        }
        return i < tokens.size() && tokens.get(i).type == TokenType.ARROW;
    }

    /** At '{' (not consumed): true when the brace opens "key: value" pairs. */
    private boolean looksLikeMapLiteral() {
        int i = current + 1;
        while (tokens.get(i).type == TokenType.NEWLINE) i++;
        Token first = tokens.get(i);
        return (first.type == TokenType.STRING || isWord(first)) && tokens.get(i + 1).type == TokenType.COLON;
    }

    private ExprInterface listLiteral(Token bracket) {
        List<ExprInterface> elements = new ArrayList<>();
        skipNewlines();
        if (!check(TokenType.RIGHT_BRACKET)) {
            do {
                skipNewlines();
                if (check(TokenType.RIGHT_BRACKET)) break;
                elements.add(nested());
            } while (match(TokenType.COMMA));
        }
        skipNewlines();
        consume(TokenType.RIGHT_BRACKET, "Expect ']' after list elements.");
        return new Expr.ListLiteral(bracket, elements);
    }

    /** Parses {@code key: value} pairs after '{' through '}'. Keys are words or strings. */
    private LinkedHashMap<String, ExprInterface> fieldInitializers(String what) {
        LinkedHashMap<String, ExprInterface> entries = new LinkedHashMap<>();
        while (true) {
            skipSeparatorsAndCommas();
            if (check(TokenType.RIGHT_BRACE) || isAtEnd()) break;
            String key;
            if (match(TokenType.STRING)) key = (String) previous().literal;
            else key = consumeWord("Expect key in " + what + ".").lexeme;
            consume(TokenType.COLON, "Expect ':' after key in " + what + ".");
            entries.put(key, nested());
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after " + what + ".");
        return entries;
    }

    private ExprInterface matchExpression() {
        Token keyword = previous();
        ExprInterface subject = condition();
        consume(TokenType.LEFT_BRACE, "Expect '{' after match subject.");
        List<MatchArm> arms = new ArrayList<>();
        while (true) {
            skipSeparatorsAndCommas();
            if (check(TokenType.RIGHT_BRACE) || isAtEnd()) break;
            Pattern pattern = pattern();
            ExprInterface guard = null;
            if (match(TokenType.IF)) guard = or();
            consume(TokenType.ARROW, "Expect '=>' after match pattern.");
            if (check(TokenType.LEFT_BRACE) && !looksLikeMapLiteral()) {
                arms.add(new MatchArm(pattern, guard, null, block()));
            } else {
                arms.add(new MatchArm(pattern, guard, expression(), null));
            }
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after match arms.");
        return new Expr.Match(keyword, subject, arms);
    }

    // -------------------------
    // Patterns
    // -------------------------

    private Pattern pattern() {
        if (match(TokenType.NUMBER)) return new Pattern.Literal(previous().literal, false);
        if (match(TokenType.MINUS)) {
            Token number = consume(TokenType.NUMBER, "Expect number after '-' in pattern.");
            return new Pattern.Literal(-(Double) number.literal, false);
        }
        if (match(TokenType.STRING)) return new Pattern.Literal(previous().literal, false);
        if (match(TokenType.TRUE)) return new Pattern.Literal(Boolean.TRUE, false);
        if (match(TokenType.FALSE)) return new Pattern.Literal(Boolean.FALSE, false);
        if (match(TokenType.NONE)) return new Pattern.Literal(null, false);
        if (match(TokenType.SYMBOL)) return new Pattern.Literal(previous().literal, true);
        if (match(TokenType.IDENTIFIER)) {
            String name = previous().lexeme;
            return "_".equals(name) ? Pattern.Wildcard.INSTANCE : new Pattern.Variable(name);
        }
        if (match(TokenType.LEFT_BRACKET)) {
            List<Pattern> elements = new ArrayList<>();
            String rest = null;
            skipNewlines();
            if (!check(TokenType.RIGHT_BRACKET)) {
                do {
                    skipNewlines();
                    if (match(TokenType.ELLIPSIS)) {
                        rest = consume(TokenType.IDENTIFIER, "Expect name after '...' in list pattern.").lexeme;
                        skipNewlines();
                        break;
                    }
                    elements.add(pattern());
                    skipNewlines();
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after list pattern.");
            return new Pattern.ListPattern(elements, rest);
        }
        throw error(peek(), "Expect pattern, got '" + peek().lexeme + "'.");
    }

    // -------------------------
    // Token helpers
    // -------------------------

    /** Identifiers and keywords; keywords are valid method, property and key names. */
    private static boolean isWord(Token t) {
        return t.type == TokenType.IDENTIFIER
                || (t.type.ordinal() >= TokenType.FN.ordinal() && t.type.ordinal() <= TokenType.NOT.ordinal());
    }

    private Token consumeWord(String message) {
        if (isWord(peek())) return advance();
        throw error(peek(), message);
    }

    private void skipNewlines() {
        while (match(TokenType.NEWLINE)) {
            // skip
        }
    }

    private void skipSeparators() {
        while (match(TokenType.NEWLINE, TokenType.SEMICOLON)) {
            // skip
        }
    }

    private void skipSeparatorsAndCommas() {
        while (match(TokenType.NEWLINE, TokenType.SEMICOLON, TokenType.COMMA)) {
            // skip
        }
    }

    private boolean matchAfterNewlines(TokenType type) {
        int save = current;
        skipNewlines();
        if (match(type)) return true;
        current = save;
        return false;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.EOF;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token peekNext() { return peekAt(1); }
    private Token peekAt(int offset) { return tokens.get(Math.min(current + offset, tokens.size() - 1)); }
    private Token previous() { return tokens.get(current - 1); }

    private GraphoidException error(Token token, String message) {
        return GraphoidException.syntax(message, token.position());
    }
}
