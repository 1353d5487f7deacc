package com.graphoid.script.parser;

import java.util.LinkedHashMap;
import java.util.List;

import com.graphoid.script.parser.Statement.GraphBody;
import com.graphoid.script.parser.Statement.Stmt;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);

        /** Token used for diagnostics. */
        Token token();
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitSymbolExpr(SymbolLiteral expr);
        R visitVariableExpr(Variable expr);
        R visitBinaryExpr(Binary expr);
        R visitLogicalExpr(Logical expr);
        R visitUnaryExpr(Unary expr);
        R visitCallExpr(Call expr);
        R visitMethodCallExpr(MethodCall expr);
        R visitSuperCallExpr(SuperCall expr);
        R visitGetExpr(Get expr);
        R visitIndexExpr(Index expr);
        R visitListLiteralExpr(ListLiteral expr);
        R visitMapLiteralExpr(MapLiteral expr);
        R visitLambdaExpr(Lambda expr);
        R visitGraphLiteralExpr(GraphLiteral expr);
        R visitInstantiateExpr(Instantiate expr);
        R visitConditionalExpr(Conditional expr);
        R visitRaiseExpr(Raise expr);
        R visitMatchExpr(Match expr);
    }

    // -------------------------
    // Call plumbing
    // -------------------------

    /** Call-site argument: positional when {@code name} is null; {@code mutable} marks {@code x!} write-back. */
    public static final class Argument {
        public final String name;
        public final ExprInterface value;
        public final boolean mutable;

        public Argument(String name, ExprInterface value, boolean mutable) {
            this.name = name;
            this.value = value;
            this.mutable = mutable;
        }
    }

    public static final class Param {
        public final Token name;
        public final ExprInterface defaultValue;
        public final boolean variadic;

        public Param(Token name, ExprInterface defaultValue, boolean variadic) {
            this.name = name;
            this.defaultValue = defaultValue;
            this.variadic = variadic;
        }
    }

    /** {@code |pattern| [if guard] => body} inside a function body. */
    public static final class PatternClause {
        public final Pattern pattern;
        public final ExprInterface guard;
        public final ExprInterface body;

        public PatternClause(Pattern pattern, ExprInterface guard, ExprInterface body) {
            this.pattern = pattern;
            this.guard = guard;
            this.body = body;
        }
    }

    /** {@code pattern [if guard] => expr} or {@code => { block }} inside a match expression. */
    public static final class MatchArm {
        public final Pattern pattern;
        public final ExprInterface guard;
        public final ExprInterface body;
        public final List<Stmt> block;

        public MatchArm(Pattern pattern, ExprInterface guard, ExprInterface body, List<Stmt> block) {
            this.pattern = pattern;
            this.guard = guard;
            this.body = body;
            this.block = block;
        }
    }

    // -------------------------
    // Core expression nodes
    // -------------------------

    /** Number, string, boolean or none. Numbers keep their lexeme for exact big-number construction. */
    public static final class Literal implements ExprInterface {
        public final Token token;
        public final Object value;

        public Literal(Token token, Object value) {
            this.token = token;
            this.value = value;
        }

        @Override public Token token() { return token; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class SymbolLiteral implements ExprInterface {
        public final Token token;
        public final String name;

        public SymbolLiteral(Token token, String name) {
            this.token = token;
            this.name = name;
        }

        @Override public Token token() { return token; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSymbolExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override public Token token() { return name; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override public Token token() { return operator; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override public Token token() { return operator; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override public Token token() { return operator; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final Token paren;
        public final List<Argument> arguments;

        public Call(ExprInterface callee, Token paren, List<Argument> arguments) {
            this.callee = callee;
            this.paren = paren;
            this.arguments = arguments;
        }

        @Override public Token token() { return paren; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    /** {@code obj.name(args)}; {@code mutating} for {@code obj.name!(args)}. */
    public static final class MethodCall implements ExprInterface {
        public final ExprInterface object;
        public final Token name;
        public final List<Argument> arguments;
        public final boolean mutating;

        public MethodCall(ExprInterface object, Token name, List<Argument> arguments, boolean mutating) {
            this.object = object;
            this.name = name;
            this.arguments = arguments;
            this.mutating = mutating;
        }

        @Override public Token token() { return name; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMethodCallExpr(this);
        }
    }

    public static final class SuperCall implements ExprInterface {
        public final Token keyword;
        public final Token method;
        public final List<Argument> arguments;

        public SuperCall(Token keyword, Token method, List<Argument> arguments) {
            this.keyword = keyword;
            this.method = method;
            this.arguments = arguments;
        }

        @Override public Token token() { return keyword; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSuperCallExpr(this);
        }
    }

    public static final class Get implements ExprInterface {
        public final ExprInterface object;
        public final Token name;

        public Get(ExprInterface object, Token name) {
            this.object = object;
            this.name = name;
        }

        @Override public Token token() { return name; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGetExpr(this);
        }
    }

    public static final class Index implements ExprInterface {
        public final ExprInterface object;
        public final Token bracket;
        public final ExprInterface index;

        public Index(ExprInterface object, Token bracket, ExprInterface index) {
            this.object = object;
            this.bracket = bracket;
            this.index = index;
        }

        @Override public Token token() { return bracket; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }

    public static final class ListLiteral implements ExprInterface {
        public final Token bracket;
        public final List<ExprInterface> elements;

        public ListLiteral(Token bracket, List<ExprInterface> elements) {
            this.bracket = bracket;
            this.elements = elements;
        }

        @Override public Token token() { return bracket; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListLiteralExpr(this);
        }
    }

    public static final class MapLiteral implements ExprInterface {
        public final Token brace;
        public final LinkedHashMap<String, ExprInterface> entries; // deterministic order

        public MapLiteral(Token brace, LinkedHashMap<String, ExprInterface> entries) {
            this.brace = brace;
            this.entries = entries;
        }

        @Override public Token token() { return brace; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMapLiteralExpr(this);
        }
    }

    /** Anonymous function: expression body ({@code x => x * 2}) or block body ({@code fn (x) { ... }}). */
    public static final class Lambda implements ExprInterface {
        public final Token token;
        public final List<Param> params;
        public final ExprInterface body;
        public final List<Stmt> block;

        public Lambda(Token token, List<Param> params, ExprInterface body, List<Stmt> block) {
            this.token = token;
            this.params = params;
            this.body = body;
            this.block = block;
        }

        @Override public Token token() { return token; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLambdaExpr(this);
        }
    }

    public static final class GraphLiteral implements ExprInterface {
        public final GraphBody body;

        public GraphLiteral(GraphBody body) {
            this.body = body;
        }

        @Override public Token token() { return body.keyword; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGraphLiteralExpr(this);
        }
    }

    /** {@code TypeName { prop: value, ... }}. */
    public static final class Instantiate implements ExprInterface {
        public final Token typeName;
        public final LinkedHashMap<String, ExprInterface> overrides;

        public Instantiate(Token typeName, LinkedHashMap<String, ExprInterface> overrides) {
            this.typeName = typeName;
            this.overrides = overrides;
        }

        @Override public Token token() { return typeName; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitInstantiateExpr(this);
        }
    }

    /** {@code a if c else b}, or {@code a unless c} with {@code unless} set. */
    public static final class Conditional implements ExprInterface {
        public final ExprInterface thenBranch;
        public final Token keyword;
        public final ExprInterface condition;
        public final ExprInterface elseBranch;
        public final boolean unless;

        public Conditional(ExprInterface thenBranch, Token keyword, ExprInterface condition,
                           ExprInterface elseBranch, boolean unless) {
            this.thenBranch = thenBranch;
            this.keyword = keyword;
            this.condition = condition;
            this.elseBranch = elseBranch;
            this.unless = unless;
        }

        @Override public Token token() { return keyword; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConditionalExpr(this);
        }
    }

    public static final class Raise implements ExprInterface {
        public final Token keyword;
        public final ExprInterface value;

        public Raise(Token keyword, ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        @Override public Token token() { return keyword; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRaiseExpr(this);
        }
    }

    public static final class Match implements ExprInterface {
        public final Token keyword;
        public final ExprInterface subject;
        public final List<MatchArm> arms;

        public Match(Token keyword, ExprInterface subject, List<MatchArm> arms) {
            this.keyword = keyword;
            this.subject = subject;
            this.arms = arms;
        }

        @Override public Token token() { return keyword; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMatchExpr(this);
        }
    }
}
