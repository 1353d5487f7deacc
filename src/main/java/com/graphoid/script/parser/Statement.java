package com.graphoid.script.parser;

import java.util.LinkedHashMap;
import java.util.List;

import com.graphoid.script.parser.Expr.ExprInterface;
import com.graphoid.script.parser.Expr.Param;
import com.graphoid.script.parser.Expr.PatternClause;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);

        int line();
    }

    public interface StmtVisitor<R> {
        R visitExprStmt(ExprStmt stmt);
        R visitVarDeclStmt(VarDecl stmt);
        R visitAssignStmt(Assign stmt);
        R visitFunctionStmt(FunctionDecl stmt);
        R visitGraphDeclStmt(GraphDecl stmt);
        R visitIfStmt(If stmt);
        R visitWhileStmt(While stmt);
        R visitForStmt(For stmt);
        R visitReturnStmt(Return stmt);
        R visitBreakStmt(Break stmt);
        R visitContinueStmt(Continue stmt);
        R visitTryStmt(Try stmt);
        R visitConfigureStmt(Configure stmt);
        R visitPrecisionStmt(Precision stmt);
        R visitImportStmt(Import stmt);
        R visitLoadStmt(Load stmt);
        R visitModuleDeclStmt(ModuleDecl stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final ExprInterface expression;
        public ExprStmt(ExprInterface expression) { this.expression = expression; }
        public int line() { return expression.token().line; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExprStmt(this); }
    }

    /** {@code [priv] [type] name = value}. {@code typeName} is null for untyped declarations. */
    public static final class VarDecl implements Stmt {
        public final Token typeName;
        public final Token name;
        public final ExprInterface initializer;
        public final boolean isPrivate;

        public VarDecl(Token typeName, Token name, ExprInterface initializer, boolean isPrivate) {
            this.typeName = typeName;
            this.name = name;
            this.initializer = initializer;
            this.isPrivate = isPrivate;
        }

        public int line() { return name.line; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitVarDeclStmt(this); }
    }

    /** Assignment to a variable, index or property target. */
    public static final class Assign implements Stmt {
        public final ExprInterface target;
        public final Token equals;
        public final ExprInterface value;

        public Assign(ExprInterface target, Token equals, ExprInterface value) {
            this.target = target;
            this.equals = equals;
            this.value = value;
        }

        public int line() { return equals.line; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAssignStmt(this); }
    }

    /**
     * Named function or method. Either {@code params}/{@code body} or {@code clauses} are set, never both.
     * {@code receiver} is set for {@code fn Receiver.name()} declarations.
     */
    public static final class FunctionDecl implements Stmt {
        public final Token name;
        public final Token receiver;
        public final List<Param> params;
        public final List<Stmt> body;
        public final List<PatternClause> clauses;
        public final ExprInterface guard;
        public final boolean isStatic;
        public final boolean isSetter;
        public final boolean isPrivate;

        public FunctionDecl(Token name, Token receiver, List<Param> params, List<Stmt> body,
                            List<PatternClause> clauses, ExprInterface guard,
                            boolean isStatic, boolean isSetter, boolean isPrivate) {
            this.name = name;
            this.receiver = receiver;
            this.params = params;
            this.body = body;
            this.clauses = clauses;
            this.guard = guard;
            this.isStatic = isStatic;
            this.isSetter = isSetter;
            this.isPrivate = isPrivate;
        }

        public int line() { return name.line; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitFunctionStmt(this); }
    }

    public static final class RuleDecl {
        public final Token name;
        public final ExprInterface param;

        public RuleDecl(Token name, ExprInterface param) {
            this.name = name;
            this.param = param;
        }
    }

    /** Body shared by named graph declarations and anonymous graph literals. */
    public static final class GraphBody {
        public final Token keyword;
        public final ExprInterface parent;
        public final String graphType;
        public final LinkedHashMap<String, ExprInterface> properties;
        public final List<RuleDecl> rules;
        public final List<FunctionDecl> methods;
        public final List<String> readable;
        public final List<String> writable;

        public GraphBody(Token keyword, ExprInterface parent, String graphType,
                         LinkedHashMap<String, ExprInterface> properties, List<RuleDecl> rules,
                         List<FunctionDecl> methods, List<String> readable, List<String> writable) {
            this.keyword = keyword;
            this.parent = parent;
            this.graphType = graphType;
            this.properties = properties;
            this.rules = rules;
            this.methods = methods;
            this.readable = readable;
            this.writable = writable;
        }
    }

    public static final class GraphDecl implements Stmt {
        public final Token name;
        public final GraphBody body;

        public GraphDecl(Token name, GraphBody body) {
            this.name = name;
            this.body = body;
        }

        public int line() { return name.line; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitGraphDeclStmt(this); }
    }

    public static final class If implements Stmt {
        public final Token keyword;
        public final ExprInterface condition;
        public final List<Stmt> thenBranch;
        public final List<Stmt> elseBranch;

        public If(Token keyword, ExprInterface condition, List<Stmt> thenBranch, List<Stmt> elseBranch) {
            this.keyword = keyword;
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        public int line() { return keyword.line; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Token keyword;
        public final ExprInterface condition;
        public final List<Stmt> body;

        public While(Token keyword, ExprInterface condition, List<Stmt> body) {
            this.keyword = keyword;
            this.condition = condition;
            this.body = body;
        }

        public int line() { return keyword.line; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitWhileStmt(this); }
    }

    public static final class For implements Stmt {
        public final Token variable;
        public final ExprInterface iterable;
        public final List<Stmt> body;

        public For(Token variable, ExprInterface iterable, List<Stmt> body) {
            this.variable = variable;
            this.iterable = iterable;
            this.body = body;
        }

        public int line() { return variable.line; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitForStmt(this); }
    }

    public static final class Return implements Stmt {
        public final Token keyword;
        public final ExprInterface value;

        public Return(Token keyword, ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public int line() { return keyword.line; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitReturnStmt(this); }
    }

    public static final class Break implements Stmt {
        public final Token keyword;
        public Break(Token keyword) { this.keyword = keyword; }
        public int line() { return keyword.line; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBreakStmt(this); }
    }

    public static final class Continue implements Stmt {
        public final Token keyword;
        public Continue(Token keyword) { this.keyword = keyword; }
        public int line() { return keyword.line; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitContinueStmt(this); }
    }

    /** {@code catch [Type] [as name] { ... }}. Both parts are optional. */
    public static final class CatchClause {
        public final Token errorType;
        public final Token variable;
        public final List<Stmt> body;

        public CatchClause(Token errorType, Token variable, List<Stmt> body) {
            this.errorType = errorType;
            this.variable = variable;
            this.body = body;
        }
    }

    public static final class Try implements Stmt {
        public final Token keyword;
        public final List<Stmt> body;
        public final List<CatchClause> catches;
        public final List<Stmt> finallyBody;

        public Try(Token keyword, List<Stmt> body, List<CatchClause> catches, List<Stmt> finallyBody) {
            this.keyword = keyword;
            this.body = body;
            this.catches = catches;
            this.finallyBody = finallyBody;
        }

        public int line() { return keyword.line; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitTryStmt(this); }
    }

    /** {@code configure { key: value, :flag } [ { body } ]}; without a body the settings stay active. */
    public static final class Configure implements Stmt {
        public final Token keyword;
        public final LinkedHashMap<String, ExprInterface> settings;
        public final List<String> flags;
        public final List<Stmt> body;

        public Configure(Token keyword, LinkedHashMap<String, ExprInterface> settings, List<String> flags, List<Stmt> body) {
            this.keyword = keyword;
            this.settings = settings;
            this.flags = flags;
            this.body = body;
        }

        public int line() { return keyword.line; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitConfigureStmt(this); }
    }

    /** {@code precision N { ... }}; {@code precision :int} is zero places. */
    public static final class Precision implements Stmt {
        public final Token keyword;
        public final int places;
        public final List<Stmt> body;

        public Precision(Token keyword, int places, List<Stmt> body) {
            this.keyword = keyword;
            this.places = places;
            this.body = body;
        }

        public int line() { return keyword.line; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitPrecisionStmt(this); }
    }

    public static final class Import implements Stmt {
        public final Token keyword;
        public final String path;
        public final String alias;

        public Import(Token keyword, String path, String alias) {
            this.keyword = keyword;
            this.path = path;
            this.alias = alias;
        }

        public int line() { return keyword.line; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitImportStmt(this); }
    }

    public static final class Load implements Stmt {
        public final Token keyword;
        public final String path;

        public Load(Token keyword, String path) {
            this.keyword = keyword;
            this.path = path;
        }

        public int line() { return keyword.line; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitLoadStmt(this); }
    }

    public static final class ModuleDecl implements Stmt {
        public final Token keyword;
        public final String name;
        public final String alias;

        public ModuleDecl(Token keyword, String name, String alias) {
            this.keyword = keyword;
            this.name = name;
            this.alias = alias;
        }

        public int line() { return keyword.line; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitModuleDeclStmt(this); }
    }
}
