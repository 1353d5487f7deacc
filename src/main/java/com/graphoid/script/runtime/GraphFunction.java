package com.graphoid.script.runtime;

import java.util.Collections;
import java.util.List;

import com.graphoid.script.parser.Expr.ExprInterface;
import com.graphoid.script.parser.Expr.Param;
import com.graphoid.script.parser.Expr.PatternClause;
import com.graphoid.script.parser.Statement.Stmt;

/**
 * User function: parameters with a body (block or single expression) or a list of pattern clauses,
 * plus the environment it closes over. The closure is shared, never copied.
 */
public final class GraphFunction {
    public final String name;
    public final List<Param> params;
    public final List<Stmt> body;
    public final ExprInterface expressionBody;
    public final List<PatternClause> clauses;
    public final Environment closure;
    public final ExprInterface guard;
    public final boolean isStatic;
    public final boolean isSetter;
    public final boolean isPrivate;

    public GraphFunction(String name, List<Param> params, List<Stmt> body, ExprInterface expressionBody,
                         List<PatternClause> clauses, Environment closure, ExprInterface guard,
                         boolean isStatic, boolean isSetter, boolean isPrivate) {
        this.name = name;
        this.params = (params == null) ? Collections.emptyList() : params;
        this.body = body;
        this.expressionBody = expressionBody;
        this.clauses = clauses;
        this.closure = closure;
        this.guard = guard;
        this.isStatic = isStatic;
        this.isSetter = isSetter;
        this.isPrivate = isPrivate;
    }

    public boolean isPatternFunction() {
        return clauses != null;
    }

    public boolean isVariadic() {
        for (Param p : params) if (p.variadic) return true;
        return false;
    }

    /** Parameters without a default and not variadic. */
    public int requiredCount() {
        if (isPatternFunction()) return 1;
        int n = 0;
        for (Param p : params) if (!p.variadic && p.defaultValue == null) n++;
        return n;
    }

    /** Declared non-variadic parameters. */
    public int arity() {
        if (isPatternFunction()) return 1;
        int n = 0;
        for (Param p : params) if (!p.variadic) n++;
        return n;
    }

    public boolean accepts(int argCount) {
        if (argCount < requiredCount()) return false;
        return isVariadic() || argCount <= arity();
    }

    public String displayName() {
        return (name == null) ? "<lambda>" : name;
    }
}
