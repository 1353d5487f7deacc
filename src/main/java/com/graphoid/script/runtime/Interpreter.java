package com.graphoid.script.runtime;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.graphoid.debug.Debug;
import com.graphoid.script.config.BoundsCheckingMode;
import com.graphoid.script.config.ErrorMode;
import com.graphoid.script.config.RuntimeConfig;
import com.graphoid.script.errors.ErrorObject;
import com.graphoid.script.errors.GraphoidException;
import com.graphoid.script.errors.SourcePosition;
import com.graphoid.script.graph.Graph;
import com.graphoid.script.graph.GraphType;
import com.graphoid.script.parser.Expr.Argument;
import com.graphoid.script.parser.Expr.Binary;
import com.graphoid.script.parser.Expr.Call;
import com.graphoid.script.parser.Expr.Conditional;
import com.graphoid.script.parser.Expr.ExprInterface;
import com.graphoid.script.parser.Expr.ExprVisitor;
import com.graphoid.script.parser.Expr.Get;
import com.graphoid.script.parser.Expr.GraphLiteral;
import com.graphoid.script.parser.Expr.Index;
import com.graphoid.script.parser.Expr.Instantiate;
import com.graphoid.script.parser.Expr.Lambda;
import com.graphoid.script.parser.Expr.ListLiteral;
import com.graphoid.script.parser.Expr.Literal;
import com.graphoid.script.parser.Expr.Logical;
import com.graphoid.script.parser.Expr.MapLiteral;
import com.graphoid.script.parser.Expr.Match;
import com.graphoid.script.parser.Expr.MatchArm;
import com.graphoid.script.parser.Expr.MethodCall;
import com.graphoid.script.parser.Expr.Param;
import com.graphoid.script.parser.Expr.Raise;
import com.graphoid.script.parser.Expr.SuperCall;
import com.graphoid.script.parser.Expr.SymbolLiteral;
import com.graphoid.script.parser.Expr.Unary;
import com.graphoid.script.parser.Expr.Variable;
import com.graphoid.script.parser.Parser;
import com.graphoid.script.parser.Statement.Assign;
import com.graphoid.script.parser.Statement.Break;
import com.graphoid.script.parser.Statement.CatchClause;
import com.graphoid.script.parser.Statement.Configure;
import com.graphoid.script.parser.Statement.Continue;
import com.graphoid.script.parser.Statement.ExprStmt;
import com.graphoid.script.parser.Statement.For;
import com.graphoid.script.parser.Statement.FunctionDecl;
import com.graphoid.script.parser.Statement.GraphBody;
import com.graphoid.script.parser.Statement.GraphDecl;
import com.graphoid.script.parser.Statement.If;
import com.graphoid.script.parser.Statement.Import;
import com.graphoid.script.parser.Statement.Load;
import com.graphoid.script.parser.Statement.ModuleDecl;
import com.graphoid.script.parser.Statement.Precision;
import com.graphoid.script.parser.Statement.Return;
import com.graphoid.script.parser.Statement.RuleDecl;
import com.graphoid.script.parser.Statement.Stmt;
import com.graphoid.script.parser.Statement.StmtVisitor;
import com.graphoid.script.parser.Statement.Try;
import com.graphoid.script.parser.Statement.VarDecl;
import com.graphoid.script.parser.Statement.While;
import com.graphoid.script.parser.Token;
import com.graphoid.script.parser.TokenType;
import com.graphoid.script.pattern.PatternMatcher;
import com.graphoid.script.rules.MethodConstraints;
import com.graphoid.script.rules.RuleInstance;
import com.graphoid.script.rules.RuleSeverity;
import com.graphoid.script.rules.RuleSpec;
import com.graphoid.script.rules.RuleSymbols;
import com.graphoid.script.rules.TransformationRules;
import com.graphoid.script.runtime.ArgumentBinder.ArgValue;

/**
 * Tree-walking evaluator. Expressions produce values, statements produce a {@link StepResult} so
 * that break/continue/return travel outward without exceptions. One interpreter runs one file; module
 * and {@code exec} interpreters share the {@link RuntimeContext} of the interpreter that spawned them.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor<StepResult> {
    private static final String TAG = "Interpreter";
    private static final String SELF = "self";

    /** Graph whose method is executing, used to resolve {@code super}. */
    private static final class MethodContext {
        final Graph owner;
        final GraphFunction method;

        MethodContext(Graph owner, GraphFunction method) {
            this.owner = owner;
            this.method = method;
        }
    }

    private final RuntimeContext ctx;
    private final Environment globals;
    private final Map<String, Value> builtins;
    private final Deque<MethodContext> methodStack = new ArrayDeque<>();
    private final Deque<GraphFunction> activeSetters = new ArrayDeque<>();
    private final Set<String> privateNames = new LinkedHashSet<>();
    Environment env;
    private Path currentFile;
    private String moduleName;
    private String moduleAlias;

    public Interpreter(RuntimeContext ctx, Path currentFile) {
        this.ctx = ctx;
        this.currentFile = currentFile;
        this.globals = new Environment();
        this.env = globals;
        this.builtins = GlobalFunctions.bind(this);
    }

    public RuntimeContext context() {
        return ctx;
    }

    public RuntimeConfig config() {
        return ctx.config();
    }

    public Environment getGlobals() {
        return globals;
    }

    public Path getCurrentFile() {
        return currentFile;
    }

    // -------------------------
    // Entry points
    // -------------------------

    public Value executeSource(String source) {
        return run(Parser.parseSource(source));
    }

    /** Runs {@code file} in this interpreter's global scope; imports resolve next to it. */
    public Value executeFile(Path file) {
        String source = ModuleManager.readSource(file, SourcePosition.UNKNOWN);
        Path saved = currentFile;
        currentFile = file;
        ctx.modules().beginLoading(file, SourcePosition.UNKNOWN);
        try {
            return run(Parser.parseSource(source));
        } finally {
            ctx.modules().endLoading(file);
            currentFile = saved;
        }
    }

    /**
     * Executes a program and returns the value of its last expression statement. Configuration frames
     * pushed by body-less {@code configure} statements end with the program.
     */
    public Value run(List<Stmt> program) {
        int configDepth = ctx.configStack().depth();
        Value last = Value.none();
        try {
            for (Stmt stmt : program) {
                if (stmt instanceof ExprStmt) {
                    last = evaluate(((ExprStmt) stmt).expression);
                    continue;
                }
                StepResult r = execute(stmt);
                if (r.kind == StepResult.Kind.RETURN) return r.value;
                if (!r.isNormal()) throw loopControlOutsideLoop(r);
            }
            return last;
        } catch (StackOverflowError e) {
            Debug.get().w(TAG, "host stack exhausted");
            throw GraphoidException.runtime("Maximum recursion depth exceeded");
        } finally {
            while (ctx.configStack().depth() > configDepth) ctx.configStack().pop();
            env = globals;
        }
    }

    /** Runs another program with output capture and returns what it printed. */
    String execProgram(String spec) {
        Path file = ctx.modules().resolve(spec, currentFile, SourcePosition.UNKNOWN);
        String source = ModuleManager.readSource(file, SourcePosition.UNKNOWN);
        ctx.output().beginCapture();
        boolean closed = false;
        try {
            new Interpreter(ctx, file).executeSource(source);
            closed = true;
            return ctx.output().endCapture();
        } finally {
            if (!closed) ctx.output().endCapture();
        }
    }

    // -------------------------
    // Evaluation helpers
    // -------------------------

    Value evaluate(ExprInterface expr) {
        try {
            return expr.accept(this);
        } catch (GraphoidException e) {
            throw e.atPosition(position(expr.token()));
        }
    }

    StepResult execute(Stmt stmt) {
        return stmt.accept(this);
    }

    StepResult executeStatements(List<Stmt> statements) {
        for (Stmt stmt : statements) {
            StepResult r = execute(stmt);
            if (!r.isNormal()) return r;
        }
        return StepResult.NORMAL;
    }

    private SourcePosition position(Token token) {
        if (token == null) return SourcePosition.UNKNOWN;
        String file = (currentFile == null) ? null : currentFile.getFileName().toString();
        return token.position().inFile(file);
    }

    private static GraphoidException loopControlOutsideLoop(StepResult r) {
        String word = (r.kind == StepResult.Kind.BREAK) ? "break" : "continue";
        return GraphoidException.runtime("'" + word + "' outside of loop");
    }

    /** Applies the transformation rules of a collection to a value entering it. */
    public Value applyInsertRules(List<RuleInstance> rules, Value value) {
        if (rules.isEmpty()) return value;
        return TransformationRules.applyOnInsert(rules, value, this::callValue);
    }

    /** Calls a function value with positional arguments. Used by builtins and rule callbacks. */
    public Value callValue(Value callee, List<Value> args) {
        List<ArgValue> bound = new ArrayList<>(args.size());
        for (Value v : args) bound.add(ArgValue.positional(v));
        return callFunctionValue(callee, bound);
    }

    /**
     * Outcome of a soft failure (missing key, bad index): collected, turned into none, or thrown,
     * depending on the error mode.
     */
    private Value softFailure(boolean outOfBounds, String message) {
        RuntimeConfig cfg = config();
        GraphoidException err = GraphoidException.runtime(message);
        switch (cfg.errorMode) {
            case COLLECT:
                ctx.errors().collect(err.toErrorObject());
                return Value.none();
            case LENIENT:
                return Value.none();
            default:
                if (outOfBounds && cfg.boundsChecking == BoundsCheckingMode.LENIENT) return Value.none();
                throw err;
        }
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitLiteralExpr(Literal expr) {
        Object v = expr.value;
        if (v == null) return Value.none();
        if (v instanceof Double) return Operators.numberLiteral(expr.token.lexeme, config());
        if (v instanceof String) return Value.string((String) v);
        if (v instanceof Boolean) return Value.bool((Boolean) v);
        throw new IllegalStateException("Internal error: unexpected literal " + v.getClass().getSimpleName());
    }

    @Override
    public Value visitSymbolExpr(SymbolLiteral expr) {
        return Value.symbol(expr.name);
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        String name = expr.name.lexeme;
        Value v = lookupName(name);
        if (v == null) throw GraphoidException.runtime("Undefined variable: " + name);
        return v.deepCopy();
    }

    /** Scope chain, then host functions, then built-in globals. */
    private Value lookupName(String name) {
        Value v = env.lookup(name);
        if (v == null) v = ctx.hostFunctions().get(name);
        if (v == null) v = builtins.get(name);
        return v;
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = evaluate(expr.left);
        Value right = evaluate(expr.right);
        if (expr.operator.type == TokenType.PLUS && config().strictTypes
                && (left.type == Value.Type.STRING) != (right.type == Value.Type.STRING)) {
            throw GraphoidException.type("Cannot add " + left.typeName() + " and " + right.typeName()
                    + " with strict_types enabled", position(expr.operator));
        }
        return Operators.binary(expr.operator.type, left, right);
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        boolean left = evaluate(expr.left).isTruthy();
        TokenType op = expr.operator.type;
        if (op == TokenType.OR || op == TokenType.OR_OR) {
            if (left) return Value.bool(true);
        } else if (!left) {
            return Value.bool(false);
        }
        return Value.bool(evaluate(expr.right).isTruthy());
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = evaluate(expr.right);
        switch (expr.operator.type) {
            case MINUS:
                return Operators.negate(right);
            case BANG:
            case NOT:
                return Value.bool(!right.isTruthy());
            default:
                throw new IllegalStateException("Internal error: unhandled unary operator " + expr.operator.type);
        }
    }

    @Override
    public Value visitListLiteralExpr(ListLiteral expr) {
        List<Value> items = new ArrayList<>(expr.elements.size());
        for (ExprInterface e : expr.elements) items.add(evaluate(e));
        return Value.list(items);
    }

    @Override
    public Value visitMapLiteralExpr(MapLiteral expr) {
        LinkedHashMap<String, Value> entries = new LinkedHashMap<>();
        for (Map.Entry<String, ExprInterface> e : expr.entries.entrySet()) {
            entries.put(e.getKey(), evaluate(e.getValue()));
        }
        return Value.map(new MapValue(entries));
    }

    @Override
    public Value visitLambdaExpr(Lambda expr) {
        GraphFunction fn = new GraphFunction(null, expr.params, expr.block, expr.body, null, env,
                null, false, false, false);
        return Value.function(fn);
    }

    @Override
    public Value visitConditionalExpr(Conditional expr) {
        boolean cond = evaluate(expr.condition).isTruthy();
        if (expr.unless) cond = !cond;
        if (cond) return evaluate(expr.thenBranch);
        return (expr.elseBranch == null) ? Value.none() : evaluate(expr.elseBranch);
    }

    @Override
    public Value visitRaiseExpr(Raise expr) {
        Value v = evaluate(expr.value);
        SourcePosition pos = position(expr.keyword);
        List<String> trace = ctx.calls().stackTrace();
        ErrorObject error;
        if (v.type == Value.Type.ERROR) {
            ErrorObject e = v.asError();
            error = new ErrorObject(e.type, e.message, e.position.isKnown() ? e.position : pos, e.cause, trace);
        } else if (v.type == Value.Type.STRING) {
            error = new ErrorObject("RuntimeError", v.asString(), pos, null, trace);
        } else {
            throw GraphoidException.type("Can only raise error values or strings, got " + v.typeName());
        }
        if (config().errorMode == ErrorMode.COLLECT) {
            ctx.errors().collect(error);
            return Value.none();
        }
        throw GraphoidException.raised(error);
    }

    @Override
    public Value visitMatchExpr(Match expr) {
        Value subject = evaluate(expr.subject);
        for (MatchArm arm : expr.arms) {
            Map<String, Value> bindings = PatternMatcher.match(arm.pattern, subject);
            if (bindings == null) continue;
            Environment scope = new Environment(env);
            bindings.forEach(scope::define);
            Environment saved = env;
            env = scope;
            try {
                if (arm.guard != null && !evaluate(arm.guard).isTruthy()) continue;
                return (arm.body != null) ? evaluate(arm.body) : blockValue(arm.block);
            } finally {
                env = saved;
            }
        }
        return Value.none();
    }

    /** Value of a block used as an expression: its return value, else its last expression. */
    private Value blockValue(List<Stmt> block) {
        Value last = Value.none();
        for (Stmt stmt : block) {
            if (stmt instanceof ExprStmt) {
                last = evaluate(((ExprStmt) stmt).expression);
                continue;
            }
            StepResult r = execute(stmt);
            if (r.kind == StepResult.Kind.RETURN) return r.value;
            if (!r.isNormal()) throw loopControlOutsideLoop(r);
        }
        return last;
    }

    // -------------------------
    // Property and index access
    // -------------------------

    @Override
    public Value visitGetExpr(Get expr) {
        Value obj = evaluate(expr.object);
        String name = expr.name.lexeme;
        switch (obj.type) {
            case MODULE:
                return obj.asModule().member(name).deepCopy();
            case MAP: {
                MapValue m = obj.asMap();
                if (m.containsKey(name)) return m.get(name).deepCopy();
                return softFailure(false, "Key not found: '" + name + "'");
            }
            case GRAPH: {
                Graph g = obj.asGraph();
                if (g.hasProperty(name)) return g.getProperty(name).deepCopy();
                List<GraphFunction> variants = g.findMethods(name);
                if (variants != null) {
                    for (GraphFunction fn : variants) {
                        if (fn.guard == null && fn.accepts(0)) {
                            checkPrivate(fn, expr.object);
                            return callGraphMethod(obj, fn, Collections.emptyList(), expr.object);
                        }
                    }
                }
                if (Graph.isDataId(name) && g.hasNode(name)) return g.nodeValue(name).deepCopy();
                break;
            }
            default:
                break;
        }
        BuiltinMethods.Entry entry = BuiltinMethods.find(obj.type, name);
        if (entry != null && !entry.mutator) return entry.method.call(this, obj, Collections.emptyList());
        throw GraphoidException.runtime("Type '" + describeType(obj) + "' has no property '" + name + "'");
    }

    @Override
    public Value visitIndexExpr(Index expr) {
        Value obj = evaluate(expr.object);
        Value key = evaluate(expr.index);
        switch (obj.type) {
            case LIST: {
                ListValue l = obj.asList();
                int i = key.asInt();
                int idx = (i < 0) ? i + l.size() : i;
                if (idx < 0 || idx >= l.size()) {
                    return softFailure(true, "Index " + i + " out of bounds for list of length " + l.size());
                }
                return l.get(idx).deepCopy();
            }
            case STRING: {
                String s = obj.asString();
                int i = key.asInt();
                int idx = (i < 0) ? i + s.length() : i;
                if (idx < 0 || idx >= s.length()) {
                    return softFailure(true, "Index " + i + " out of bounds for string of length " + s.length());
                }
                return Value.string(String.valueOf(s.charAt(idx)));
            }
            case MAP: {
                String k = BuiltinMethods.key(key);
                MapValue m = obj.asMap();
                if (m.containsKey(k)) return m.get(k).deepCopy();
                return softFailure(false, "Key not found: '" + k + "'");
            }
            case GRAPH: {
                String id = BuiltinMethods.key(key);
                Graph g = obj.asGraph();
                if (Graph.isDataId(id) && g.hasNode(id)) return g.nodeValue(id).deepCopy();
                return softFailure(false, "Node '" + id + "' not found");
            }
            default:
                throw GraphoidException.type("Cannot index into " + obj.typeName());
        }
    }

    private static String describeType(Value v) {
        if (v.type == Value.Type.GRAPH && v.asGraph().getTypeName() != null) return v.asGraph().getTypeName();
        return v.typeName();
    }

    // -------------------------
    // Assignment
    // -------------------------

    private static boolean isAssignable(ExprInterface target) {
        if (target instanceof Variable) return true;
        if (target instanceof Index) return isAssignable(((Index) target).object);
        if (target instanceof Get) return isAssignable(((Get) target).object);
        return false;
    }

    /**
     * Stores {@code value} at an lvalue. Index and property targets rebuild their container and store
     * it back one level up, so the change reaches the variable at the root.
     */
    private void assignTo(ExprInterface target, Value value, boolean useSetters) {
        if (target instanceof Variable) {
            String name = ((Variable) target).name.lexeme;
            if (env.exists(name)) env.set(name, value);
            else env.define(name, value);
            return;
        }
        if (target instanceof Index) {
            Index ix = (Index) target;
            Value container = evaluate(ix.object);
            Value key = evaluate(ix.index);
            storeAtIndex(container, key, value);
            assignTo(ix.object, container, false);
            return;
        }
        if (target instanceof Get) {
            Get get = (Get) target;
            Value obj = evaluate(get.object);
            String name = get.name.lexeme;
            if (obj.type == Value.Type.GRAPH) {
                Graph g = obj.asGraph();
                GraphFunction setter = useSetters ? g.findSetter(name) : null;
                if (setter != null && !activeSetters.contains(setter)) {
                    activeSetters.push(setter);
                    try {
                        callGraphMethod(obj, setter, Collections.singletonList(ArgValue.positional(value)), get.object);
                    } finally {
                        activeSetters.pop();
                    }
                    return;
                }
                g.setProperty(name, value);
            } else if (obj.type == Value.Type.MAP) {
                MapValue m = obj.asMap();
                m.put(name, applyInsertRules(m.rules(), value));
            } else {
                throw GraphoidException.type("Cannot set property '" + name + "' on " + obj.typeName());
            }
            assignTo(get.object, obj, false);
            return;
        }
        throw GraphoidException.runtime("Invalid assignment target");
    }

    private void storeAtIndex(Value container, Value key, Value value) {
        switch (container.type) {
            case LIST: {
                ListValue l = container.asList();
                int i = key.asInt();
                int idx = (i < 0) ? i + l.size() : i;
                if (idx < 0 || idx >= l.size()) {
                    throw GraphoidException.runtime("Index " + i + " out of bounds for list of length " + l.size());
                }
                l.set(idx, applyInsertRules(l.rules(), value));
                return;
            }
            case MAP: {
                MapValue m = container.asMap();
                m.put(BuiltinMethods.key(key), applyInsertRules(m.rules(), value));
                return;
            }
            case GRAPH: {
                Graph g = container.asGraph();
                g.addNode(BuiltinMethods.key(key), applyInsertRules(g.rules(), value));
                return;
            }
            default:
                throw GraphoidException.type("Cannot assign by index into " + container.typeName());
        }
    }

    // -------------------------
    // Calls
    // -------------------------

    private List<ArgValue> evaluateArguments(List<Argument> arguments) {
        List<ArgValue> out = new ArrayList<>(arguments.size());
        for (Argument a : arguments) {
            Value v = evaluate(a.value);
            String writeBack = null;
            if (a.mutable) {
                if (!(a.value instanceof Variable)) {
                    throw GraphoidException.runtime("Write-back argument must be a variable");
                }
                writeBack = ((Variable) a.value).name.lexeme;
            }
            out.add(new ArgValue(a.name, v, writeBack));
        }
        return out;
    }

    private static List<Value> positionalValues(List<ArgValue> args) {
        List<Value> out = new ArrayList<>(args.size());
        for (ArgValue a : args) out.add(a.value);
        return out;
    }

    private static List<Value> positionalOnly(List<ArgValue> args, String method) {
        List<Value> out = new ArrayList<>(args.size());
        for (ArgValue a : args) {
            if (a.name != null) {
                throw GraphoidException.runtime("Method '" + method + "' does not accept named arguments");
            }
            out.add(a.value);
        }
        return out;
    }

    @Override
    public Value visitCallExpr(Call expr) {
        if (expr.callee instanceof Variable) {
            String name = ((Variable) expr.callee).name.lexeme;

            List<GraphFunction> overloads = env.lookupOverloads(name);
            if (overloads != null) {
                List<ArgValue> args = evaluateArguments(expr.arguments);
                GraphFunction fn = selectOverload(name, overloads, args);
                return invoke(fn, args, new Environment(fn.closure));
            }

            Value self = env.lookup(SELF);
            if (self != null && self.type == Value.Type.GRAPH && self.asGraph().hasMethod(name)) {
                List<ArgValue> args = evaluateArguments(expr.arguments);
                Variable selfExpr = new Variable(Token.synthetic(SELF, expr.paren.line));
                Value result = callUserGraphMethod(self.deepCopy(), name, args, selfExpr);
                if (result != null) return result;
            }

            Value callee = lookupName(name);
            if (callee == null) throw GraphoidException.runtime("Undefined function: " + name);
            return callFunctionValue(callee, evaluateArguments(expr.arguments));
        }
        Value callee = evaluate(expr.callee);
        return callFunctionValue(callee, evaluateArguments(expr.arguments));
    }

    /** Picks the overload of a named function for the given arguments. */
    private GraphFunction selectOverload(String name, List<GraphFunction> variants, List<ArgValue> args) {
        if (variants.size() == 1 && variants.get(0).guard == null) return variants.get(0);
        int n = args.size();
        for (GraphFunction fn : variants) {
            if (fn.guard != null && fn.accepts(n) && guardAccepts(fn, args, null)) return fn;
        }
        for (GraphFunction fn : variants) {
            if (fn.guard == null && fn.accepts(n)) return fn;
        }
        throw GraphoidException.runtime("No matching overload for '" + name + "' with " + n + " argument(s)");
    }

    /** Evaluates a function-level guard with the arguments bound. An erroring guard rejects. */
    private boolean guardAccepts(GraphFunction fn, List<ArgValue> args, Value self) {
        Environment scope = new Environment(fn.closure);
        if (self != null) scope.define(SELF, self);
        Environment saved = env;
        try {
            if (!fn.isPatternFunction()) {
                ArgumentBinder.Bound bound = ArgumentBinder.bind(fn, args, this::evaluate);
                bound.values.forEach(scope::define);
            }
            env = scope;
            return evaluate(fn.guard).isTruthy();
        } catch (GraphoidException e) {
            Debug.get().d(TAG, "guard of '" + fn.displayName() + "' rejected call: " + e.getMessage());
            return false;
        } finally {
            env = saved;
        }
    }

    private Value callFunctionValue(Value callee, List<ArgValue> args) {
        switch (callee.type) {
            case FUNCTION: {
                GraphFunction fn = callee.asFunction();
                Environment scope = fn.isStatic ? new Environment(env) : new Environment(fn.closure);
                return invoke(fn, args, scope);
            }
            case NATIVE_FUNCTION: {
                Value.NativeFunction nf = callee.asNativeFunction();
                List<Value> positional = new ArrayList<>();
                Map<String, Value> named = new LinkedHashMap<>();
                for (ArgValue a : args) {
                    if (a.name == null) positional.add(a.value);
                    else named.put(a.name, a.value);
                }
                ctx.calls().push(nf.name, positional);
                try {
                    return nf.fn.call(positional, named);
                } finally {
                    ctx.calls().pop();
                }
            }
            default:
                throw GraphoidException.type("Value of type " + callee.typeName() + " is not callable");
        }
    }

    /**
     * Runs a user function in {@code scope}: binds arguments (defaults evaluated in the caller's scope),
     * executes the body, copies write-back parameters to the caller and restores the caller's scope on
     * every exit path.
     */
    Value invoke(GraphFunction fn, List<ArgValue> args, Environment scope) {
        int max = ctx.getMaxCallDepth();
        if (max > 0 && ctx.calls().depth() >= max) {
            throw GraphoidException.runtime("Maximum call depth (" + max + ") exceeded");
        }
        Environment caller = env;
        List<Value> plain = positionalValues(args);
        ArgumentBinder.Bound bound = null;
        if (fn.isPatternFunction()) {
            if (args.size() != 1 || args.get(0).name != null) {
                throw GraphoidException.runtime("Pattern function '" + fn.displayName()
                        + "' expects exactly 1 argument, got " + args.size());
            }
        } else {
            bound = ArgumentBinder.bind(fn, args, this::evaluate);
            bound.values.forEach(scope::define);
        }

        ctx.calls().push(fn.displayName(), plain);
        env = scope;
        try {
            Value result;
            if (fn.isPatternFunction()) {
                result = applyClauses(fn, plain.get(0), scope);
            } else if (fn.expressionBody != null) {
                result = evaluate(fn.expressionBody);
            } else {
                StepResult r = executeStatements(fn.body);
                if (r.kind == StepResult.Kind.RETURN) result = r.value;
                else if (r.isNormal()) result = Value.none();
                else throw loopControlOutsideLoop(r);
            }
            if (bound != null) {
                for (ArgumentBinder.WriteBack wb : bound.writeBacks) {
                    caller.set(wb.variable, scope.get(wb.param).deepCopy());
                }
            }
            return result;
        } catch (GraphoidException e) {
            e.recordTrace(ctx.calls().stackTrace());
            throw e;
        } finally {
            env = caller;
            ctx.calls().pop();
        }
    }

    private Value applyClauses(GraphFunction fn, Value arg, Environment scope) {
        PatternMatcher.ClauseMatch m = PatternMatcher.findMatch(fn.clauses, arg, (guard, bindings) -> {
            Environment tmp = new Environment(env);
            bindings.forEach(tmp::define);
            Environment saved = env;
            env = tmp;
            try {
                return evaluate(guard).isTruthy();
            } finally {
                env = saved;
                tmp.takeParent();
            }
        });
        if (m == null) return Value.none();
        Environment clauseScope = new Environment(scope);
        m.bindings.forEach(clauseScope::define);
        env = clauseScope;
        return evaluate(m.clause.body);
    }

    // -------------------------
    // Method calls
    // -------------------------

    @Override
    public Value visitMethodCallExpr(MethodCall expr) {
        Value receiver = evaluate(expr.object);
        String name = expr.name.lexeme;
        List<ArgValue> args = evaluateArguments(expr.arguments);

        if (receiver.type == Value.Type.MODULE) {
            return callFunctionValue(receiver.asModule().member(name), args);
        }
        if (receiver.type == Value.Type.GRAPH) {
            Value result = callUserGraphMethod(receiver, name, args, expr.object);
            if (result != null) return result;
        }

        BuiltinMethods.Entry entry = BuiltinMethods.find(receiver.type, name);
        if (entry == null) {
            throw GraphoidException.runtime("Type '" + describeType(receiver) + "' has no method '" + name + "'");
        }
        List<Value> plain = positionalOnly(args, name);

        if (expr.mutating) {
            if (!isAssignable(expr.object)) {
                throw GraphoidException.runtime("Mutating method '" + name + "!' requires a variable, not an expression");
            }
            if ("pop".equals(name) && receiver.type == Value.Type.LIST) {
                BuiltinMethods.expectArgs("pop", plain, 0, 0);
                Value removed = CollectionMethods.popInPlace(receiver.asList());
                assignTo(expr.object, receiver, false);
                return removed;
            }
            Value result = entry.method.call(this, receiver, plain);
            assignTo(expr.object, entry.mutator ? receiver : result, false);
            return Value.none();
        }

        Value result = entry.method.call(this, receiver, plain);
        if (entry.mutator && isAssignable(expr.object)) assignTo(expr.object, receiver, false);
        return result;
    }

    /**
     * Static method, then user instance method (guarded variants first). Returns null when the graph
     * defines neither, so the caller can fall back to the built-in graph methods.
     */
    private Value callUserGraphMethod(Value receiver, String name, List<ArgValue> args, ExprInterface receiverExpr) {
        Graph g = receiver.asGraph();
        GraphFunction staticFn = g.findStaticMethod(name);
        if (staticFn != null) {
            checkPrivate(staticFn, receiverExpr);
            return invoke(staticFn, args, new Environment(env));
        }
        List<GraphFunction> variants = g.findMethods(name);
        if (variants == null) return null;
        for (GraphFunction fn : variants) {
            if (!fn.accepts(args.size())) continue;
            if (fn.guard != null && !guardAccepts(fn, args, receiver.deepCopy())) continue;
            checkPrivate(fn, receiverExpr);
            return callGraphMethod(receiver, fn, args, receiverExpr);
        }
        if (BuiltinMethods.find(Value.Type.GRAPH, name) != null) return null;
        throw GraphoidException.runtime("No matching variant of method '" + name + "' with " + args.size() + " argument(s)");
    }

    private void checkPrivate(GraphFunction fn, ExprInterface receiverExpr) {
        boolean isPrivate = fn.isPrivate || (fn.name != null && fn.name.startsWith("_"));
        if (!isPrivate) return;
        boolean viaSelf = (receiverExpr instanceof Variable) && SELF.equals(((Variable) receiverExpr).name.lexeme);
        if (viaSelf || !methodStack.isEmpty()) return;
        throw GraphoidException.runtime("Cannot call private method '" + fn.name + "' from outside the graph's methods");
    }

    /**
     * Executes an instance method with {@code self} bound to a copy of the receiver. Method constraints
     * are checked against the copy afterwards; only then is the copy written back to the receiver's
     * lvalue, so a failed call leaves the original untouched.
     */
    private Value callGraphMethod(Value receiver, GraphFunction fn, List<ArgValue> args, ExprInterface receiverExpr) {
        Graph g = receiver.asGraph();
        Graph owner = ownerOf(g, fn);
        List<RuleInstance> rules = g.rules();
        MethodConstraints.Snapshot before = MethodConstraints.hasConstraints(rules) ? MethodConstraints.capture(g) : null;

        Environment scope = new Environment(fn.closure);
        scope.define(SELF, receiver.deepCopy());
        methodStack.push(new MethodContext(owner, fn));
        Value result;
        try {
            result = invoke(fn, args, scope);
        } finally {
            methodStack.pop();
        }

        Value after = scope.lookup(SELF);
        if (after != null && after.type == Value.Type.GRAPH) {
            if (before != null) MethodConstraints.check(fn.name, rules, before, after.asGraph(), this::callValue);
            if (receiverExpr != null && isAssignable(receiverExpr)) assignTo(receiverExpr, after, false);
        }
        return result;
    }

    /** Topmost graph in the parent chain whose table holds {@code fn}: the graph that defined it. */
    private static Graph ownerOf(Graph g, GraphFunction fn) {
        Graph owner = g;
        for (Graph p = g; p != null; p = p.getParent()) {
            if (p.ownsMethod(fn)) owner = p;
        }
        return owner;
    }

    @Override
    public Value visitSuperCallExpr(SuperCall expr) {
        if (methodStack.isEmpty()) throw GraphoidException.runtime("'super' used outside of a method");
        MethodContext current = methodStack.peek();
        String name = expr.method.lexeme;
        List<ArgValue> args = evaluateArguments(expr.arguments);

        GraphFunction target = null;
        for (Graph p = current.owner.getParent(); p != null && target == null; p = p.getParent()) {
            List<GraphFunction> variants = p.findMethods(name);
            if (variants == null) continue;
            for (GraphFunction fn : variants) {
                if (fn.accepts(args.size())) {
                    target = fn;
                    break;
                }
            }
        }
        if (target == null) {
            throw GraphoidException.runtime("No parent method '" + name + "' found for super call in '"
                    + current.method.displayName() + "'");
        }
        Value self = env.get(SELF);
        Variable selfExpr = new Variable(Token.synthetic(SELF, expr.keyword.line));
        return callGraphMethod(self.deepCopy(), target, args, selfExpr);
    }

    // -------------------------
    // Graphs
    // -------------------------

    @Override
    public Value visitGraphLiteralExpr(GraphLiteral expr) {
        return Value.graph(buildGraph(expr.body, null));
    }

    @Override
    public Value visitInstantiateExpr(Instantiate expr) {
        String typeName = expr.typeName.lexeme;
        Value type = lookupName(typeName);
        if (type == null) throw GraphoidException.runtime("Undefined variable: " + typeName);
        if (type.type != Value.Type.GRAPH) {
            throw GraphoidException.type("Cannot instantiate " + type.typeName() + " '" + typeName + "'");
        }
        Graph instance = type.asGraph().copy();
        instance.thaw();
        for (Map.Entry<String, ExprInterface> e : expr.overrides.entrySet()) {
            if (!instance.hasProperty(e.getKey())) {
                throw GraphoidException.runtime("Unknown property '" + e.getKey() + "' for type " + typeName);
            }
            instance.setProperty(e.getKey(), evaluate(e.getValue()));
        }
        return Value.graph(instance);
    }

    private Graph buildGraph(GraphBody body, String name) {
        Graph g;
        if (body.parent != null) {
            Value parent = evaluate(body.parent);
            if (parent.type != Value.Type.GRAPH) {
                throw GraphoidException.type("Cannot inherit from " + parent.typeName());
            }
            g = Graph.fromParent(parent.asGraph());
        } else {
            g = new Graph();
        }
        if (name != null) g.setTypeName(name);

        if (body.graphType != null) {
            switch (body.graphType) {
                case "undirected":
                    g.setGraphType(GraphType.UNDIRECTED);
                    break;
                case "directed":
                    g.setGraphType(GraphType.DIRECTED);
                    break;
                default:
                    g.addRuleset(body.graphType);
                    break;
            }
        }

        for (Map.Entry<String, ExprInterface> e : body.properties.entrySet()) {
            g.setProperty(e.getKey(), evaluate(e.getValue()));
        }
        for (RuleDecl rule : body.rules) {
            attachDeclaredRule(g, rule);
        }
        for (FunctionDecl m : body.methods) {
            g.attachMethod(functionFrom(m, env));
        }
        int line = body.keyword.line;
        for (String p : body.readable) {
            if (g.findMethods(p) != null) continue;
            ExprInterface getter = new Get(new Variable(Token.synthetic(SELF, line)), Token.synthetic(p, line));
            g.attachMethod(new GraphFunction(p, Collections.emptyList(), null, getter, null, env,
                    null, false, false, false));
        }
        for (String p : body.writable) {
            String setterName = "set_" + p;
            if (g.findMethods(setterName) != null) continue;
            Token value = Token.synthetic("value", line);
            Stmt store = new Assign(new Get(new Variable(Token.synthetic(SELF, line)), Token.synthetic(p, line)),
                    Token.synthetic("=", line), new Variable(value));
            g.attachMethod(new GraphFunction(setterName, Collections.singletonList(new Param(value, null, false)),
                    Collections.singletonList(store), null, null, env, null, false, false, false));
        }
        return g;
    }

    private void attachDeclaredRule(Graph g, RuleDecl rule) {
        String ruleName = (String) rule.name.literal;
        Value param = (rule.param == null) ? null : evaluate(rule.param);
        RuleSeverity severity = RuleSeverity.ERROR;
        if (param != null && param.type == Value.Type.SYMBOL && RuleSeverity.fromSymbol(param.asSymbol()) != null) {
            severity = RuleSeverity.fromSymbol(param.asSymbol());
            param = null;
        }
        if (("tree".equals(ruleName) || "dag".equals(ruleName)) && param == null) {
            g.addRuleset(ruleName);
            return;
        }
        RuleSpec spec = RuleSymbols.fromSymbol(ruleName, param);
        g.addRule(new RuleInstance(spec, severity));
    }

    private static GraphFunction functionFrom(FunctionDecl d, Environment closure) {
        return new GraphFunction(d.name.lexeme, d.params, d.clauses == null ? d.body : null, null, d.clauses,
                closure, d.guard, d.isStatic, d.isSetter, d.isPrivate);
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public StepResult visitExprStmt(ExprStmt stmt) {
        evaluate(stmt.expression);
        return StepResult.NORMAL;
    }

    @Override
    public StepResult visitVarDeclStmt(VarDecl stmt) {
        String name = stmt.name.lexeme;
        Value value = evaluate(stmt.initializer);
        if (stmt.typeName != null) value = checkDeclaredType(stmt.typeName, name, value);
        env.define(name, Operators.onAssignment(value, config()));
        if (stmt.isPrivate) privateNames.add(name);
        return StepResult.NORMAL;
    }

    private Value checkDeclaredType(Token typeToken, String variable, Value v) {
        String type = typeToken.lexeme;
        try {
            if ("bignum".equals(type)) return Value.bignum(Operators.toBigNumber(v, config()));
        } catch (GraphoidException e) {
            throw e.atPosition(position(typeToken));
        }
        boolean ok = "num".equals(type) ? v.isNumeric() : type.equals(v.typeName());
        if (!ok) {
            throw GraphoidException.type("Cannot assign " + v.typeName() + " to '" + variable + "' declared as "
                    + type, position(typeToken));
        }
        return v;
    }

    @Override
    public StepResult visitAssignStmt(Assign stmt) {
        Value value = evaluate(stmt.value);
        if (stmt.target instanceof Variable) value = Operators.onAssignment(value, config());
        try {
            assignTo(stmt.target, value, true);
        } catch (GraphoidException e) {
            throw e.atPosition(position(stmt.equals));
        }
        return StepResult.NORMAL;
    }

    @Override
    public StepResult visitFunctionStmt(FunctionDecl stmt) {
        GraphFunction fn = functionFrom(stmt, env);
        if (stmt.receiver != null) {
            String receiver = stmt.receiver.lexeme;
            Value target = env.lookup(receiver);
            if (target == null) throw GraphoidException.runtime("Undefined variable: " + receiver).atPosition(position(stmt.receiver));
            if (target.type != Value.Type.GRAPH) {
                throw GraphoidException.type("Cannot attach method '" + fn.name + "' to " + target.typeName(),
                        position(stmt.receiver));
            }
            Value updated = target.deepCopy();
            updated.asGraph().attachMethod(fn);
            env.set(receiver, updated);
            return StepResult.NORMAL;
        }
        env.defineFunction(fn);
        if (stmt.isPrivate) privateNames.add(fn.name);
        return StepResult.NORMAL;
    }

    @Override
    public StepResult visitGraphDeclStmt(GraphDecl stmt) {
        Graph g = buildGraph(stmt.body, stmt.name.lexeme);
        env.define(stmt.name.lexeme, Value.graph(g));
        return StepResult.NORMAL;
    }

    @Override
    public StepResult visitIfStmt(If stmt) {
        if (evaluate(stmt.condition).isTruthy()) return executeStatements(stmt.thenBranch);
        if (stmt.elseBranch != null) return executeStatements(stmt.elseBranch);
        return StepResult.NORMAL;
    }

    @Override
    public StepResult visitWhileStmt(While stmt) {
        while (evaluate(stmt.condition).isTruthy()) {
            StepResult r = executeStatements(stmt.body);
            if (r.kind == StepResult.Kind.BREAK) break;
            if (r.kind == StepResult.Kind.RETURN) return r;
        }
        return StepResult.NORMAL;
    }

    @Override
    public StepResult visitForStmt(For stmt) {
        Value iterable = evaluate(stmt.iterable);
        List<Value> items;
        switch (iterable.type) {
            case LIST:
                items = new ArrayList<>(iterable.asList().items());
                break;
            case MAP:
                items = new ArrayList<>();
                for (String k : iterable.asMap().entries().keySet()) items.add(Value.string(k));
                break;
            case STRING:
                items = new ArrayList<>();
                for (char c : iterable.asString().toCharArray()) items.add(Value.string(String.valueOf(c)));
                break;
            default:
                throw GraphoidException.type("Cannot iterate over " + iterable.typeName(), position(stmt.variable));
        }
        String var = stmt.variable.lexeme;
        for (Value item : items) {
            if (env.exists(var)) env.set(var, item);
            else env.define(var, item);
            StepResult r = executeStatements(stmt.body);
            if (r.kind == StepResult.Kind.BREAK) break;
            if (r.kind == StepResult.Kind.RETURN) return r;
        }
        return StepResult.NORMAL;
    }

    @Override
    public StepResult visitReturnStmt(Return stmt) {
        Value v = (stmt.value == null) ? Value.none() : evaluate(stmt.value);
        return StepResult.returning(v);
    }

    @Override
    public StepResult visitBreakStmt(Break stmt) {
        return StepResult.BREAK;
    }

    @Override
    public StepResult visitContinueStmt(Continue stmt) {
        return StepResult.CONTINUE;
    }

    @Override
    public StepResult visitTryStmt(Try stmt) {
        StepResult result = StepResult.NORMAL;
        GraphoidException pending = null;
        try {
            result = executeStatements(stmt.body);
        } catch (GraphoidException e) {
            CatchClause clause = findCatch(stmt.catches, e);
            if (clause == null) {
                pending = e;
            } else {
                Environment scope = new Environment(env);
                if (clause.variable != null) scope.define(clause.variable.lexeme, Value.error(e.toErrorObject()));
                Environment saved = env;
                env = scope;
                try {
                    result = executeStatements(clause.body);
                } catch (GraphoidException inner) {
                    pending = inner;
                } finally {
                    env = saved;
                }
            }
        }
        if (stmt.finallyBody != null) {
            StepResult f = executeStatements(stmt.finallyBody);
            if (!f.isNormal()) return f;
        }
        if (pending != null) throw pending;
        return result;
    }

    private static CatchClause findCatch(List<CatchClause> catches, GraphoidException e) {
        String type = e.typeName();
        for (CatchClause c : catches) {
            if (c.errorType == null || c.errorType.lexeme.equals(type)) return c;
        }
        return null;
    }

    @Override
    public StepResult visitConfigureStmt(Configure stmt) {
        RuntimeConfig cfg = config().copy();
        try {
            for (Map.Entry<String, ExprInterface> e : stmt.settings.entrySet()) {
                cfg.set(e.getKey(), rawSetting(e.getKey(), evaluate(e.getValue())));
            }
            for (String flag : stmt.flags) cfg.setFlag(flag);
        } catch (GraphoidException e) {
            throw e.atPosition(position(stmt.keyword));
        }
        ctx.configStack().push(cfg);
        if (stmt.body == null) return StepResult.NORMAL;
        try {
            return executeStatements(stmt.body);
        } finally {
            ctx.configStack().pop();
        }
    }

    private static Object rawSetting(String key, Value v) {
        switch (v.type) {
            case SYMBOL: return v.asSymbol();
            case STRING: return v.asString();
            case BOOL: return v.asBool();
            case NUMBER:
            case BIGNUM:
                return v.asNumber();
            case NONE: return null;
            default:
                throw GraphoidException.config("Invalid value for " + key + ": " + v);
        }
    }

    @Override
    public StepResult visitPrecisionStmt(Precision stmt) {
        RuntimeConfig cfg = config().copy();
        cfg.decimalPlaces = stmt.places;
        ctx.configStack().push(cfg);
        try {
            return executeStatements(stmt.body);
        } finally {
            ctx.configStack().pop();
        }
    }

    // -------------------------
    // Modules
    // -------------------------

    @Override
    public StepResult visitModuleDeclStmt(ModuleDecl stmt) {
        moduleName = stmt.name;
        moduleAlias = stmt.alias;
        return StepResult.NORMAL;
    }

    @Override
    public StepResult visitImportStmt(Import stmt) {
        SourcePosition pos = position(stmt.keyword);
        ModuleValue nativeModule = ctx.modules().nativeModule(stmt.path);
        if (nativeModule != null) {
            env.define(stmt.alias != null ? stmt.alias : nativeModule.name, Value.module(nativeModule));
            return StepResult.NORMAL;
        }
        Path file = ctx.modules().resolve(stmt.path, currentFile, pos);
        ModuleValue module = ctx.modules().cached(file);
        if (module == null) module = loadModule(file, pos);
        env.define(stmt.alias != null ? stmt.alias : module.bindingName(), Value.module(module));
        return StepResult.NORMAL;
    }

    private ModuleValue loadModule(Path file, SourcePosition pos) {
        ctx.modules().beginLoading(file, pos);
        try {
            String source = ModuleManager.readSource(file, pos);
            Interpreter sub = new Interpreter(ctx, file);
            sub.run(Parser.parseSource(source));
            ModuleValue module = sub.toModule(file);
            ctx.modules().register(file, module);
            Debug.get().d(TAG, "module '" + module.name + "' exports " + module.getExports().keySet());
            return module;
        } finally {
            ctx.modules().endLoading(file);
        }
    }

    /** Module value of this interpreter's file: its public top-level bindings. */
    ModuleValue toModule(Path file) {
        String name = (moduleName != null) ? moduleName : ModuleManager.stem(file);
        Map<String, Value> exports = new LinkedHashMap<>();
        for (Map.Entry<String, Value> e : globals.getLocalBindings().entrySet()) {
            String n = e.getKey();
            if (n.startsWith("__") || privateNames.contains(n)) continue;
            exports.put(n, e.getValue());
        }
        return new ModuleValue(name, moduleAlias, file.toString(), exports, privateNames);
    }

    @Override
    public StepResult visitLoadStmt(Load stmt) {
        SourcePosition pos = position(stmt.keyword);
        Path file = ctx.modules().resolve(stmt.path, currentFile, pos);
        ctx.modules().beginLoading(file, pos);
        try {
            String source = ModuleManager.readSource(file, pos);
            Interpreter sub = new Interpreter(ctx, file);
            sub.run(Parser.parseSource(source));
            for (Map.Entry<String, Value> e : sub.globals.getLocalBindings().entrySet()) {
                String n = e.getKey();
                if (n.startsWith("__")) continue;
                Value v = e.getValue();
                List<GraphFunction> overloads = sub.globals.lookupOverloads(n);
                if (overloads != null) {
                    for (GraphFunction fn : overloads) env.defineFunction(fn);
                } else {
                    env.define(n, v);
                }
            }
        } finally {
            ctx.modules().endLoading(file);
        }
        return StepResult.NORMAL;
    }
}
