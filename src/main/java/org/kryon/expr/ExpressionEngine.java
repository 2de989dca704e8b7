package org.kryon.expr;

import org.kryon.expr.astnode.Node;
import org.kryon.expr.astvisitor.ConstantFoldingVisitor;
import org.kryon.expr.backend.bytecode.BytecodeCompiler;
import org.kryon.expr.backend.bytecode.BytecodeInterpreter;
import org.kryon.expr.backend.bytecode.BytecodeOptimizer;
import org.kryon.expr.backend.bytecode.CompiledExpression;
import org.kryon.expr.backend.bytecode.EvalContext;
import org.kryon.expr.cache.ExpressionCache;
import org.kryon.expr.runtime.BuiltinRegistry;
import org.kryon.expr.runtime.VariableAccessor;
import org.kryon.expr.runtime.runtimetypes.Value;

import java.util.Map;

/**
 * Entry point tying the pipeline together:
 * constant folding, bytecode compilation, dead-code elimination, evaluation.
 * <p>
 * An engine owns its options and compile cache and shares the host's builtin
 * registry. Like the compiler it wraps, it is not thread-safe; the compiled
 * units it returns are, and may be evaluated from any thread.
 */
public class ExpressionEngine {
    private final CompilerOptions options;
    private final BuiltinRegistry builtins;
    private final ExpressionCache cache;

    public ExpressionEngine(CompilerOptions options, BuiltinRegistry builtins) {
        this.options = options.clone();
        this.builtins = builtins;
        this.cache = new ExpressionCache(this.options.cacheSize);
    }

    public ExpressionEngine(BuiltinRegistry builtins) {
        this(CompilerOptions.loadDefault(), builtins);
    }

    public ExpressionEngine() {
        this(new BuiltinRegistry());
    }

    /**
     * Compiles a tree through the passes enabled in the options. The result is
     * not cached; see {@link #compileCached(Node)}.
     */
    public CompiledExpression compile(Node tree) {
        Node optimized = options.constantFolding ? ConstantFoldingVisitor.foldConstants(tree) : tree;
        CompiledExpression compiled = new BytecodeCompiler(options).compile(optimized);
        if (options.deadCodeElimination && !compiled.hasError()) {
            compiled = BytecodeOptimizer.eliminateDeadCode(compiled);
        }
        return compiled;
    }

    /**
     * Compiles a tree, reusing the unit of any structurally equal tree compiled before.
     */
    public CompiledExpression compileCached(Node tree) {
        return cache.getOrCompile(tree, this::compile);
    }

    public Value evaluate(CompiledExpression compiled, VariableAccessor accessor) {
        return evaluate(compiled, newContext(accessor));
    }

    /**
     * Evaluates with local bindings that shadow the accessor's variables.
     * A null key names nothing an expression can read and is skipped.
     */
    public Value evaluate(CompiledExpression compiled, VariableAccessor accessor, Map<String, Value> locals) {
        EvalContext ctx = newContext(accessor);
        for (Map.Entry<String, Value> local : locals.entrySet()) {
            if (local.getKey() != null) {
                ctx.defineLocal(local.getKey(), local.getValue());
            }
        }
        return evaluate(compiled, ctx);
    }

    /**
     * Evaluates in a caller-supplied context, so the caller can inspect its error state.
     */
    public Value evaluate(CompiledExpression compiled, EvalContext ctx) {
        return BytecodeInterpreter.execute(compiled, ctx);
    }

    /**
     * Compiles (through the cache) and evaluates a tree.
     */
    public Value evaluate(Node tree, VariableAccessor accessor) {
        return evaluate(compileCached(tree), accessor);
    }

    public EvalContext newContext(VariableAccessor accessor) {
        return new EvalContext(accessor, builtins, options.initialStackSize, options.maxStackSize);
    }

    public CompilerOptions getOptions() {
        return options;
    }

    public BuiltinRegistry getBuiltins() {
        return builtins;
    }

    public ExpressionCache getCache() {
        return cache;
    }
}
