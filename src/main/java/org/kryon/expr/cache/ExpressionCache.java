package org.kryon.expr.cache;

import org.kryon.expr.astnode.Node;
import org.kryon.expr.astvisitor.VariableCollectorVisitor;
import org.kryon.expr.backend.bytecode.CompiledExpression;
import org.kryon.expr.json.ExpressionJson;
import org.kryon.expr.runtime.runtimetypes.Value;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * LRU cache of compiled expressions, keyed by tree structure.
 * <p>
 * Two trees with the same shape and literals share one entry, whatever their
 * object identity. Each entry also remembers the variables its expression
 * reads and, optionally, the last evaluation result; when a variable changes,
 * {@link #invalidateVariable(String)} drops the memoized results that depend
 * on it while keeping the compiled code.
 * <p>
 * Not thread-safe: callers serialize access, as they do for the state store.
 */
public class ExpressionCache {

    /**
     * Snapshot of the cache counters.
     */
    public record Stats(long hits, long misses, long evictions, long invalidations, int size) {
        public double hitRate() {
            long lookups = hits + misses;
            return lookups == 0 ? 0.0 : (double) hits / lookups;
        }
    }

    private static class Entry {
        final CompiledExpression compiled;
        final Set<String> dependencies;
        Value result;  // memoized last result, or null

        Entry(CompiledExpression compiled, Set<String> dependencies) {
            this.compiled = compiled;
            this.dependencies = dependencies;
        }
    }

    private final int maxEntries;
    private final LinkedHashMap<String, Entry> entries;

    private long hits;
    private long misses;
    private long evictions;
    private long invalidations;

    public ExpressionCache(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Cache size must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        // Access order: iteration starts at the least recently used entry
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Entry> eldest) {
                if (size() > ExpressionCache.this.maxEntries) {
                    evictions++;
                    return true;
                }
                return false;
            }
        };
    }

    /**
     * Structural key of a tree.
     */
    static String keyOf(Node tree) {
        return ExpressionJson.toJson(tree);
    }

    /**
     * @return the cached unit for a structurally equal tree, or null
     */
    public CompiledExpression lookup(Node tree) {
        Entry entry = entries.get(keyOf(tree));
        if (entry == null) {
            misses++;
            return null;
        }
        hits++;
        return entry.compiled;
    }

    /**
     * Caches a unit, replacing any entry for the same tree and evicting the
     * least recently used entry if the cache is full.
     */
    public void insert(Node tree, CompiledExpression compiled) {
        entries.put(keyOf(tree), new Entry(compiled, VariableCollectorVisitor.collect(tree)));
    }

    /**
     * Returns the cached unit for {@code tree}, compiling and caching it on a miss.
     */
    public CompiledExpression getOrCompile(Node tree, Function<Node, CompiledExpression> compiler) {
        String key = keyOf(tree);
        Entry entry = entries.get(key);
        if (entry != null) {
            hits++;
            return entry.compiled;
        }
        misses++;
        CompiledExpression compiled = compiler.apply(tree);
        entries.put(key, new Entry(compiled, VariableCollectorVisitor.collect(tree)));
        return compiled;
    }

    /**
     * @return a copy of the memoized result for {@code tree}, or null if there is none
     */
    public Value getResult(Node tree) {
        Entry entry = entries.get(keyOf(tree));
        if (entry == null || entry.result == null) {
            return null;
        }
        return entry.result.copy();
    }

    /**
     * Memoizes a result for a cached tree. Ignored if the tree is not cached.
     */
    public void storeResult(Node tree, Value result) {
        Entry entry = entries.get(keyOf(tree));
        if (entry != null) {
            entry.result = result == null ? Value.NULL : result.copy();
        }
    }

    /**
     * Drops the memoized results of every entry that reads {@code name}.
     *
     * @return the number of results dropped
     */
    public int invalidateVariable(String name) {
        int count = 0;
        for (Entry entry : entries.values()) {
            if (entry.result != null && entry.dependencies.contains(name)) {
                entry.result = null;
                count++;
            }
        }
        invalidations += count;
        return count;
    }

    /**
     * Drops every memoized result; compiled code stays cached.
     */
    public int invalidateAll() {
        int count = 0;
        for (Entry entry : entries.values()) {
            if (entry.result != null) {
                entry.result = null;
                count++;
            }
        }
        invalidations += count;
        return count;
    }

    /**
     * Removes the entry for {@code tree}.
     *
     * @return true if there was one
     */
    public boolean remove(Node tree) {
        return entries.remove(keyOf(tree)) != null;
    }

    /**
     * Removes every entry whose expression reads {@code name}, for bindings torn
     * down together with a variable.
     */
    public int removeDependents(String name) {
        int count = 0;
        Iterator<Entry> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().dependencies.contains(name)) {
                it.remove();
                count++;
            }
        }
        return count;
    }

    /**
     * Removes all entries. Counters are kept.
     */
    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return maxEntries;
    }

    public Stats stats() {
        return new Stats(hits, misses, evictions, invalidations, entries.size());
    }

    public void resetStats() {
        hits = 0;
        misses = 0;
        evictions = 0;
        invalidations = 0;
    }
}
