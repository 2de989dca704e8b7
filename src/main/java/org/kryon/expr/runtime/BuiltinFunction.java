package org.kryon.expr.runtime;

import org.kryon.expr.runtime.runtimetypes.Value;

/**
 * A native function callable from expressions through {@link BuiltinRegistry}.
 */
@FunctionalInterface
public interface BuiltinFunction {

    /**
     * @param args arguments in source order; owned by the callee
     * @return the result, or {@code null} for {@link Value#NULL}
     */
    Value call(Value[] args);
}
