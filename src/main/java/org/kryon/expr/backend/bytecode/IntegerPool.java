package org.kryon.expr.backend.bytecode;

import java.util.HashMap;
import java.util.Map;

/**
 * Deduplicated 64-bit integer constants too wide for an inline operand3.
 */
public class IntegerPool {
    private long[] values = new long[8];
    private int size;
    private final Map<Long, Integer> index = new HashMap<>(8);

    public int add(long value) {
        Integer existing = index.get(value);
        if (existing != null) {
            return existing;
        }
        if (size == values.length) {
            long[] grown = new long[values.length * 2];
            System.arraycopy(values, 0, grown, 0, size);
            values = grown;
        }
        values[size] = value;
        index.put(value, size);
        return size++;
    }

    public long get(int idx) {
        return values[idx];
    }

    public int size() {
        return size;
    }

    public long[] toArray() {
        long[] out = new long[size];
        System.arraycopy(values, 0, out, 0, size);
        return out;
    }
}
