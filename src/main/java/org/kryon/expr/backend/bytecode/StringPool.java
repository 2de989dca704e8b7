package org.kryon.expr.backend.bytecode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Deduplicated string constants: names, string literals and the text form of
 * float literals. Indexes are assigned in insertion order starting at 0.
 */
public class StringPool {
    private final List<String> strings = new ArrayList<>(16);
    private final Map<String, Integer> index = new HashMap<>(16);  // O(1) lookup

    /**
     * @return the index of {@code s}, adding it if not yet present
     */
    public int add(String s) {
        Integer existing = index.get(s);
        if (existing != null) {
            return existing;
        }
        int idx = strings.size();
        strings.add(s);
        index.put(s, idx);
        return idx;
    }

    public String get(int idx) {
        return idx >= 0 && idx < strings.size() ? strings.get(idx) : null;
    }

    public int size() {
        return strings.size();
    }

    public String[] toArray() {
        return strings.toArray(new String[0]);
    }
}
