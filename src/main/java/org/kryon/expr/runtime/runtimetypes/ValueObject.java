package org.kryon.expr.runtime.runtimetypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered string-keyed map of {@link Value}s, owned by exactly one object Value.
 * <p>
 * Keys are unique. Lookup is a linear scan: binding scopes and state objects
 * are small (typically well under 100 entries), and insertion order is kept
 * for enumeration.
 */
public class ValueObject {

    private final List<String> keys;
    private final List<Value> values;

    public ValueObject() {
        this(4);
    }

    public ValueObject(int initialCapacity) {
        int capacity = initialCapacity <= 0 ? 4 : initialCapacity;
        this.keys = new ArrayList<>(capacity);
        this.values = new ArrayList<>(capacity);
    }

    public int size() {
        return keys.size();
    }

    private int indexOf(String key) {
        for (int i = 0; i < keys.size(); i++) {
            if (keys.get(i).equals(key)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns a copy of the value stored under {@code key}, or {@link Value#NULL}.
     */
    public Value get(String key) {
        if (key == null) {
            return Value.NULL;
        }
        int i = indexOf(key);
        return i < 0 ? Value.NULL : values.get(i).copy();
    }

    /**
     * Stores {@code value} under {@code key}, taking ownership of it. An
     * existing key keeps its position.
     */
    public void set(String key, Value value) {
        if (key == null) {
            return;
        }
        Value v = value == null ? Value.NULL : value;
        int i = indexOf(key);
        if (i >= 0) {
            values.set(i, v);
        } else {
            keys.add(key);
            values.add(v);
        }
    }

    /**
     * Chained {@link #set}, for building objects inline.
     */
    public ValueObject with(String key, Value value) {
        set(key, value);
        return this;
    }

    public boolean has(String key) {
        return key != null && indexOf(key) >= 0;
    }

    public boolean delete(String key) {
        int i = key == null ? -1 : indexOf(key);
        if (i < 0) {
            return false;
        }
        keys.remove(i);
        values.remove(i);
        return true;
    }

    /**
     * Keys in insertion order.
     */
    public List<String> keys() {
        return Collections.unmodifiableList(keys);
    }

    public ValueObject copy() {
        ValueObject clone = new ValueObject(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            clone.keys.add(keys.get(i));
            clone.values.add(values.get(i).copy());
        }
        return clone;
    }

    /**
     * Same key set with equal values; order does not matter.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValueObject)) {
            return false;
        }
        ValueObject other = (ValueObject) o;
        if (other.size() != size()) {
            return false;
        }
        for (int i = 0; i < keys.size(); i++) {
            int j = other.indexOf(keys.get(i));
            if (j < 0 || !values.get(i).equals(other.values.get(j))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (int i = 0; i < keys.size(); i++) {
            h += keys.get(i).hashCode() ^ values.get(i).hashCode();
        }
        return h;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < keys.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(keys.get(i)).append('=').append(values.get(i));
        }
        return sb.append('}').toString();
    }
}
