package org.kryon.expr.runtime.runtimetypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Growable array of {@link Value}s, owned by exactly one array Value.
 */
public class ValueArray {

    private final List<Value> elements;

    public ValueArray() {
        this.elements = new ArrayList<>(4);
    }

    public ValueArray(int initialCapacity) {
        this.elements = new ArrayList<>(initialCapacity <= 0 ? 4 : initialCapacity);
    }

    /**
     * Builds an array from the given values, moving them in.
     */
    public static ValueArray of(Value... values) {
        ValueArray array = new ValueArray(values.length);
        for (Value v : values) {
            array.push(v);
        }
        return array;
    }

    public int size() {
        return elements.size();
    }

    /**
     * Appends a value, taking ownership of it. A Java null is stored as {@link Value#NULL}.
     */
    public void push(Value value) {
        elements.add(value == null ? Value.NULL : value);
    }

    /**
     * Removes and returns the last element, or {@link Value#NULL} when empty.
     * Ownership of the removed value passes to the caller.
     */
    public Value pop() {
        if (elements.isEmpty()) {
            return Value.NULL;
        }
        return elements.remove(elements.size() - 1);
    }

    /**
     * Returns a copy of the element at {@code index}, or {@link Value#NULL} when out of range.
     */
    public Value get(long index) {
        if (index < 0 || index >= elements.size()) {
            return Value.NULL;
        }
        return elements.get((int) index).copy();
    }

    /**
     * Replaces the element at {@code index}. Out-of-range writes are dropped.
     */
    public void set(long index, Value value) {
        if (index < 0 || index >= elements.size()) {
            return;
        }
        elements.set((int) index, value == null ? Value.NULL : value);
    }

    public void reverse() {
        Collections.reverse(elements);
    }

    public ValueArray copy() {
        ValueArray clone = new ValueArray(elements.size());
        for (Value v : elements) {
            clone.elements.add(v.copy());
        }
        return clone;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValueArray)) {
            return false;
        }
        return elements.equals(((ValueArray) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return elements.toString();
    }
}
