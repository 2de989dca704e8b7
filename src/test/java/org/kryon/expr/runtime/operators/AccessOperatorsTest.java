package org.kryon.expr.runtime.operators;

import org.junit.jupiter.api.Test;
import org.kryon.expr.runtime.runtimetypes.Value;
import org.kryon.expr.runtime.runtimetypes.ValueArray;
import org.kryon.expr.runtime.runtimetypes.ValueObject;

import static org.junit.jupiter.api.Assertions.*;

public class AccessOperatorsTest {

    @Test
    public void testObjectProperty() {
        Value user = Value.ofObject(new ValueObject().with("name", Value.ofString("Ann")));
        assertEquals(Value.ofString("Ann"), AccessOperators.getProperty(user, "name"));
        assertEquals(Value.NULL, AccessOperators.getProperty(user, "age"));
        assertEquals(Value.NULL, AccessOperators.getProperty(Value.NULL, "name"));
        assertEquals(Value.ofString("Ann"), AccessOperators.getIndexed(user, Value.ofString("name")));
    }

    @Test
    public void testSyntheticLength() {
        Value arr = Value.ofArray(ValueArray.of(Value.ofInt(1), Value.ofInt(2)));
        assertEquals(Value.ofInt(2), AccessOperators.getProperty(arr, "length"));
        assertEquals(Value.ofInt(5), AccessOperators.getProperty(Value.ofString("hello"), "length"));
        assertEquals(Value.ofInt(2), AccessOperators.getIndexed(arr, Value.ofString("length")));
        assertEquals(Value.NULL, AccessOperators.getProperty(arr, "size"));
    }

    @Test
    public void testIndexBounds() {
        Value arr = Value.ofArray(ValueArray.of(Value.ofInt(10), Value.ofInt(20)));
        assertEquals(Value.ofInt(10), AccessOperators.getIndexed(arr, Value.ofInt(0)));
        assertEquals(Value.ofInt(20), AccessOperators.getIndexed(arr, Value.ofInt(1)));
        assertEquals(Value.NULL, AccessOperators.getIndexed(arr, Value.ofInt(2)));
        assertEquals(Value.NULL, AccessOperators.getIndexed(arr, Value.ofInt(-1)));

        Value s = Value.ofString("abc");
        assertEquals(Value.ofString("c"), AccessOperators.getIndexed(s, Value.ofInt(2)));
        assertEquals(Value.NULL, AccessOperators.getIndexed(s, Value.ofInt(3)));
        assertEquals(Value.NULL, AccessOperators.getIndexed(s, Value.ofInt(-1)));
    }

    @Test
    public void testNullAndMismatchedKeys() {
        Value arr = Value.ofArray(ValueArray.of(Value.ofInt(10)));
        assertEquals(Value.NULL, AccessOperators.getIndexed(arr, Value.NULL));
        assertEquals(Value.NULL, AccessOperators.getIndexed(arr, Value.ofFloat(0.0)));
        assertEquals(Value.NULL, AccessOperators.getIndexed(Value.NULL, Value.ofInt(0)));
        assertEquals(Value.NULL, AccessOperators.getIndexed(Value.ofInt(5), Value.ofInt(0)));
    }
}
