package org.kryon.expr.runtime.operators;

import org.junit.jupiter.api.Test;
import org.kryon.expr.runtime.runtimetypes.Value;

import static org.junit.jupiter.api.Assertions.*;

public class StringOperatorsTest {

    @Test
    public void testConcatStringifiesBothSides() {
        assertEquals(Value.ofString("12"), StringOperators.concat(Value.ofInt(1), Value.ofInt(2)));
        assertEquals(Value.ofString("truenull"), StringOperators.concat(Value.TRUE, Value.NULL));
        assertEquals(Value.ofString("x2"), StringOperators.concat(Value.ofString("x"), Value.ofFloat(2.0)));
    }

    @Test
    public void testLengthCountsCodePoints() {
        assertEquals(5, StringOperators.length("hello"));
        assertEquals(0, StringOperators.length(""));
        assertEquals(0, StringOperators.length(null));
        assertEquals(2, StringOperators.length("a😀"), "surrogate pair is one character");
    }

    @Test
    public void testCharAt() {
        assertEquals(Value.ofString("h"), StringOperators.charAt("hello", 0));
        assertEquals(Value.ofString("o"), StringOperators.charAt("hello", 4));
        assertEquals(Value.NULL, StringOperators.charAt("hello", 5));
        assertEquals(Value.NULL, StringOperators.charAt("hello", -1));
        assertEquals(Value.ofString("😀"), StringOperators.charAt("a😀", 1));
    }

    @Test
    public void testCaseMapping() {
        assertEquals(Value.ofString("HELLO"), StringOperators.toUpperCase("hello"));
        assertEquals(Value.ofString("STRASSE"), StringOperators.toUpperCase("straße"), "full case mapping");
        assertEquals(Value.ofString("été"), StringOperators.toLowerCase("ÉTÉ"));
    }

    @Test
    public void testTrim() {
        assertEquals(Value.ofString("x y"), StringOperators.trim(" \t x y\r\n"));
        assertEquals(Value.ofString(""), StringOperators.trim("   "));
        assertEquals(Value.ofString("\u00A0x"), StringOperators.trim("\u00A0x "), "only space, tab, CR and LF are stripped");
    }

    @Test
    public void testSubstringClamps() {
        assertEquals(Value.ofString("ell"), StringOperators.substring("hello", Value.ofInt(1), Value.ofInt(4)));
        assertEquals(Value.ofString("llo"), StringOperators.substring("hello", Value.ofInt(2), null));
        assertEquals(Value.ofString("hello"), StringOperators.substring("hello", Value.ofInt(-3), Value.ofInt(99)));
        assertEquals(Value.ofString(""), StringOperators.substring("hello", Value.ofInt(4), Value.ofInt(2)));
        assertEquals(Value.ofString("hello"), StringOperators.substring("hello", Value.ofString("x"), null));
    }
}
