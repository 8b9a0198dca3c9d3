package cheesepp;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValueTest {

    @Test
    void integralNumbersPrintWithoutFraction() {
        assertEquals("30", Value.number(30.0).format());
        assertEquals("-3", Value.number(-3).format());
        assertEquals("0", Value.number(-0.0).format());
    }

    @Test
    void otherNumbersUseDoubleFormatting() {
        assertEquals("2.5", Value.number(2.5).format());
        assertEquals("1.0E20", Value.number(1e20).format());
    }

    @Test
    void stringsPrintVerbatim() {
        assertEquals("Hello World", Value.string("Hello World").format());
        assertEquals("", Value.string("").format());
    }

    @Test
    void truthiness() {
        assertTrue(Value.number(-1).isTruthy());
        assertFalse(Value.number(0).isTruthy());
        assertTrue(Value.string("a").isTruthy());
        assertFalse(Value.string("").isTruthy());
        assertSame(Value.TRUE, Value.bool(true));
    }

    @Test
    void valuesOfDifferentKindsAreNeverEqual() {
        assertNotEquals(Value.number(1), Value.string("1"));
        assertEquals(Value.number(0.0), Value.number(-0.0));
        assertEquals(Value.number(0.0).hashCode(), Value.number(-0.0).hashCode());
    }

    @Test
    void accessorsRejectTheOtherKind() {
        assertThrows(IllegalStateException.class, () -> Value.string("x").asNumber());
        assertThrows(IllegalStateException.class, () -> Value.number(1).asString());
    }
}
