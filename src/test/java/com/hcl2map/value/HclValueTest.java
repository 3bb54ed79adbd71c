package com.hcl2map.value;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class HclValueTest {

    @Test
    public void testObjectKeepsInsertionOrder() {
        HclValue.HclObject object = HclValue.HclObject.empty();
        for (String key : List.of("zeta", "alpha", "mid", "beta")) {
            object.with(key, new HclValue.HclNull());
        }
        assertEquals(List.of("zeta", "alpha", "mid", "beta"), List.copyOf(object.fields().keySet()));
    }

    @Test
    public void testReplacingKeyKeepsPosition() {
        HclValue.HclObject object = HclValue.HclObject.of("a", HclValue.HclNumber.of(1L))
                .with("b", HclValue.HclNumber.of(2L))
                .with("a", HclValue.HclNumber.of(3L));
        assertEquals(List.of("a", "b"), List.copyOf(object.fields().keySet()));
        assertEquals(HclValue.HclNumber.of(3L), object.get("a"));
    }

    @Test
    public void testToPlain() {
        HclValue.HclObject object = HclValue.HclObject.of("name", new HclValue.HclString("web"))
                .with("count", HclValue.HclNumber.of(2L))
                .with("ratio", HclValue.HclNumber.of(0.25))
                .with("on", new HclValue.HclBoolean(true))
                .with("none", new HclValue.HclNull())
                .with("list", HclValue.HclArray.of(new HclValue.HclString("a"), HclValue.HclObject.empty()));

        Map<String, Object> plain = object.toPlain();

        assertEquals("web", plain.get("name"));
        assertEquals(2L, plain.get("count"));
        assertEquals(0.25, plain.get("ratio"));
        assertEquals(Boolean.TRUE, plain.get("on"));
        assertTrue(plain.containsKey("none"));
        assertNull(plain.get("none"));
        assertEquals(Arrays.asList("a", Map.of()), plain.get("list"));
        assertEquals(List.of("name", "count", "ratio", "on", "none", "list"), List.copyOf(plain.keySet()));
    }

    @Test
    public void testNumberJsonText() {
        assertEquals("42", HclValue.HclNumber.of(42L).toJsonString());
        assertEquals("1.5", HclValue.HclNumber.of(1.5).toJsonString());
        assertEquals("null", HclValue.HclNumber.of(Double.NaN).toJsonString());
        assertEquals("18446744073709551616", HclValue.HclNumber.of(BigInteger.TWO.pow(64)).toJsonString());
    }

    @Test
    public void testBigIntegerToPlain() {
        BigInteger wide = new BigInteger("99999999999999999999");
        assertEquals(wide, HclValue.HclNumber.of(wide).toPlain());
    }

    @Test
    public void testStructuralEquality() {
        assertEquals(
                HclValue.HclObject.of("x", HclValue.HclArray.of(HclValue.HclNumber.of(1L))),
                HclValue.HclObject.of("x", HclValue.HclArray.empty().with(HclValue.HclNumber.of(1L))));
        assertNotEquals(HclValue.HclNumber.of(1L), HclValue.HclNumber.of(1.0));
    }
}
