package com.structural.cbr.api;

import org.junit.Test;

import static org.junit.Assert.*;

public class DofKeyTest {

    @Test
    public void testLabelRoundTripForEveryComponent() {
        for (int code = 1; code <= 6; code++) {
            DofKey key = DofKey.of(123, code);
            assertEquals(1230 + code, key.encode());
            assertEquals(key, DofKey.decode(key.encode()));
        }
    }

    @Test
    public void testOrderingIsNodeThenComponent() {
        DofKey a = DofKey.of(1, DofComponent.RZ);
        DofKey b = DofKey.of(2, DofComponent.UX);
        DofKey c = DofKey.of(2, DofComponent.UY);
        assertTrue(a.compareTo(b) < 0);
        assertTrue(b.compareTo(c) < 0);
        assertEquals(0, c.compareTo(DofKey.of(2, 2)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNonPositiveNode() {
        DofKey.of(0, DofComponent.UX);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsUnknownComponentCode() {
        DofKey.decode(17);
    }

    @Test
    public void testPlanarComponents() {
        assertTrue(DofComponent.UX.isPlanar());
        assertTrue(DofComponent.UY.isPlanar());
        assertTrue(DofComponent.RZ.isPlanar());
        assertFalse(DofComponent.UZ.isPlanar());
        assertFalse(DofComponent.RX.isPlanar());
        assertFalse(DofComponent.RY.isPlanar());
    }
}
