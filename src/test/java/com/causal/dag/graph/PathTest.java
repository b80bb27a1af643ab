package com.causal.dag.graph;

import org.junit.Test;

import java.util.List;

import static com.causal.dag.graph.Path.Step.BACKWARD;
import static com.causal.dag.graph.Path.Step.FORWARD;
import static org.junit.Assert.*;

public class PathTest {

    @Test
    public void testColliderAndBackdoor() {
        Path p = new Path(List.of("A", "U1", "C", "U2", "Y"), List.of(BACKWARD, FORWARD, BACKWARD, FORWARD));
        assertTrue(p.isBackdoor());
        assertFalse(p.isDirected());
        assertTrue(p.isColliderAt(2));
        assertFalse(p.isColliderAt(1));
        assertFalse(p.isColliderAt(0));
        assertFalse(p.isColliderAt(4));
        assertEquals(4, p.length());
        assertEquals("A", p.start());
        assertEquals("Y", p.end());
        assertEquals("A <- U1 -> C <- U2 -> Y", p.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testStepCountMustMatch() {
        new Path(List.of("A", "B"), List.of());
    }
}
