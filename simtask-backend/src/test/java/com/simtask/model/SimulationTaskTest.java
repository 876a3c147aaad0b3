package com.simtask.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimulationTaskTest {

    @Test
    void returnsIntegerIdAndQueryUnchanged() {
        SimulationTask task = new SimulationTask(1, "select * from t");

        assertEquals(1, task.getId());
        assertEquals("select * from t", task.getQuery());
    }

    @Test
    void keepsEmptyQuery() {
        SimulationTask task = new SimulationTask("task-42", "");

        assertEquals("task-42", task.getId());
        assertEquals("", task.getQuery());
    }

    @Test
    void acceptsNullId() {
        SimulationTask task = new SimulationTask(null, "MATCH (n) RETURN n");

        assertNull(task.getId());
        assertEquals("MATCH (n) RETURN n", task.getQuery());
    }

    @Test
    void acceptsNullQuery() {
        SimulationTask task = new SimulationTask(7L, null);

        assertEquals(7L, task.getId());
        assertNull(task.getQuery());
    }

    @Test
    void returnsSameIdInstance() {
        Object id = new Object();
        SimulationTask task = new SimulationTask(id, "q");

        assertSame(id, task.getId());
    }

    @Test
    void samePairBuildsIndependentInstances() {
        SimulationTask first = new SimulationTask(1, "q");
        SimulationTask second = new SimulationTask(1, "q");

        assertNotSame(first, second);
        assertNotEquals(first, second);
        assertEquals(first.getId(), second.getId());
        assertEquals(first.getQuery(), second.getQuery());
    }
}
