package com.gigateer.ingestor.application.run;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceRunLocksTest {

    @Test
    void testOneRunPerSource() {
        SourceRunLocks locks = new SourceRunLocks();

        assertTrue(locks.tryAcquire("croft"));
        assertFalse(locks.tryAcquire("croft"));
        assertTrue(locks.tryAcquire("exchange"));
        assertTrue(locks.isRunning("croft"));

        locks.release("croft");
        assertFalse(locks.isRunning("croft"));
        assertTrue(locks.tryAcquire("croft"));
    }
}
