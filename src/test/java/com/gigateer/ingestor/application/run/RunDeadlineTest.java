package com.gigateer.ingestor.application.run;

import com.gigateer.ingestor.domain.exception.RunTimeoutException;
import com.gigateer.ingestor.domain.model.ErrorStage;
import com.gigateer.ingestor.domain.model.PipelineStage;
import com.gigateer.ingestor.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RunDeadlineTest {

    @Test
    void testExpiresAfterBudget() throws Exception {
        Instant start = Instant.parse("2025-05-01T10:00:00Z");
        MutableClock clock = new MutableClock(start);
        RunDeadline deadline = new RunDeadline(clock, start, 1_000L);

        deadline.check(PipelineStage.FETCHING);
        clock.advance(Duration.ofMillis(999));
        assertFalse(deadline.isExpired());

        clock.advance(Duration.ofMillis(1));
        assertTrue(deadline.isExpired());
        RunTimeoutException e = assertThrows(RunTimeoutException.class, () -> deadline.check(PipelineStage.NORMALIZING));
        assertEquals(PipelineStage.NORMALIZING, e.getAbortedAt());
        assertEquals(ErrorStage.NORMALIZE, e.getStage());
        assertEquals("TIMEOUT", e.getKind());
    }
}
