package com.gigateer.ingestor.infrastructure.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoggingIngestionEventSinkTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void testRunContextVisibleWhileLogging() {
        List<String> seen = new ArrayList<>();

        LoggingIngestionEventSink.withRunContext("bristol-the-croft", "run-1", () -> {
            seen.add(MDC.get("sourceId"));
            seen.add(MDC.get("runId"));
        });

        assertEquals(List.of("bristol-the-croft", "run-1"), seen);
        assertNull(MDC.get("sourceId"));
        assertNull(MDC.get("runId"));
    }

    @Test
    void testCallerContextRestored() {
        MDC.put("sourceId", "bristol-exchange");
        MDC.put("runId", "outer-run");

        LoggingIngestionEventSink.withRunContext("bristol-the-croft", "inner-run", () ->
            assertEquals("inner-run", MDC.get("runId")));

        assertEquals("bristol-exchange", MDC.get("sourceId"));
        assertEquals("outer-run", MDC.get("runId"));
    }
}
