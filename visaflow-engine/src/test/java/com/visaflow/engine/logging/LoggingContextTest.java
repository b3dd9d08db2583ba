package com.visaflow.engine.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LoggingContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void forInstance_shouldPopulateAndClearMdc() {
        try (var ctx = LoggingContext.forInstance("i-1", "d-1", "def-1")) {
            assertEquals("i-1", MDC.get(LoggingContext.INSTANCE_ID));
            assertEquals("d-1", MDC.get(LoggingContext.DOCUMENT_ID));
            assertEquals("def-1", MDC.get(LoggingContext.DEFINITION_ID));
            assertNotNull(LoggingContext.getTraceId());
        }

        assertNull(MDC.get(LoggingContext.INSTANCE_ID));
        assertNull(LoggingContext.getTraceId());
    }

    @Test
    void nestedContexts_shouldRestoreOuterValues() {
        try (var watcher = LoggingContext.forWatcher("w-1", "def-1")) {
            String traceId = LoggingContext.getTraceId();

            try (var instance = LoggingContext.forInstance(null, "d-1", "def-2")) {
                LoggingContext.setInstanceId("i-9");
                assertEquals("def-2", MDC.get(LoggingContext.DEFINITION_ID));
                assertEquals("i-9", LoggingContext.getInstanceId());
                assertEquals(traceId, LoggingContext.getTraceId());
            }

            assertEquals("w-1", MDC.get(LoggingContext.WATCHER_ID));
            assertEquals("def-1", MDC.get(LoggingContext.DEFINITION_ID));
            assertNull(LoggingContext.getInstanceId());
            assertEquals(traceId, LoggingContext.getTraceId());
        }

        assertNull(MDC.get(LoggingContext.WATCHER_ID));
        assertNull(LoggingContext.getTraceId());
    }

    @Test
    void forInstance_shouldNotInheritAnOuterInstanceId() {
        MDC.put(LoggingContext.INSTANCE_ID, "outer");

        try (var ctx = LoggingContext.forInstance(null, "d-1", null)) {
            assertNull(LoggingContext.getInstanceId());
        }

        assertEquals("outer", LoggingContext.getInstanceId());
    }
}
