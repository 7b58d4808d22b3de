package com.content.visibility.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forRecompute should set correlationId, userId, and operation in MDC")
    void forRecomputeSetsMDC() {
        try (LogContext ctx = LogContext.forRecompute("corr-123", 42L)) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("42", MDC.get("userId"));
            assertEquals("recompute", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forBatch should set batchId and operation in MDC")
    void forBatchSetsMDC() {
        try (LogContext ctx = LogContext.forBatch("batch-456")) {
            assertEquals("batch-456", MDC.get("batchId"));
            assertEquals("recompute-all", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forHide should set userId, entityType, and operation in MDC")
    void forHideSetsMDC() {
        try (LogContext ctx = LogContext.forHide(7L, "performer")) {
            assertEquals("7", MDC.get("userId"));
            assertEquals("performer", MDC.get("entityType"));
            assertEquals("hide", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forRecompute("corr-123", 1L);
        assertNotNull(MDC.get("correlationId"));

        ctx.close();

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("userId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("with() should add extra keys that are also cleared")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forBatch("b-1").with("phase", "commit")) {
            assertEquals("commit", MDC.get("phase"));
        }
        assertNull(MDC.get("phase"));
    }

    @Test
    @DisplayName("generateCorrelationId should produce unique ids")
    void uniqueCorrelationIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
