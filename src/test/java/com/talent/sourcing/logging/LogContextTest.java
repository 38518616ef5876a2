package com.talent.sourcing.logging;

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
    @DisplayName("forRun should set runId in MDC")
    void forRunSetsMDC() {
        try (LogContext ctx = LogContext.forRun("run-123")) {
            assertEquals("run-123", MDC.get("runId"));
        }
        assertNull(MDC.get("runId"));
    }

    @Test
    @DisplayName("forStage should set runId and stage in MDC")
    void forStageSetsMDC() {
        try (LogContext ctx = LogContext.forStage("run-1", "DISCOVERY")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("DISCOVERY", MDC.get("stage"));
        }
    }

    @Test
    @DisplayName("forSession should set sessionId and operation in MDC")
    void forSessionSetsMDC() {
        LogContext ctx = LogContext.forSession("session-9", "loadMore");
        assertEquals("session-9", MDC.get("sessionId"));
        assertEquals("loadMore", MDC.get("operation"));

        ctx.close();

        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("with() should add keys that are removed on close")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forRun("run-1").with("entity", "Acme Corp")) {
            assertEquals("Acme Corp", MDC.get("entity"));
        }
        assertNull(MDC.get("entity"));
        assertNull(MDC.get("runId"));
    }

    @Test
    @DisplayName("Inner context sharing a key should restore the outer value")
    void nestedContextsRestoreSharedKeys() {
        try (LogContext run = LogContext.forRun("run-1")) {
            try (LogContext stage = LogContext.forStage("run-1", "SCORING")) {
                assertEquals("SCORING", MDC.get("stage"));
            }
            assertEquals("run-1", MDC.get("runId"));
            assertNull(MDC.get("stage"));

            try (LogContext other = LogContext.forRun("run-2")) {
                assertEquals("run-2", MDC.get("runId"));
            }
            assertEquals("run-1", MDC.get("runId"));
        }
        assertNull(MDC.get("runId"));
    }

    @Test
    @DisplayName("Closing twice should be harmless")
    void closeIsIdempotent() {
        LogContext ctx = LogContext.forRun("run-1");
        ctx.close();
        MDC.put("runId", "later");

        ctx.close();

        assertEquals("later", MDC.get("runId"));
    }

    @Test
    @DisplayName("generateId should return unique UUIDs")
    void generateIdReturnsUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateId());
        }
        assertEquals(100, ids.size(), "All generated IDs should be unique");
        assertTrue(ids.iterator().next().matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
    }
}
