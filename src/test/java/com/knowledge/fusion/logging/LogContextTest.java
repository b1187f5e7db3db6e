package com.knowledge.fusion.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Fusion context sets and clears its keys")
    void fusionContext() {
        try (LogContext ctx = LogContext.forFusion("batch-1", "entity")) {
            assertEquals("batch-1", MDC.get("batchId"));
            assertEquals("entity", MDC.get("itemKind"));
            assertEquals("fuse", MDC.get("operation"));
        }
        assertNull(MDC.get("batchId"));
        assertNull(MDC.get("itemKind"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Additional keys are removed on close as well")
    void withExtraKey() {
        try (LogContext ctx = LogContext.forPersistence("corr-1", "json").with("path", "/tmp/graph.json")) {
            assertEquals("json", MDC.get("format"));
            assertEquals("/tmp/graph.json", MDC.get("path"));
        }
        assertNull(MDC.get("path"));
        assertNull(MDC.get("correlationId"));
    }

    @Test
    @DisplayName("Merge and conflict contexts name their operation")
    void operations() {
        try (LogContext ctx = LogContext.forGraphMerge("corr-2")) {
            assertEquals("graph-merge", MDC.get("operation"));
        }
        try (LogContext ctx = LogContext.forConflicts("batch-2")) {
            assertEquals("resolve-conflicts", MDC.get("operation"));
        }
        assertNotEquals(LogContext.generateCorrelationId(), LogContext.generateCorrelationId());
    }
}
