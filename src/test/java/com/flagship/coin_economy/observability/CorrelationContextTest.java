package com.flagship.coin_economy.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationContextTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Caller id is used as is and removed on close")
    void testBeginWithCallerId() {
        try (CorrelationContext.Scope scope = CorrelationContext.begin("client-42")) {
            assertEquals("client-42", scope.getCorrelationId());
            assertEquals("client-42", CorrelationContext.current().orElseThrow());
            assertEquals("client-42", MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        }
        assertTrue(CorrelationContext.current().isEmpty());
    }

    @Test
    @DisplayName("Blank or malformed ids are replaced")
    void testInvalidIdsReplaced() {
        try (CorrelationContext.Scope scope = CorrelationContext.begin(" ")) {
            assertEquals(8, scope.getCorrelationId().length());
        }
        try (CorrelationContext.Scope scope = CorrelationContext.begin("bad id\nwith newline")) {
            assertNotEquals("bad id\nwith newline", scope.getCorrelationId());
        }
        try (CorrelationContext.Scope scope = CorrelationContext.begin("x".repeat(65))) {
            assertEquals(8, scope.getCorrelationId().length());
        }
    }

    @Test
    @DisplayName("Job scope tags the run and restores the outer scope")
    void testJobScopeNests() {
        try (CorrelationContext.Scope outer = CorrelationContext.begin("outer-1")) {
            try (CorrelationContext.Scope job = CorrelationContext.beginJob("bot-refunds")) {
                assertTrue(job.getCorrelationId().startsWith("bot-refunds-"));
                assertEquals("bot-refunds", MDC.get(CorrelationContext.JOB_MDC_KEY));
                MDC.put(CorrelationContext.WALLET_ID_MDC_KEY, "w-1");
            }
            assertEquals("outer-1", CorrelationContext.current().orElseThrow());
            assertNull(MDC.get(CorrelationContext.JOB_MDC_KEY));
            assertNull(MDC.get(CorrelationContext.WALLET_ID_MDC_KEY));
        }
    }

    @Test
    @DisplayName("Outside any scope a fresh id is handed out without being stored")
    void testCurrentOrNew() {
        String first = CorrelationContext.currentOrNew();
        String second = CorrelationContext.currentOrNew();

        assertNotEquals(first, second);
        assertTrue(CorrelationContext.current().isEmpty());
    }
}
