package de.htwsaar.datalinker.common.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import java.io.IOException;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

/**
 * Unit-Tests für {@link TraceIdFilter}.
 */
class TraceIdFilterTest {

    @AfterEach
    void cleanupMdcAfterTest() {
        MDC.clear();
    }

    /**
     * Eine mitgesendete Trace-ID wird unverändert übernommen und zurückgegeben.
     */
    @Test
    void shouldReuseIncomingTraceIdFromHeader() throws ServletException, IOException {
        TraceIdFilter filter = new TraceIdFilter();
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/datalink/links");
        MockHttpServletResponse response = new MockHttpServletResponse();
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "test-trace-123");

        FilterChain chain = (req, resp) -> assertEquals("test-trace-123", MDC.get(TraceIdFilter.TRACE_ID_KEY));

        filter.doFilter(request, response, chain);

        assertEquals("test-trace-123", response.getHeader(TraceIdFilter.TRACE_ID_HEADER));
        assertMdcIsEmpty();
    }

    @Test
    void shouldGenerateUuidWhenHeaderIsMissing() throws ServletException, IOException {
        TraceIdFilter filter = new TraceIdFilter();
        MockHttpServletRequest request = new MockHttpServletRequest();
        MockHttpServletResponse response = new MockHttpServletResponse();

        FilterChain chain = (req, resp) -> assertValidUuid(MDC.get(TraceIdFilter.TRACE_ID_KEY));

        filter.doFilter(request, response, chain);

        assertValidUuid(response.getHeader(TraceIdFilter.TRACE_ID_HEADER));
        assertMdcIsEmpty();
    }

    /**
     * Whitespace-Header gelten als "nicht gesetzt".
     */
    @Test
    void shouldGenerateUuidWhenHeaderIsBlank() throws ServletException, IOException {
        TraceIdFilter filter = new TraceIdFilter();
        MockHttpServletRequest request = new MockHttpServletRequest();
        MockHttpServletResponse response = new MockHttpServletResponse();
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "   ");

        filter.doFilter(request, response, (req, resp) -> assertValidUuid(MDC.get(TraceIdFilter.TRACE_ID_KEY)));

        assertValidUuid(response.getHeader(TraceIdFilter.TRACE_ID_HEADER));
        assertMdcIsEmpty();
    }

    @Test
    void shouldOverwriteOldMdcValueInsideRequestAndClearAfterwards() throws ServletException, IOException {
        TraceIdFilter filter = new TraceIdFilter();
        MockHttpServletRequest request = new MockHttpServletRequest();
        MockHttpServletResponse response = new MockHttpServletResponse();

        MDC.put(TraceIdFilter.TRACE_ID_KEY, "stale-trace-id");

        filter.doFilter(request, response, (req, resp) -> {
            String traceIdInRequest = MDC.get(TraceIdFilter.TRACE_ID_KEY);
            assertNotNull(traceIdInRequest);
            assertFalse("stale-trace-id".equals(traceIdInRequest));
        });

        assertMdcIsEmpty();
    }

    /**
     * Auch im Fehlerfall muss der MDC-Eintrag entfernt werden.
     */
    @Test
    void shouldClearMdcWhenFilterChainThrows() {
        TraceIdFilter filter = new TraceIdFilter();
        MockHttpServletRequest request = new MockHttpServletRequest();
        MockHttpServletResponse response = new MockHttpServletResponse();

        RuntimeException thrown = assertThrows(
                RuntimeException.class,
                () -> filter.doFilter(request, response, (req, resp) -> {
                    throw new RuntimeException("boom");
                }));

        assertEquals("boom", thrown.getMessage());
        assertMdcIsEmpty();
    }

    /**
     * IDs mit Sonderzeichen oder Überlänge werden durch eine neue UUID ersetzt.
     */
    @Test
    void shouldReplaceUnsafeIncomingTraceId() throws ServletException, IOException {
        TraceIdFilter filter = new TraceIdFilter();
        MockHttpServletRequest request = new MockHttpServletRequest();
        MockHttpServletResponse response = new MockHttpServletResponse();
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "abc\nFAKE LOG LINE");

        filter.doFilter(request, response, (req, resp) -> assertValidUuid(MDC.get(TraceIdFilter.TRACE_ID_KEY)));

        assertValidUuid(response.getHeader(TraceIdFilter.TRACE_ID_HEADER));
        assertValidUuid(TraceIdFilter.resolveTraceId("x".repeat(65)));
    }

    @Test
    void shouldExposeStableContractConstants() {
        assertEquals("traceId", TraceIdFilter.TRACE_ID_KEY);
        assertEquals("X-Trace-Id", TraceIdFilter.TRACE_ID_HEADER);
    }

    private static void assertValidUuid(String maybeUuid) {
        assertNotNull(maybeUuid);
        assertFalse(maybeUuid.isBlank());
        assertNotNull(UUID.fromString(maybeUuid));
    }

    private static void assertMdcIsEmpty() {
        Map<String, String> context = MDC.getCopyOfContextMap();
        assertTrue(context == null || context.isEmpty());
    }
}
