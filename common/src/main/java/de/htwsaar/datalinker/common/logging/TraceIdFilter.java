package de.htwsaar.datalinker.common.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Vergibt jeder Anfrage eine Trace-ID (aus {@code X-Trace-Id} oder neu erzeugt), legt sie im MDC ab,
 * spiegelt sie im Response-Header und schreibt nach der Anfrage eine Zugriffszeile.
 *
 * <p>Mitgesendete IDs werden nur übernommen, wenn sie kurz sind und keine Sonderzeichen enthalten;
 * sie landen sonst ungefiltert in den Logs.</p>
 */
public class TraceIdFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(TraceIdFilter.class);

    /** Schlüsselname der Trace-ID im Logging-Kontext */
    public static final String TRACE_ID_KEY = "traceId";

    /** HTTP-Header, aus dem eine vorhandene Trace-ID gelesen werden kann */
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private static final Pattern ACCEPTED_TRACE_ID = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String traceId = resolveTraceId(request.getHeader(TRACE_ID_HEADER));
        MDC.put(TRACE_ID_KEY, traceId);
        response.setHeader(TRACE_ID_HEADER, traceId);

        long start = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long tookMs = (System.nanoTime() - start) / 1_000_000;
            log.info("{} {} -> {} ({} ms)", request.getMethod(), request.getRequestURI(), response.getStatus(), tookMs);
            // Thread-Pool: Kontext nicht in die nächste Anfrage tragen
            MDC.remove(TRACE_ID_KEY);
        }
    }

    static String resolveTraceId(String incoming) {
        if (incoming != null) {
            String trimmed = incoming.trim();
            if (ACCEPTED_TRACE_ID.matcher(trimmed).matches()) {
                return trimmed;
            }
        }
        return UUID.randomUUID().toString();
    }
}
