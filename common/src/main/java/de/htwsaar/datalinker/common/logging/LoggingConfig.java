package de.htwsaar.datalinker.common.logging;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Konfiguration für Logging und Tracing.
 */
@Configuration
public class LoggingConfig {

    /** Läuft vor allen anderen Filtern, damit auch deren Logzeilen die Trace-ID tragen. */
    public static final int TRACE_FILTER_ORDER = Ordered.HIGHEST_PRECEDENCE;

    @Bean
    public TraceIdFilter traceIdFilter() {
        return new TraceIdFilter();
    }

    @Bean
    public FilterRegistrationBean<TraceIdFilter> traceIdFilterRegistration(TraceIdFilter traceIdFilter) {
        FilterRegistrationBean<TraceIdFilter> registration = new FilterRegistrationBean<>(traceIdFilter);
        registration.setOrder(TRACE_FILTER_ORDER);
        registration.addUrlPatterns("/*");
        return registration;
    }
}
