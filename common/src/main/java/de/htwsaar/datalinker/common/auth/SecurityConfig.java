package de.htwsaar.datalinker.common.auth;

import de.htwsaar.datalinker.common.logging.LoggingConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Schützt die Admin-Routen per Token. Läuft direkt nach dem Trace-Filter.
 */
@Configuration
public class SecurityConfig {

    @Bean
    public AdminAuthFilter adminAuthFilter(@Value("${datalinker.admin.token:secret-token}") String adminToken) {
        return new AdminAuthFilter(adminToken);
    }

    @Bean
    public FilterRegistrationBean<AdminAuthFilter> adminAuthFilterRegistration(AdminAuthFilter adminAuthFilter) {
        FilterRegistrationBean<AdminAuthFilter> registration = new FilterRegistrationBean<>(adminAuthFilter);
        registration.setOrder(LoggingConfig.TRACE_FILTER_ORDER + 1);
        registration.addUrlPatterns("/*");
        return registration;
    }
}
