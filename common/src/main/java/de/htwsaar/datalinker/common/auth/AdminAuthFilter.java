package de.htwsaar.datalinker.common.auth;

import de.htwsaar.datalinker.common.util.DigestUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Filter that protects the administrative routes (cache refresh etc.) by validating a shared admin token.
 *
 * <p>Only paths containing {@code /admin/} are checked; DataLink and HiPS read routes stay open.</p>
 */
public class AdminAuthFilter extends OncePerRequestFilter {

    /** Name of the HTTP header expected to carry the admin token. */
    public static final String AUTH_HEADER = "X-Admin-Token";

    private final String expectedToken;

    /**
     * Creates a new admin authentication filter.
     *
     * @param expectedToken the token that must match the value provided in the admin header
     */
    public AdminAuthFilter(String expectedToken) {
        this.expectedToken = expectedToken;
    }

    /**
     * Responds with 401 if the token is missing and with 403 if it does not match.
     */
    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (request.getRequestURI().contains("/admin/")) {
            String providedToken = request.getHeader(AUTH_HEADER);

            if (providedToken == null || providedToken.isBlank()) {
                response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Missing Admin Token");
                return;
            }

            if (!DigestUtil.constantTimeEquals(expectedToken, providedToken)) {
                response.sendError(HttpServletResponse.SC_FORBIDDEN, "Invalid Admin Token");
                return;
            }
        }

        filterChain.doFilter(request, response);
    }
}
