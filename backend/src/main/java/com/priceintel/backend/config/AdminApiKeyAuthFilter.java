package com.priceintel.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Authenticates admin and scheduler requests using the X-Admin-Api-Key header.
 * Only applies to /api/admin/** endpoints.
 */
@Component
public class AdminApiKeyAuthFilter extends OncePerRequestFilter {

    public static final String ADMIN_API_KEY_HEADER = "X-Admin-Api-Key";

    @Value("${admin.api.key:}")
    private String adminApiKey;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestPath = request.getRequestURI();

        if (!requestPath.startsWith("/api/admin/")) {
            filterChain.doFilter(request, response);
            return;
        }

        // Credit grants move money-equivalent state, so no key means the admin API is off
        if (adminApiKey == null || adminApiKey.isBlank()) {
            reject(response, HttpServletResponse.SC_FORBIDDEN, "Admin API is disabled");
            return;
        }

        String providedKey = request.getHeader(ADMIN_API_KEY_HEADER);

        if (providedKey == null || providedKey.isBlank()) {
            reject(response, HttpServletResponse.SC_UNAUTHORIZED, "Missing X-Admin-Api-Key header");
            return;
        }

        if (!adminApiKey.equals(providedKey)) {
            reject(response, HttpServletResponse.SC_UNAUTHORIZED, "Invalid API key");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, int status, String error) throws IOException {
        response.setStatus(status);
        response.setContentType("application/json");
        response.getWriter().write("{\"error\":\"" + error + "\"}");
    }
}
