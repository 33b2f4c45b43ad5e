package com.shlawgathon.faceguard.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Authenticates service-to-service calls on /internal/** with the
 * X-Faceguard-Api-Key header.
 */
@Component
public class InternalApiKeyAuthFilter extends OncePerRequestFilter {

    static final String API_KEY_HEADER = "X-Faceguard-Api-Key";

    private final String internalApiKey;

    public InternalApiKeyAuthFilter(@Value("${faceguard.internal.api-key:}") String internalApiKey) {
        this.internalApiKey = internalApiKey;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (!request.getRequestURI().startsWith("/internal/")) {
            filterChain.doFilter(request, response);
            return;
        }

        // No key configured: development mode
        if (internalApiKey == null || internalApiKey.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }

        String providedKey = request.getHeader(API_KEY_HEADER);

        if (providedKey == null || providedKey.isBlank()) {
            reject(response, "Missing " + API_KEY_HEADER + " header");
            return;
        }

        if (!internalApiKey.equals(providedKey)) {
            reject(response, "Invalid API key");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private static void reject(HttpServletResponse response, String message) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json");
        response.getWriter().write("{\"error_kind\":\"unauthorized\",\"message\":\"" + message + "\"}");
    }
}
