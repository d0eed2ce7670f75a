package com.flagship.mpesa_bridge.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Bearer API key for the client-facing and admin endpoints.
 *
 * Daraja-facing endpoints (STK callback, C2B validation and confirmation), the
 * status lookup and the health checks stay open. With no key configured every
 * protected request is refused.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@Slf4j
public class ApiKeyFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final AntPathMatcher PATH_MATCHER = new AntPathMatcher();
    private static final UrlPathHelper PATH_HELPER = new UrlPathHelper();

    static {
        PATH_HELPER.setRemoveSemicolonContent(true);
        PATH_HELPER.setUrlDecode(true);
    }

    static final List<String> PROTECTED_GET_PATHS = List.of(
            "/api/payments/history",
            "/api/payments/*/upstream-status");
    static final List<String> PROTECTED_POST_PATHS = List.of(
            "/api/payments/initiate",
            "/api/payments/register-c2b");

    private final byte[] expectedApiKey;

    public ApiKeyFilter(@Value("${security.api-key:}") String expectedApiKey) {
        if (expectedApiKey == null || expectedApiKey.isBlank()) {
            log.warn("security.api-key is not set: protected endpoints will refuse every request");
            this.expectedApiKey = null;
        } else {
            this.expectedApiKey = expectedApiKey.getBytes(StandardCharsets.UTF_8);
        }
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        if (isAuthorized(request.getHeader(HttpHeaders.AUTHORIZATION))) {
            filterChain.doFilter(request, response);
            return;
        }

        log.warn("Unauthorized {} {}", request.getMethod(), request.getRequestURI());
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"status\":\"error\",\"error\":\"UNAUTHORIZED\",\"message\":\"Invalid API key\"}");
    }

    /**
     * Matches on the path as handler mapping sees it: decoded, without matrix
     * parameters and with duplicate slashes collapsed.
     */
    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String method = request.getMethod();
        return !isProtected(method, PATH_HELPER.getPathWithinApplication(request))
                && !isProtected(method, request.getRequestURI());
    }

    static boolean isProtected(String method, String path) {
        boolean readOnly = HttpMethod.GET.matches(method) || HttpMethod.HEAD.matches(method);
        List<String> patterns = readOnly ? PROTECTED_GET_PATHS
                : HttpMethod.POST.matches(method) ? PROTECTED_POST_PATHS
                : List.of();
        return patterns.stream().anyMatch(pattern -> PATH_MATCHER.match(pattern, path));
    }

    private boolean isAuthorized(String authorization) {
        if (expectedApiKey == null || authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            return false;
        }
        byte[] presented = authorization.substring(BEARER_PREFIX.length()).trim().getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expectedApiKey, presented);
    }
}
