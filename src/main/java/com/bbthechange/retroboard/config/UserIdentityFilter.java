package com.bbthechange.retroboard.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Duration;
import java.util.UUID;

/**
 * Resolves the anonymous session of every API request.
 *
 * Reads the session cookie, issuing a fresh one when it is missing or malformed, and stores
 * the hashed identity as request attributes for the controllers. The hash prefix goes into
 * the MDC so log lines can be correlated per user without exposing the session id.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class UserIdentityFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(UserIdentityFilter.class);

    private static final String MDC_USER = "user";
    private static final int MAX_SESSION_ID_LENGTH = 128;

    private final CardEngineProperties properties;

    @Autowired
    public UserIdentityFilter(CardEngineProperties properties) {
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/v1/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String sessionId = readSessionCookie(request);
        if (sessionId == null) {
            sessionId = UUID.randomUUID().toString();
            response.addHeader(HttpHeaders.SET_COOKIE, sessionCookie(sessionId).toString());
            logger.debug("Issued new session cookie for {}", request.getRequestURI());
        }

        UserIdentity identity = UserIdentity.fromSession(sessionId, request.getHeader(UserIdentity.ALIAS_HEADER));
        identity.applyTo(request);

        try {
            MDC.put(MDC_USER, identity.toLogString());
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_USER);
        }
    }

    private String readSessionCookie(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (properties.getSessionCookieName().equals(cookie.getName())) {
                String value = cookie.getValue();
                if (value == null || value.isBlank() || value.length() > MAX_SESSION_ID_LENGTH) {
                    return null;
                }
                return value;
            }
        }
        return null;
    }

    private ResponseCookie sessionCookie(String sessionId) {
        return ResponseCookie.from(properties.getSessionCookieName(), sessionId)
            .httpOnly(true)
            .path("/")
            .sameSite("Lax")
            .maxAge(Duration.ofDays(365))
            .build();
    }
}
