package com.chefai.backend.auth.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;

/**
 * The upstream gateway has already authenticated the caller and forwards the user id in
 * {@code X-User-Id}. This filter only turns it into the security principal.
 */
@Component
public class GatewayUserFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-User-Id";

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String p = request.getRequestURI();
        return p.startsWith("/actuator") || p.startsWith("/swagger-ui") || p.startsWith("/v3/api-docs");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String raw = req.getHeader(HEADER);
        if (raw == null || raw.isBlank()) {
            chain.doFilter(req, res); // 匿名，交給 EntryPoint 回 401
            return;
        }

        Long uid = parseUserId(raw);
        if (uid == null) {
            unauthorized(res);
            return;
        }

        // principal 只放 userId（Long）
        var authentication = new UsernamePasswordAuthenticationToken(uid, null, Collections.emptyList());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(req));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        req.setAttribute("userId", uid);

        chain.doFilter(req, res);
    }

    static Long parseUserId(String raw) {
        try {
            long v = Long.parseLong(raw.trim());
            return v > 0 ? v : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static void unauthorized(HttpServletResponse res) throws IOException {
        res.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        res.setContentType("application/json");
        res.getWriter().write("{\"errorCode\":\"UNAUTHENTICATED\",\"message\":\"Invalid X-User-Id\"}");
    }
}
