package com.chefai.backend.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlation id of one meal-plan request.
 * <p>
 * Accepted from {@code X-Request-Id} when it looks like an id, otherwise minted here. The id is
 * echoed on the response, kept as a request attribute for error bodies, and put into the MDC as
 * {@code rid}; {@link RequestContextTaskDecorator} carries it onto the generation, persistence
 * and image worker threads so one plan's log lines share it.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_KEY = "rid";

    /** gateway 給的 id 只收安全字元，其他一律換掉（避免 log injection / 灌爆） */
    private static final Pattern ACCEPTED = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = acceptOrMint(req.getHeader(HEADER));

        req.setAttribute(ATTR, rid);
        res.setHeader(HEADER, rid);
        MDC.put(MDC_KEY, rid);
        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    static String acceptOrMint(String incoming) {
        if (incoming != null) {
            String s = incoming.trim();
            if (ACCEPTED.matcher(s).matches()) return s;
        }
        return mint();
    }

    /** 32 hex，沒有 dash，log 裡比較好搜 */
    static String mint() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Id for an error body: the request's own id, else the one on the current thread, else a new one.
     */
    public static String current(HttpServletRequest req) {
        Object v = (req == null) ? null : req.getAttribute(ATTR);
        if (v != null) return String.valueOf(v);
        String fromMdc = MDC.get(MDC_KEY);
        return (fromMdc != null) ? fromMdc : mint();
    }
}
