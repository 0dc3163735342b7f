package com.chefai.backend.mealplan.mapper;

import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

public final class GeneratorErrorMapper {

    private GeneratorErrorMapper() {}

    public record Mapped(String code, String message, Integer retryAfterSec) {}

    private static final int MIN_429_RETRY_SEC = 1;
    private static final int MAX_RETRY_SEC = 60;

    public static Mapped map(Throwable e) {
        if (e == null) return new Mapped("GENERATOR_FAILED", null, null);

        if (isTimeoutThrowable(e)) {
            return new Mapped("GENERATOR_TIMEOUT", safeMsg(e), null);
        }

        // 自己丟的 IllegalStateException("GENERATOR_xxx") 直接沿用 code
        if (e instanceof IllegalStateException ise) {
            String m = ise.getMessage();
            if (m != null && m.startsWith("GENERATOR_")) {
                return new Mapped(m, safeMsg(ise), null);
            }
        }

        if (e instanceof RestClientResponseException re) {
            int status = re.getStatusCode().value();
            Integer retryAfter = parseRetryAfterHeaderSecondsOrNull(re.getResponseHeaders());

            if (status == 401 || status == 403) return new Mapped("GENERATOR_AUTH_FAILED", "auth failed", null);

            if (status == 429) {
                int sec = retryAfter == null ? MIN_429_RETRY_SEC : Math.max(MIN_429_RETRY_SEC, retryAfter);
                return new Mapped("GENERATOR_RATE_LIMITED", "rate limited", Math.min(sec, MAX_RETRY_SEC));
            }

            if (status == 408) return new Mapped("GENERATOR_TIMEOUT", "timeout", retryAfter);

            if (re.getStatusCode().is5xxServerError()) {
                return new Mapped("GENERATOR_UPSTREAM_5XX", "upstream 5xx",
                        retryAfter == null ? null : Math.min(retryAfter, MAX_RETRY_SEC));
            }

            if (re.getStatusCode().is4xxClientError()) {
                return new Mapped("GENERATOR_BAD_REQUEST", "bad request", null);
            }

            return new Mapped("GENERATOR_FAILED", "http error", retryAfter);
        }

        if (e instanceof ResourceAccessException rae) {
            return new Mapped("GENERATOR_NETWORK_ERROR", safeMsg(rae), null);
        }

        if (e instanceof RestClientException rce) {
            return new Mapped("GENERATOR_BAD_RESPONSE", safeMsg(rce), null);
        }

        return new Mapped("GENERATOR_FAILED", safeMsg(e), null);
    }

    /**
     * 重試也不會好的錯誤（設定 / 授權 / request 格式）
     */
    public static boolean isNonRetryable(String code) {
        if (code == null || code.isBlank()) return false;
        return switch (code) {
            case "GENERATOR_NOT_CONFIGURED",
                 "GENERATOR_AUTH_FAILED",
                 "GENERATOR_BAD_REQUEST" -> true;
            default -> false;
        };
    }

    private static boolean isTimeoutThrowable(Throwable e) {
        Throwable cur = e;
        for (int i = 0; i < 6 && cur != null; i++) {
            if (cur instanceof SocketTimeoutException || cur instanceof TimeoutException) return true;
            cur = cur.getCause();
        }
        return false;
    }

    private static Integer parseRetryAfterHeaderSecondsOrNull(HttpHeaders headers) {
        if (headers == null) return null;
        String v = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (v == null || v.isBlank()) return null;
        try {
            return Math.max(0, Integer.parseInt(v.trim()));
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    private static String safeMsg(Throwable e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) return e.getClass().getSimpleName();
        return m.length() > 200 ? m.substring(0, 200) : m;
    }
}
