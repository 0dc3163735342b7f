package com.chefai.backend.common.web;

import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

import java.util.Map;

/**
 * Copies the submitting thread's MDC (request id) onto the worker for the duration of the task.
 * <p>
 * The worker's previous MDC is restored afterwards, not cleared: with caller-runs rejection the
 * "worker" is the request thread itself.
 */
public class RequestContextTaskDecorator implements TaskDecorator {

    @Override
    public Runnable decorate(Runnable task) {
        Map<String, String> submitted = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            apply(submitted);
            try {
                task.run();
            } finally {
                apply(previous);
            }
        };
    }

    private static void apply(Map<String, String> ctx) {
        if (ctx == null || ctx.isEmpty()) MDC.clear();
        else MDC.setContextMap(ctx);
    }
}
