package com.chefai.backend.common.web;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RequestContextTaskDecoratorTest {

    private final RequestContextTaskDecorator decorator = new RequestContextTaskDecorator();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void worker_thread_sees_the_submitters_request_id() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            MDC.put(RequestIdFilter.MDC_KEY, "rid-1");
            AtomicReference<String> seen = new AtomicReference<>();
            AtomicReference<String> after = new AtomicReference<>("unset");

            pool.submit(decorator.decorate(() -> seen.set(MDC.get(RequestIdFilter.MDC_KEY)))).get(5, TimeUnit.SECONDS);
            pool.submit(() -> after.set(MDC.get(RequestIdFilter.MDC_KEY))).get(5, TimeUnit.SECONDS);

            assertThat(seen.get()).isEqualTo("rid-1");
            assertThat(after.get()).isNull();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void caller_runs_keeps_the_callers_own_context() {
        MDC.put(RequestIdFilter.MDC_KEY, "submitted");
        Runnable task = decorator.decorate(() -> assertThat(MDC.get(RequestIdFilter.MDC_KEY)).isEqualTo("submitted"));

        MDC.put(RequestIdFilter.MDC_KEY, "caller");
        task.run();

        assertThat(MDC.get(RequestIdFilter.MDC_KEY)).isEqualTo("caller");
    }
}
