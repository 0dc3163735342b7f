package com.chefai.backend.mealplan.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class GeneratorTelemetry {

    public void ok(String provider, String model, String taskId, long latencyMs, int attempts,
                   Integer promptTok, Integer completionTok) {
        log.info("generator_call status=OK provider={} model={} taskId={} latencyMs={} attempts={} tokensPrompt={} tokensCompletion={}",
                safe(provider), safe(model), safe(taskId), latencyMs, attempts, n(promptTok), n(completionTok));
    }

    public void fail(String provider, String model, String taskId, long latencyMs, int attempts,
                     String errorCode, Integer retryAfterSec) {
        log.warn("generator_call status=FAIL provider={} model={} taskId={} latencyMs={} attempts={} errorCode={} retryAfterSec={}",
                safe(provider), safe(model), safe(taskId), latencyMs, attempts, safe(errorCode), n(retryAfterSec));
    }

    private static String safe(String s) { return (s == null || s.isBlank()) ? "UNKNOWN" : s; }
    private static Object n(Integer v) { return v == null ? "NA" : v; }
}
