package com.chefai.backend.mealplan.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * External recipe generation service. Any thrown exception means the task failed;
 * the orchestrator does not distinguish "unavailable" from "could not satisfy constraints".
 */
public interface RecipeGenerator {

    String providerCode();

    GeneratorResult generate(RecipeGenerationRequest request) throws Exception;

    /** draft 是 provider 原始 JSON（未驗證），交給 ResultValidator 處理 */
    record GeneratorResult(JsonNode draft, String provider) {}
}
