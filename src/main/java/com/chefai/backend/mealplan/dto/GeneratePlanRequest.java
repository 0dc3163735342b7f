package com.chefai.backend.mealplan.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;

/**
 * preferences 保持原始 JSON，交給 PreferenceNormalizer 處理（容忍 null / 空字串 / 奇怪型別）
 */
public record GeneratePlanRequest(
        JsonNode preferences,
        @NotNull Integer days
) {}
