package com.chefai.backend.mealplan.dto;

import com.chefai.backend.mealplan.model.MissingSlotRecord;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MealPlanErrorResponse(
        String errorCode,
        String message,
        String requestId,
        String reason,
        List<MissingSlotRecord> missingSlots
) {
    public MealPlanErrorResponse(String errorCode, String message, String requestId) {
        this(errorCode, message, requestId, null, null);
    }
}
