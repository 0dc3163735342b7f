package com.chefai.backend.mealplan.dto;

import com.chefai.backend.mealplan.model.MissingSlotRecord;
import com.chefai.backend.mealplan.model.PlanStatus;

import java.util.List;

public record PlanResult(
        String planId,
        List<RecipeView> recipes,
        PlanStatus status,
        List<MissingSlotRecord> missingSlots
) {
    public PlanResult {
        recipes = (recipes == null) ? List.of() : List.copyOf(recipes);
        missingSlots = (missingSlots == null) ? List.of() : List.copyOf(missingSlots);
    }
}
