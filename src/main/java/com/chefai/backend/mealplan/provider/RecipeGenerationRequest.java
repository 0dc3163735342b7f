package com.chefai.backend.mealplan.provider;

import com.chefai.backend.mealplan.model.MealSlot;

import java.util.List;

public record RecipeGenerationRequest(
        String taskId,
        List<String> dietary,
        List<String> allergies,
        List<String> cuisinePriority,
        List<String> meatTypes,
        MealSlot mealSlot,
        List<String> excludeNames,
        int maxRetries
) {
    public RecipeGenerationRequest {
        dietary = dietary == null ? List.of() : List.copyOf(dietary);
        allergies = allergies == null ? List.of() : List.copyOf(allergies);
        cuisinePriority = cuisinePriority == null ? List.of() : List.copyOf(cuisinePriority);
        meatTypes = meatTypes == null ? List.of() : List.copyOf(meatTypes);
        excludeNames = excludeNames == null ? List.of() : List.copyOf(excludeNames);
        maxRetries = Math.max(0, maxRetries);
    }
}
