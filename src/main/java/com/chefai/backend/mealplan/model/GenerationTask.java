package com.chefai.backend.mealplan.model;

import java.util.List;

/**
 * One (day, meal slot) unit of generation. day is 1-based.
 */
public record GenerationTask(
        String taskId,
        int day,
        MealSlot mealSlot,
        List<String> cuisinePriority
) {
    public GenerationTask {
        cuisinePriority = cuisinePriority == null ? List.of() : List.copyOf(cuisinePriority);
    }
}
