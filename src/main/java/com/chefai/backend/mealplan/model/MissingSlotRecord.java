package com.chefai.backend.mealplan.model;

public record MissingSlotRecord(int day, MealSlot mealSlot, MissingSlotReason reason) {

    public static MissingSlotRecord of(GenerationTask task, MissingSlotReason reason) {
        return new MissingSlotRecord(task.day(), task.mealSlot(), reason);
    }
}
