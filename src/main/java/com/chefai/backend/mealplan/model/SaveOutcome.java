package com.chefai.backend.mealplan.model;

import com.chefai.backend.mealplan.entity.RecipeEntity;

public record SaveOutcome(GenerationTask task, RecipeEntity recipe, String errorCode) {

    public static SaveOutcome saved(GenerationTask task, RecipeEntity recipe) {
        return new SaveOutcome(task, recipe, null);
    }

    public static SaveOutcome failed(GenerationTask task, String errorCode) {
        return new SaveOutcome(task, null, errorCode);
    }

    public boolean saved() {
        return recipe != null;
    }
}
