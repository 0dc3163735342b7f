package com.chefai.backend.testsupport;

import com.chefai.backend.mealplan.entity.RecipeEntity;
import com.chefai.backend.mealplan.model.MealSlot;
import com.chefai.backend.mealplan.model.RecipeDraft;

import java.time.Instant;
import java.util.List;

public final class RecipeFixtures {

    private RecipeFixtures() {}

    public static RecipeDraft draft(String name) {
        return new RecipeDraft(
                name, "desc", 10, 20, 2,
                List.of(new RecipeDraft.Ingredient("rice", 1, "cup")),
                List.of("Cook."),
                List.of("dinner"),
                new RecipeDraft.Nutrition(400, 20, 50, 10),
                1, null, null
        );
    }

    public static RecipeEntity recipe(Long userId, String name, String cuisine) {
        RecipeEntity e = new RecipeEntity();
        e.setUserId(userId);
        e.setName(name);
        e.setCuisine(cuisine);
        e.setServings(2);
        e.setComplexity(1);
        return e;
    }

    public static RecipeEntity active(Long userId, String id, String planId, int day, MealSlot slot, Instant expiresAt) {
        RecipeEntity e = recipe(userId, "Recipe " + id, null);
        e.setId(id);
        e.setPlanId(planId);
        e.setPlanDay(day);
        e.setMealSlot(slot);
        e.setCreatedAtUtc(expiresAt.minusSeconds(3600));
        e.setExpiresAtUtc(expiresAt);
        return e;
    }
}
