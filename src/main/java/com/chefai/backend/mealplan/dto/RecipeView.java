package com.chefai.backend.mealplan.dto;

import com.chefai.backend.mealplan.entity.RecipeEntity;
import com.chefai.backend.mealplan.model.MealSlot;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecipeView(
        String id,
        String planId,
        Integer day,
        MealSlot mealSlot,
        String name,
        String description,
        int prepTime,
        int cookTime,
        int servings,
        int complexity,
        String cuisine,
        JsonNode ingredients,
        JsonNode instructions,
        JsonNode tags,
        JsonNode nutrition,
        String imageUrl,
        boolean favorited,
        int favoritesCount,
        Instant createdAtUtc,
        Instant expiresAtUtc
) {
    public static RecipeView from(RecipeEntity e) {
        // ✅ 有永久圖就用永久圖
        String image = (e.getDurableImageUrl() != null) ? e.getDurableImageUrl() : e.getImageUrl();
        return new RecipeView(
                e.getId(),
                e.getPlanId(),
                e.getPlanDay(),
                e.getMealSlot(),
                e.getName(),
                e.getDescription(),
                e.getPrepTime(),
                e.getCookTime(),
                e.getServings(),
                e.getComplexity(),
                e.getCuisine(),
                e.getIngredients(),
                e.getInstructions(),
                e.getTags(),
                e.getNutrition(),
                image,
                e.isFavorited(),
                e.getFavoritesCount(),
                e.getCreatedAtUtc(),
                e.getExpiresAtUtc()
        );
    }
}
