package com.chefai.backend.mealplan.model;

import java.util.List;

/**
 * 已通過 ResultValidator 的 recipe（尚未存檔）。
 * provider 回來的原始 JSON 不可信，只有經過 validate 的才會變成 RecipeDraft。
 */
public record RecipeDraft(
        String name,
        String description,
        int prepTime,
        int cookTime,
        int servings,
        List<Ingredient> ingredients,
        List<String> instructions,
        List<String> tags,
        Nutrition nutrition,
        int complexity,
        String cuisine,
        String imageUrl
) {
    public RecipeDraft {
        ingredients = ingredients == null ? List.of() : List.copyOf(ingredients);
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
        tags = tags == null ? List.of() : List.copyOf(tags);
        nutrition = nutrition == null ? Nutrition.ZERO : nutrition;
    }

    public record Ingredient(String name, double amount, String unit) {}

    public record Nutrition(double calories, double protein, double carbs, double fat) {
        public static final Nutrition ZERO = new Nutrition(0, 0, 0, 0);
    }
}
