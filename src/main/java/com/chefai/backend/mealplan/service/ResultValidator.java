package com.chefai.backend.mealplan.service;

import com.chefai.backend.mealplan.model.RecipeDraft;
import com.chefai.backend.mealplan.web.RecipeValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Permissive "coerce or drop" gate between the generator and persistence.
 * The only rejection is a missing / blank / non-text name; everything else is clamped or defaulted.
 */
@Component
public class ResultValidator {

    static final String DEFAULT_DESCRIPTION = "No description available";
    static final int DEFAULT_SERVINGS = 2;
    static final int MIN_COMPLEXITY = 1;
    static final int MAX_COMPLEXITY = 3;

    public RecipeDraft validate(JsonNode raw) {
        return validate(raw, List.of());
    }

    /**
     * @param requestedCuisines used to infer the cuisine from tags when the draft does not name one
     */
    public RecipeDraft validate(JsonNode raw, List<String> requestedCuisines) {
        if (raw == null || !raw.isObject()) throw new RecipeValidationException("DRAFT_NOT_OBJECT");

        JsonNode nameNode = raw.get("name");
        if (nameNode == null || !nameNode.isTextual() || nameNode.textValue().isBlank()) {
            throw new RecipeValidationException("DRAFT_NAME_MISSING");
        }
        String name = nameNode.textValue().trim();

        String description = text(raw, "description");
        if (description == null) description = DEFAULT_DESCRIPTION;

        int prep = Math.max(0, intOr(field(raw, "prep_time", "prepTime"), 0));
        int cook = Math.max(0, intOr(field(raw, "cook_time", "cookTime"), 0));
        int servings = Math.max(1, intOr(raw.get("servings"), DEFAULT_SERVINGS));
        int complexity = clamp(intOr(raw.get("complexity"), MIN_COMPLEXITY), MIN_COMPLEXITY, MAX_COMPLEXITY);

        List<String> tags = stringList(raw.get("tags"));
        String cuisine = text(raw, "cuisine");
        if (cuisine == null) cuisine = inferCuisine(tags, requestedCuisines);

        String imageUrl = textOf(field(raw, "image_url", "imageUrl"));

        return new RecipeDraft(
                name,
                description,
                prep,
                cook,
                servings,
                ingredients(raw.get("ingredients")),
                stringList(raw.get("instructions")),
                tags,
                nutrition(raw.get("nutrition")),
                complexity,
                cuisine,
                imageUrl
        );
    }

    private static List<RecipeDraft.Ingredient> ingredients(JsonNode node) {
        if (node == null || !node.isArray()) return List.of();
        List<RecipeDraft.Ingredient> out = new ArrayList<>();
        for (JsonNode el : node) {
            if (el == null || !el.isObject()) continue;
            String n = textOf(el.get("name"));
            if (n == null) continue;
            double amount = Math.max(0d, doubleOr(el.get("amount"), 0d));
            String unit = textOf(el.get("unit"));
            out.add(new RecipeDraft.Ingredient(n, amount, unit == null ? "" : unit));
        }
        return out;
    }

    private static RecipeDraft.Nutrition nutrition(JsonNode node) {
        if (node == null || !node.isObject()) return RecipeDraft.Nutrition.ZERO;
        return new RecipeDraft.Nutrition(
                Math.max(0d, doubleOr(node.get("calories"), 0d)),
                Math.max(0d, doubleOr(node.get("protein"), 0d)),
                Math.max(0d, doubleOr(node.get("carbs"), 0d)),
                Math.max(0d, doubleOr(node.get("fat"), 0d))
        );
    }

    private static List<String> stringList(JsonNode node) {
        if (node == null || !node.isArray()) return List.of();
        List<String> out = new ArrayList<>();
        for (JsonNode el : node) {
            String s = textOf(el);
            if (s != null) out.add(s);
        }
        return out;
    }

    private static String inferCuisine(List<String> tags, List<String> requested) {
        if (requested == null || requested.isEmpty() || tags.isEmpty()) return null;
        for (String c : requested) {
            String k = c.trim().toLowerCase(Locale.ROOT);
            for (String t : tags) {
                if (t.trim().toLowerCase(Locale.ROOT).equals(k)) return c;
            }
        }
        return null;
    }

    private static JsonNode field(JsonNode raw, String snake, String camel) {
        JsonNode n = raw.get(snake);
        return (n == null || n.isNull()) ? raw.get(camel) : n;
    }

    private static String text(JsonNode raw, String key) {
        return textOf(raw.get(key));
    }

    private static String textOf(JsonNode n) {
        if (n == null || n.isNull() || !n.isValueNode()) return null;
        String s = n.asText().trim();
        return s.isEmpty() ? null : s;
    }

    private static int intOr(JsonNode n, int fallback) {
        double d = doubleOr(n, Double.NaN);
        if (Double.isNaN(d) || d == 0d) return fallback;
        // 先夾住再轉型，避免 3e9 之類的值溢位成負數
        long r = Math.round(d);
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, r));
    }

    private static double doubleOr(JsonNode n, double fallback) {
        if (n == null || n.isNull()) return fallback;
        if (n.isNumber()) return n.asDouble();
        if (n.isTextual()) {
            try {
                double d = Double.parseDouble(n.textValue().trim());
                return Double.isFinite(d) ? d : fallback;
            } catch (NumberFormatException ignored) {
                return fallback;
            }
        }
        return fallback;
    }

    private static int clamp(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
