package com.chefai.backend.mealplan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MealSlot {
    BREAKFAST,
    LUNCH,
    DINNER;

    /** API / prompt 都用小寫：breakfast / lunch / dinner */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MealSlot fromWire(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("MEAL_SLOT_INVALID");
        try {
            return MealSlot.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("MEAL_SLOT_INVALID");
        }
    }
}
