package com.chefai.backend.mealplan.model;

import java.util.List;

/**
 * 正規化後的偏好設定：四個欄位永遠是 list（不會是 null），也不會有空字串。
 */
public record Preferences(
        List<String> dietary,
        List<String> allergies,
        List<String> cuisines,
        List<String> meatTypes
) {
    public Preferences {
        dietary = dietary == null ? List.of() : List.copyOf(dietary);
        allergies = allergies == null ? List.of() : List.copyOf(allergies);
        cuisines = cuisines == null ? List.of() : List.copyOf(cuisines);
        meatTypes = meatTypes == null ? List.of() : List.copyOf(meatTypes);
    }

    public static Preferences empty() {
        return new Preferences(List.of(), List.of(), List.of(), List.of());
    }
}
