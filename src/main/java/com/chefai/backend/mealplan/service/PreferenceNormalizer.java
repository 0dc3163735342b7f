package com.chefai.backend.mealplan.service;

import com.chefai.backend.mealplan.model.Preferences;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Coerces a loosely typed preference payload into {@link Preferences}.
 * Never fails: anything that is not an array becomes an empty list, falsy elements are dropped.
 */
@Component
public class PreferenceNormalizer {

    public Preferences normalize(JsonNode payload) {
        if (payload == null || !payload.isObject()) return Preferences.empty();

        JsonNode cuisines = payload.get("cuisines");
        // 舊版 client 送的是 "cuisine"
        if (cuisines == null || cuisines.isNull()) cuisines = payload.get("cuisine");

        return new Preferences(
                toList(payload.get("dietary")),
                toList(payload.get("allergies")),
                toList(cuisines),
                toList(payload.get("meatTypes"))
        );
    }

    private static List<String> toList(JsonNode node) {
        if (node == null || !node.isArray()) return List.of();
        List<String> out = new ArrayList<>();
        for (JsonNode el : node) {
            String v = truthyTextOrNull(el);
            if (v != null) out.add(v);
        }
        return out;
    }

    private static String truthyTextOrNull(JsonNode el) {
        if (el == null || el.isNull() || el.isMissingNode()) return null;
        if (el.isBoolean()) return el.booleanValue() ? "true" : null;
        if (el.isNumber()) {
            if (el.asDouble() == 0d || Double.isNaN(el.asDouble())) return null;
            return el.asText();
        }
        if (el.isTextual()) {
            String s = el.textValue().trim();
            return s.isEmpty() ? null : s;
        }
        // object / array 不是合法偏好值
        return null;
    }
}
