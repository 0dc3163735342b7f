package com.chefai.backend.mealplan.service;

import com.chefai.backend.mealplan.entity.RecipeEntity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Orders the requested cuisines least-used first, based on the user's recipe history.
 * <p>
 * Computed once per run from a history snapshot; it is not updated as tasks of the same run
 * complete, so later tasks see the same order as earlier ones.
 */
@Component
public class CuisineBalancer {

    public List<String> rank(List<String> cuisines, List<RecipeEntity> history) {
        if (cuisines == null || cuisines.isEmpty()) return List.of();

        Map<String, Integer> usage = new HashMap<>();
        for (String c : cuisines) usage.putIfAbsent(key(c), 0);

        if (history != null) {
            for (RecipeEntity r : history) {
                if (r == null || r.getCuisine() == null) continue;
                usage.computeIfPresent(key(r.getCuisine()), (k, n) -> n + 1);
            }
        }

        // List.sort 是 stable：同分維持原本順序
        List<String> ranked = new ArrayList<>(cuisines);
        ranked.sort(Comparator.comparingInt(c -> usage.getOrDefault(key(c), 0)));
        return List.copyOf(ranked);
    }

    private static String key(String cuisine) {
        return cuisine.trim().toLowerCase(Locale.ROOT);
    }
}
