package com.chefai.backend.mealplan.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Dev / test generator: no network, deterministic drafts that never reuse an excluded name.
 */
public class StubRecipeGenerator implements RecipeGenerator {

    private static final String PROVIDER = "STUB";

    private final ObjectMapper om;
    private final AtomicInteger seq = new AtomicInteger();

    public StubRecipeGenerator(ObjectMapper om) {
        this.om = om;
    }

    @Override
    public String providerCode() { return PROVIDER; }

    @Override
    public GeneratorResult generate(RecipeGenerationRequest req) {
        Set<String> excluded = req.excludeNames().stream()
                .map(n -> n.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        String cuisine = req.cuisinePriority().isEmpty() ? null : req.cuisinePriority().get(0);
        String base = (cuisine == null ? "House" : cuisine) + " " + capitalize(req.mealSlot().wireName()) + " Bowl";

        String name;
        do {
            name = base + " #" + seq.incrementAndGet();
        } while (excluded.contains(name.toLowerCase(Locale.ROOT)));

        ObjectNode draft = om.createObjectNode();
        draft.put("name", name);
        draft.put("description", "Stub recipe for " + req.mealSlot().wireName());
        if (cuisine != null) draft.put("cuisine", cuisine);
        draft.put("prep_time", 10);
        draft.put("cook_time", 20);
        draft.put("servings", 2);
        ObjectNode ing = draft.putArray("ingredients").addObject();
        ing.put("name", "rice");
        ing.put("amount", 1);
        ing.put("unit", "cup");
        draft.putArray("instructions").add("Cook the rice.").add("Serve.");
        draft.putArray("tags").add(req.mealSlot().wireName());
        ObjectNode nutrition = draft.putObject("nutrition");
        nutrition.put("calories", 450);
        nutrition.put("protein", 18);
        nutrition.put("carbs", 60);
        nutrition.put("fat", 12);
        draft.put("complexity", 1);
        return new GeneratorResult(draft, PROVIDER);
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
