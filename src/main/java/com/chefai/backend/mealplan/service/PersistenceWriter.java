package com.chefai.backend.mealplan.service;

import com.chefai.backend.mealplan.entity.RecipeEntity;
import com.chefai.backend.mealplan.model.GenerationTask;
import com.chefai.backend.mealplan.model.RecipeDraft;
import com.chefai.backend.mealplan.model.SaveOutcome;
import com.chefai.backend.mealplan.model.TaskOutcome;
import com.chefai.backend.mealplan.repo.RecipeRepository;
import com.chefai.backend.mealplan.retention.RecipeRetentionProperties;
import com.chefai.backend.mealplan.task.ImageEnrichment;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Saves generated drafts concurrently, one independent insert per draft.
 * A failed insert only affects its own slot. Every saved recipe is handed to
 * {@link ImageEnrichment} without waiting for it.
 */
@Slf4j
@Service
public class PersistenceWriter {

    private final RecipeRepository repo;
    private final ImageEnrichment imageEnrichment;
    private final RecipeRetentionProperties retention;
    private final ObjectMapper om;
    private final Clock clock;
    private final Executor executor;

    public PersistenceWriter(RecipeRepository repo,
                             ImageEnrichment imageEnrichment,
                             RecipeRetentionProperties retention,
                             ObjectMapper om,
                             Clock clock,
                             @Qualifier("recipePersistenceExecutor") Executor executor) {
        this.repo = repo;
        this.imageEnrichment = imageEnrichment;
        this.retention = retention;
        this.om = om;
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * @param generated successful generation outcomes only
     */
    public List<SaveOutcome> saveAll(List<TaskOutcome> generated, Long ownerId, String planId) {
        if (generated == null || generated.isEmpty()) return List.of();

        List<CompletableFuture<SaveOutcome>> futures = new ArrayList<>(generated.size());
        for (TaskOutcome outcome : generated) {
            if (!outcome.succeeded()) continue;
            futures.add(submit(outcome.task(), outcome.draft(), ownerId, planId));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<SaveOutcome> saves = new ArrayList<>(futures.size());
        for (CompletableFuture<SaveOutcome> f : futures) saves.add(f.join());
        return saves;
    }

    /**
     * Synchronous single save (slot regeneration).
     */
    public SaveOutcome saveOne(GenerationTask task, RecipeDraft draft, Long ownerId, String planId) {
        try {
            RecipeEntity saved = repo.save(toEntity(task, draft, ownerId, planId));
            imageEnrichment.enrich(saved);
            return SaveOutcome.saved(task, saved);
        } catch (Exception e) {
            log.warn("recipe_save_failed taskId={} day={} slot={} err={}",
                    task.taskId(), task.day(), task.mealSlot().wireName(), e.toString());
            return SaveOutcome.failed(task, "PERSISTENCE_FAILED");
        }
    }

    /**
     * Deletes the rows of the saved outcomes and their stored images.
     * If the rows cannot be deleted they keep their normal expiry and retention removes them later.
     */
    public void rollback(List<SaveOutcome> saves) {
        List<String> ids = saves.stream()
                .filter(SaveOutcome::saved)
                .map(s -> s.recipe().getId())
                .filter(Objects::nonNull)
                .toList();
        if (ids.isEmpty()) return;
        try {
            repo.deleteAllById(ids);
        } catch (RuntimeException e) {
            log.error("recipe_rollback_failed ids={}", ids.size(), e);
            return;
        }
        ids.forEach(imageEnrichment::discard);
    }

    private CompletableFuture<SaveOutcome> submit(GenerationTask task, RecipeDraft draft, Long ownerId, String planId) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> saveOne(task, draft, ownerId, planId), executor)
                    .exceptionally(ex -> {
                        log.error("recipe_save_crashed taskId={}", task.taskId(), ex);
                        return SaveOutcome.failed(task, "PERSISTENCE_FAILED");
                    });
        } catch (RuntimeException rejected) {
            log.warn("recipe_save_rejected taskId={} err={}", task.taskId(), rejected.toString());
            return CompletableFuture.completedFuture(SaveOutcome.failed(task, "EXECUTOR_REJECTED"));
        }
    }

    RecipeEntity toEntity(GenerationTask task, RecipeDraft draft, Long ownerId, String planId) {
        Instant now = Instant.now(clock);

        RecipeEntity e = new RecipeEntity();
        e.setUserId(ownerId);
        e.setPlanId(planId);
        e.setPlanDay(task.day());
        e.setMealSlot(task.mealSlot());
        e.setName(draft.name());
        e.setDescription(draft.description());
        e.setPrepTime(draft.prepTime());
        e.setCookTime(draft.cookTime());
        e.setServings(draft.servings());
        e.setComplexity(draft.complexity());
        e.setCuisine(draft.cuisine());
        e.setIngredients(om.valueToTree(draft.ingredients()));
        e.setInstructions(om.valueToTree(draft.instructions()));
        e.setTags(om.valueToTree(draft.tags()));
        e.setNutrition(om.valueToTree(draft.nutrition()));
        e.setImageUrl(draft.imageUrl());
        e.setDurableImageUrl(null);
        e.setFavorited(false);
        e.setFavoritesCount(0);
        e.setCreatedAtUtc(now);
        e.setUpdatedAtUtc(now);
        e.setExpiresAtUtc(now.plus(retention.getKeep()));
        return e;
    }
}
