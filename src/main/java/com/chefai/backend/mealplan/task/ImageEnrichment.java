package com.chefai.backend.mealplan.task;

import com.chefai.backend.mealplan.entity.RecipeEntity;
import com.chefai.backend.mealplan.repo.RecipeRepository;
import com.chefai.backend.mealplan.storage.ImageStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget: moves the provider's expiring image into our own storage.
 * Never blocks the caller and never throws; a failed job leaves the transient url in place.
 */
@Slf4j
@Component
public class ImageEnrichment {

    private final ImageStore imageStore;
    private final RecipeRepository repo;
    private final Clock clock;
    private final Executor executor;

    public ImageEnrichment(ImageStore imageStore,
                           RecipeRepository repo,
                           Clock clock,
                           @Qualifier("imageEnrichmentExecutor") Executor executor) {
        this.imageStore = imageStore;
        this.repo = repo;
        this.clock = clock;
        this.executor = executor;
    }

    public void enrich(RecipeEntity recipe) {
        if (recipe == null || recipe.getId() == null) return;

        String transientUrl = recipe.getImageUrl();
        if (transientUrl == null || transientUrl.isBlank()) return;

        String recordId = recipe.getId();
        try {
            executor.execute(() -> runJob(recordId, transientUrl));
        } catch (RejectedExecutionException e) {
            log.warn("image_enrich_rejected recipeId={} err={}", recordId, e.toString());
        }
    }

    void runJob(String recordId, String transientUrl) {
        try {
            String durable = imageStore.storeDurable(transientUrl, recordId);
            if (durable == null) {
                log.warn("image_enrich_skipped recipeId={} reason=NO_DURABLE_URL", recordId);
                return;
            }
            int n = repo.updateDurableImageUrl(recordId, durable, Instant.now(clock));
            if (n == 0) {
                // recipe 已被 rollback / retention 刪掉：剛寫的檔也一起清
                log.warn("image_enrich_orphan recipeId={}", recordId);
                discard(recordId);
                return;
            }
            log.info("image_enrich_ok recipeId={} url={}", recordId, durable);
        } catch (Exception e) {
            log.warn("image_enrich_failed recipeId={} err={}", recordId, e.toString());
        }
    }

    /** Deletes the stored image of a recipe whose row is gone. Never throws. */
    public void discard(String recordId) {
        if (recordId == null) return;
        try {
            imageStore.delete(recordId);
        } catch (Exception e) {
            log.warn("image_discard_failed recipeId={} err={}", recordId, e.toString());
        }
    }
}
