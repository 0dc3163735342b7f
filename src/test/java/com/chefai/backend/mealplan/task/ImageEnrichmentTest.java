package com.chefai.backend.mealplan.task;

import com.chefai.backend.mealplan.entity.RecipeEntity;
import com.chefai.backend.mealplan.repo.RecipeRepository;
import com.chefai.backend.mealplan.storage.ImageStore;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ImageEnrichmentTest {

    private final ImageStore store = mock(ImageStore.class);
    private final RecipeRepository repo = mock(RecipeRepository.class);
    private final Clock clock = Clock.systemUTC();

    private static RecipeEntity recipe(String imageUrl) {
        RecipeEntity r = new RecipeEntity();
        r.setId("r-1");
        r.setImageUrl(imageUrl);
        return r;
    }

    @Test
    void durable_url_is_written_back() throws Exception {
        when(store.storeDurable("https://cdn/tmp.png", "r-1")).thenReturn("/media/recipes/r-1.png");
        when(repo.updateDurableImageUrl(eq("r-1"), eq("/media/recipes/r-1.png"), any(Instant.class))).thenReturn(1);

        new ImageEnrichment(store, repo, clock, Runnable::run).enrich(recipe("https://cdn/tmp.png"));

        verify(repo).updateDurableImageUrl(eq("r-1"), eq("/media/recipes/r-1.png"), any(Instant.class));
    }

    @Test
    void store_failure_keeps_transient_url_and_does_not_throw() throws Exception {
        when(store.storeDurable(anyString(), anyString())).thenThrow(new IllegalStateException("download failed"));

        assertThatCode(() -> new ImageEnrichment(store, repo, clock, Runnable::run).enrich(recipe("https://cdn/tmp.png")))
                .doesNotThrowAnyException();
        verify(repo, never()).updateDurableImageUrl(anyString(), anyString(), any());
    }

    @Test
    void null_durable_url_is_not_written() throws Exception {
        when(store.storeDurable(anyString(), anyString())).thenReturn(null);

        new ImageEnrichment(store, repo, clock, Runnable::run).enrich(recipe("https://cdn/tmp.png"));

        verify(repo, never()).updateDurableImageUrl(anyString(), anyString(), any());
    }

    @Test
    void recipe_without_image_is_skipped() {
        new ImageEnrichment(store, repo, clock, Runnable::run).enrich(recipe(null));
        verifyNoInteractions(store, repo);
    }

    @Test
    void rejected_submission_is_swallowed_into_a_log_line() {
        Executor full = r -> { throw new RejectedExecutionException("queue full"); };

        assertThatCode(() -> new ImageEnrichment(store, repo, clock, full).enrich(recipe("https://cdn/tmp.png")))
                .doesNotThrowAnyException();
        verifyNoInteractions(store, repo);
    }

    @Test
    void image_of_a_deleted_recipe_is_removed_again() throws Exception {
        when(store.storeDurable("https://cdn/tmp.png", "r-1")).thenReturn("/media/recipes/r-1.png");
        when(repo.updateDurableImageUrl(eq("r-1"), anyString(), any(Instant.class))).thenReturn(0);

        new ImageEnrichment(store, repo, clock, Runnable::run).enrich(recipe("https://cdn/tmp.png"));

        verify(store).delete("r-1");
    }

    @Test
    void discard_failure_is_logged_not_thrown() throws Exception {
        doThrow(new IOException("read-only fs")).when(store).delete("r-1");

        assertThatCode(() -> new ImageEnrichment(store, repo, clock, Runnable::run).discard("r-1"))
                .doesNotThrowAnyException();
    }
}
