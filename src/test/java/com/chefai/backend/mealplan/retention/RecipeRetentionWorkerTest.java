package com.chefai.backend.mealplan.retention;

import com.chefai.backend.mealplan.repo.RecipeRepository;
import com.chefai.backend.mealplan.storage.ImageStore;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.data.domain.Pageable;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RecipeRetentionWorkerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:10:00Z");

    private final RecipeRepository repo = mock(RecipeRepository.class);
    private final ImageStore images = mock(ImageStore.class);
    private final RecipeRetentionProperties props = new RecipeRetentionProperties();

    @Test
    void deletes_expired_in_batches_until_drained() {
        props.setBatchSize(2);
        when(repo.findExpiredIds(eq(NOW), any(Pageable.class)))
                .thenReturn(List.of("a", "b"))
                .thenReturn(List.of("c"));

        new RecipeRetentionWorker(props, repo, images, Clock.fixed(NOW, ZoneOffset.UTC)).runHourly();

        verify(repo).deleteAllByIdInBatch(List.of("a", "b"));
        verify(repo).deleteAllByIdInBatch(List.of("c"));
        verify(repo, times(2)).findExpiredIds(eq(NOW), any(Pageable.class));
    }

    @Test
    void stored_images_of_deleted_recipes_are_removed() throws Exception {
        when(repo.findExpiredIds(eq(NOW), any(Pageable.class))).thenReturn(List.of("a", "b"));
        doThrow(new IOException("disk busy")).when(images).delete("a");

        new RecipeRetentionWorker(props, repo, images, Clock.fixed(NOW, ZoneOffset.UTC)).runHourly();

        InOrder order = inOrder(repo, images);
        order.verify(repo).deleteAllByIdInBatch(List.of("a", "b"));
        order.verify(images).delete("a");
        order.verify(images).delete("b");
    }

    @Test
    void nothing_expired_deletes_nothing() {
        when(repo.findExpiredIds(any(), any())).thenReturn(List.of());

        new RecipeRetentionWorker(props, repo, images, Clock.fixed(NOW, ZoneOffset.UTC)).runHourly();

        verify(repo, never()).deleteAllByIdInBatch(any());
        verifyNoInteractions(images);
    }

    @Test
    void disabled_does_not_touch_the_repository() {
        props.setEnabled(false);

        new RecipeRetentionWorker(props, repo, images, Clock.fixed(NOW, ZoneOffset.UTC)).runHourly();

        verifyNoInteractions(repo);
    }
}
