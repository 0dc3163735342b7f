package com.chefai.backend.mealplan.service;

import com.chefai.backend.mealplan.entity.RecipeEntity;
import com.chefai.backend.mealplan.repo.RecipeRepository;
import com.chefai.backend.mealplan.retention.RecipeRetentionProperties;
import com.chefai.backend.mealplan.web.RecipeNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@RequiredArgsConstructor
@Service
public class RecipeFavoriteService {

    private final RecipeRepository repo;
    private final RecipeRetentionProperties retention;
    private final Clock clock;

    /**
     * 收藏：延長保存期限（只延長，不縮短）
     */
    @Transactional
    public RecipeEntity favorite(Long userId, String recipeId) {
        RecipeEntity r = repo.findByIdAndUserId(recipeId, userId).orElseThrow(RecipeNotFoundException::new);

        Instant now = Instant.now(clock);
        Instant keepUntil = now.plus(retention.getKeepFavorited());

        if (!r.isFavorited()) {
            r.setFavorited(true);
            r.setFavoritesCount(r.getFavoritesCount() + 1);
        }
        if (r.getExpiresAtUtc() == null || r.getExpiresAtUtc().isBefore(keepUntil)) {
            r.setExpiresAtUtc(keepUntil);
        }

        log.info("recipe_favorited userId={} recipeId={} expiresAt={}", userId, recipeId, r.getExpiresAtUtc());
        return repo.save(r);
    }

    @Transactional
    public RecipeEntity unfavorite(Long userId, String recipeId) {
        RecipeEntity r = repo.findByIdAndUserId(recipeId, userId).orElseThrow(RecipeNotFoundException::new);
        if (!r.isFavorited()) return r;

        r.setFavorited(false);
        log.info("recipe_unfavorited userId={} recipeId={}", userId, recipeId);
        return repo.save(r);
    }
}
