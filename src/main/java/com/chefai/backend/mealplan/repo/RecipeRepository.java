package com.chefai.backend.mealplan.repo;

import com.chefai.backend.mealplan.entity.RecipeEntity;
import com.chefai.backend.mealplan.model.MealSlot;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RecipeRepository extends JpaRepository<RecipeEntity, String> {

    List<RecipeEntity> findByUserId(Long userId);

    Optional<RecipeEntity> findByIdAndUserId(String id, Long userId);

    boolean existsByUserIdAndFavoritedFalseAndExpiresAtUtcAfter(Long userId, Instant now);

    @Query("""
                select r from RecipeEntity r
                where r.userId = :userId
                  and r.expiresAtUtc > :now
                order by r.planDay asc, r.createdAtUtc asc
            """)
    List<RecipeEntity> findActiveByUserId(@Param("userId") Long userId, @Param("now") Instant now);

    @Query("""
                select r from RecipeEntity r
                where r.userId = :userId
                  and r.planDay = :day
                  and r.mealSlot = :slot
                  and r.favorited = false
                  and r.expiresAtUtc > :now
            """)
    List<RecipeEntity> findActiveInSlot(
            @Param("userId") Long userId,
            @Param("day") int day,
            @Param("slot") MealSlot slot,
            @Param("now") Instant now
    );

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
                update RecipeEntity r
                set r.durableImageUrl = :url, r.updatedAtUtc = :now
                where r.id = :id
            """)
    int updateDurableImageUrl(@Param("id") String id, @Param("url") String url, @Param("now") Instant now);

    @Query("""
                select r.id from RecipeEntity r
                where r.favorited = false
                  and r.expiresAtUtc < :cutoff
                order by r.expiresAtUtc asc
            """)
    List<String> findExpiredIds(@Param("cutoff") Instant cutoff, Pageable pageable);
}
