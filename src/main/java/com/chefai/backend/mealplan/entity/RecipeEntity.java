package com.chefai.backend.mealplan.entity;

import com.chefai.backend.mealplan.model.MealSlot;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "recipes", indexes = {
        @Index(name = "idx_recipes_user_expires", columnList = "user_id, expires_at_utc"),
        @Index(name = "idx_recipes_plan", columnList = "plan_id")
})
public class RecipeEntity {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "plan_id", length = 36)
    private String planId;

    @Column(name = "plan_day")
    private Integer planDay;

    @Enumerated(EnumType.STRING)
    @Column(name = "meal_slot", length = 16)
    private MealSlot mealSlot;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "prep_time", nullable = false)
    private int prepTime;

    @Column(name = "cook_time", nullable = false)
    private int cookTime;

    @Column(nullable = false)
    private int servings;

    @Column(nullable = false)
    private int complexity;

    @Column(length = 64)
    private String cuisine;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "ingredients")
    private JsonNode ingredients;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "instructions")
    private JsonNode instructions;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "tags")
    private JsonNode tags;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "nutrition")
    private JsonNode nutrition;

    /** provider 給的暫時圖片（會過期） */
    @Column(name = "image_url", columnDefinition = "TEXT")
    private String imageUrl;

    /** ImageEnrichment 搬到自家儲存後的永久圖片 */
    @Column(name = "durable_image_url", columnDefinition = "TEXT")
    private String durableImageUrl;

    @Column(nullable = false)
    private boolean favorited;

    @Column(name = "favorites_count", nullable = false)
    private int favoritesCount;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAtUtc;

    @Column(name = "updated_at_utc", nullable = false)
    private Instant updatedAtUtc;

    @Column(name = "expires_at_utc", nullable = false)
    private Instant expiresAtUtc;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        Instant now = Instant.now();
        if (createdAtUtc == null) createdAtUtc = now;
        if (updatedAtUtc == null) updatedAtUtc = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAtUtc = Instant.now();
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAtUtc != null && !expiresAtUtc.isAfter(now);
    }
}
