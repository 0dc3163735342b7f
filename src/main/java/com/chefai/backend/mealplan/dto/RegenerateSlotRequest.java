package com.chefai.backend.mealplan.dto;

import com.chefai.backend.mealplan.model.MealSlot;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;

public record RegenerateSlotRequest(
        @NotNull Integer day,
        @NotNull MealSlot mealSlot,
        JsonNode preferences
) {}
