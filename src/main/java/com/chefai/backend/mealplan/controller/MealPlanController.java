package com.chefai.backend.mealplan.controller;

import com.chefai.backend.auth.security.AuthContext;
import com.chefai.backend.mealplan.dto.GeneratePlanRequest;
import com.chefai.backend.mealplan.dto.PlanResult;
import com.chefai.backend.mealplan.dto.RecipeView;
import com.chefai.backend.mealplan.dto.RegenerateSlotRequest;
import com.chefai.backend.mealplan.service.MealPlanOrchestrator;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "MealPlan", description = "Meal plan batch generation + slot regeneration")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/meal-plans")
public class MealPlanController {

    private final AuthContext auth;
    private final MealPlanOrchestrator orchestrator;

    @PostMapping
    public PlanResult generate(@Valid @RequestBody GeneratePlanRequest body) {
        Long uid = auth.requireUserId();
        return orchestrator.generatePlan(uid, body.preferences(), body.days());
    }

    /**
     * ✅ 單一 (day, mealSlot) 重新產生；舊的那道（未收藏）會被取代
     */
    @PostMapping("/slots/regenerate")
    public RecipeView regenerate(@Valid @RequestBody RegenerateSlotRequest body) {
        Long uid = auth.requireUserId();
        return RecipeView.from(orchestrator.regenerateOne(uid, body.day(), body.mealSlot(), body.preferences()));
    }

    @GetMapping("/active")
    public List<RecipeView> active() {
        Long uid = auth.requireUserId();
        return orchestrator.getActive(uid);
    }
}
