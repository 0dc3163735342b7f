package com.chefai.backend.mealplan.service;

import com.chefai.backend.mealplan.config.MealPlanProperties;
import com.chefai.backend.mealplan.dto.PlanResult;
import com.chefai.backend.mealplan.dto.RecipeView;
import com.chefai.backend.mealplan.entity.RecipeEntity;
import com.chefai.backend.mealplan.model.GenerationTask;
import com.chefai.backend.mealplan.model.MealSlot;
import com.chefai.backend.mealplan.model.MissingSlotReason;
import com.chefai.backend.mealplan.model.Preferences;
import com.chefai.backend.mealplan.model.SaveOutcome;
import com.chefai.backend.mealplan.model.TaskOutcome;
import com.chefai.backend.mealplan.provider.RecipeGenerator;
import com.chefai.backend.mealplan.repo.RecipeRepository;
import com.chefai.backend.mealplan.task.GenerationScheduler;
import com.chefai.backend.mealplan.web.ActivePlanExistsException;
import com.chefai.backend.mealplan.web.SlotRegenerationException;
import com.chefai.backend.mealplan.web.ViabilityFailureException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Meal-plan batch generation.
 * <pre>
 * preferences → normalize → rank cuisines → plan tasks
 *   → [generation barrier] → viability check (nothing written yet)
 *   → [persistence barrier] → aggregate (post-save floor)
 * </pre>
 * The two barriers are the only places the caller thread waits.
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class MealPlanOrchestrator {

    private final MealPlanProperties props;
    private final PreferenceNormalizer normalizer;
    private final CuisineBalancer balancer;
    private final TaskPlanner planner;
    private final GenerationScheduler scheduler;
    private final PersistenceWriter writer;
    private final PartialResultAggregator aggregator;
    private final RecipeGenerator generator;
    private final RecipeRepository repo;
    private final Clock clock;

    public PlanResult generatePlan(Long userId, JsonNode preferences, int days) {
        if (days < 1 || days > props.getMaxDays()) throw new IllegalArgumentException("DAYS_OUT_OF_RANGE");

        long t0 = System.nanoTime();
        Instant now = Instant.now(clock);

        if (props.isSingleActivePlan()
            && repo.existsByUserIdAndFavoritedFalseAndExpiresAtUtcAfter(userId, now)) {
            throw new ActivePlanExistsException();
        }

        Preferences prefs = normalizer.normalize(preferences);
        List<RecipeEntity> history = repo.findByUserId(userId);
        NameDeduplicator dedup = new NameDeduplicator(names(history));
        List<String> priority = balancer.rank(prefs.cuisines(), history);

        String planId = UUID.randomUUID().toString();
        List<GenerationTask> tasks = planner.plan(planId, days, props.getMealSlots(), priority);

        log.info("meal_plan_start userId={} planId={} days={} tasks={} provider={} history={}",
                userId, planId, days, tasks.size(), generator.providerCode(), history.size());

        // 1) generation barrier
        List<TaskOutcome> outcomes = scheduler.run(tasks, prefs, generator, dedup, props.getMaxRetries());

        try {
            aggregator.checkViability(outcomes, days);
        } catch (ViabilityFailureException e) {
            log.warn("meal_plan_not_viable userId={} planId={} stage=GENERATION days={} produced={}",
                    userId, planId, days, e.produced());
            throw e;
        }

        // 2) persistence barrier
        List<TaskOutcome> generated = outcomes.stream().filter(TaskOutcome::succeeded).toList();
        List<SaveOutcome> saves = writer.saveAll(generated, userId, planId);

        PlanResult result;
        try {
            result = aggregator.aggregate(planId, tasks, outcomes, saves, days);
        } catch (ViabilityFailureException e) {
            // post-save floor：已寫入的也一起撤掉，不留半套 plan
            writer.rollback(saves);
            log.warn("meal_plan_not_viable userId={} planId={} stage=PERSISTENCE days={} produced={}",
                    userId, planId, days, e.produced());
            throw e;
        }

        long ms = (System.nanoTime() - t0) / 1_000_000;
        log.info("meal_plan_generated userId={} planId={} status={} recipes={} missing={} latencyMs={}",
                userId, planId, result.status().wireName(), result.recipes().size(),
                result.missingSlots().size(), ms);
        return result;
    }

    /**
     * Regenerates one (day, slot). Every name the user has ever had is excluded; the recipe
     * currently in that slot (unless favorited) is expired once the new one is saved.
     */
    public RecipeEntity regenerateOne(Long userId, int day, MealSlot slot, JsonNode preferences) {
        if (day < 1 || day > props.getMaxDays()) throw new IllegalArgumentException("DAY_OUT_OF_RANGE");
        if (slot == null) throw new IllegalArgumentException("MEAL_SLOT_INVALID");

        Instant now = Instant.now(clock);

        Preferences prefs = normalizer.normalize(preferences);
        List<RecipeEntity> history = repo.findByUserId(userId);
        NameDeduplicator dedup = NameDeduplicator.strict(names(history));
        List<String> priority = balancer.rank(prefs.cuisines(), history);

        List<RecipeEntity> replaced = repo.findActiveInSlot(userId, day, slot, now);
        String planId = resolvePlanId(userId, replaced, now);

        GenerationTask task = new GenerationTask(TaskPlanner.taskId(planId, day, slot), day, slot, priority);
        TaskOutcome outcome = scheduler.run(List.of(task), prefs, generator, dedup, props.getMaxRetries()).get(0);
        if (!outcome.succeeded()) {
            log.warn("slot_regenerate_failed userId={} day={} slot={} reason={} code={}",
                    userId, day, slot.wireName(), outcome.failureReason(), outcome.errorCode());
            throw new SlotRegenerationException(outcome.failureReason(), outcome.errorCode());
        }

        SaveOutcome saved = writer.saveOne(task, outcome.draft(), userId, planId);
        if (!saved.saved()) {
            throw new SlotRegenerationException(MissingSlotReason.PERSISTENCE_FAILED, saved.errorCode());
        }

        if (!replaced.isEmpty()) {
            Instant expireAt = Instant.now(clock);
            for (RecipeEntity old : replaced) old.setExpiresAtUtc(expireAt);
            repo.saveAll(replaced);
        }

        log.info("slot_regenerated userId={} planId={} day={} slot={} recipeId={} replaced={}",
                userId, planId, day, slot.wireName(), saved.recipe().getId(), replaced.size());
        return saved.recipe();
    }

    /**
     * Unexpired recipes of the user, ordered by day then meal slot.
     */
    public List<RecipeView> getActive(Long userId) {
        Instant now = Instant.now(clock);
        return repo.findActiveByUserId(userId, now).stream()
                .sorted(Comparator
                        .comparing((RecipeEntity r) -> r.getPlanDay() == null ? Integer.MAX_VALUE : r.getPlanDay())
                        .thenComparing(r -> r.getMealSlot() == null ? Integer.MAX_VALUE : r.getMealSlot().ordinal())
                        .thenComparing(RecipeEntity::getCreatedAtUtc, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(RecipeView::from)
                .toList();
    }

    private String resolvePlanId(Long userId, List<RecipeEntity> replaced, Instant now) {
        for (RecipeEntity r : replaced) {
            if (r.getPlanId() != null) return r.getPlanId();
        }
        for (RecipeEntity r : repo.findActiveByUserId(userId, now)) {
            if (r.getPlanId() != null) return r.getPlanId();
        }
        return UUID.randomUUID().toString();
    }

    private static List<String> names(List<RecipeEntity> history) {
        return history.stream().map(RecipeEntity::getName).filter(Objects::nonNull).toList();
    }
}
