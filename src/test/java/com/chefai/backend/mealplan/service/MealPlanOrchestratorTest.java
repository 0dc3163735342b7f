package com.chefai.backend.mealplan.service;

import com.chefai.backend.mealplan.config.MealPlanProperties;
import com.chefai.backend.mealplan.dto.PlanResult;
import com.chefai.backend.mealplan.entity.RecipeEntity;
import com.chefai.backend.mealplan.model.MealSlot;
import com.chefai.backend.mealplan.model.MissingSlotReason;
import com.chefai.backend.mealplan.model.MissingSlotRecord;
import com.chefai.backend.mealplan.model.PlanStatus;
import com.chefai.backend.mealplan.provider.RecipeGenerationRequest;
import com.chefai.backend.mealplan.provider.RecipeGenerator;
import com.chefai.backend.mealplan.repo.RecipeRepository;
import com.chefai.backend.mealplan.retention.RecipeRetentionProperties;
import com.chefai.backend.mealplan.task.GenerationScheduler;
import com.chefai.backend.mealplan.task.ImageEnrichment;
import com.chefai.backend.mealplan.web.ActivePlanExistsException;
import com.chefai.backend.mealplan.web.SlotRegenerationException;
import com.chefai.backend.mealplan.web.ViabilityFailureException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static com.chefai.backend.testsupport.RecipeFixtures.active;
import static com.chefai.backend.testsupport.RecipeFixtures.recipe;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class MealPlanOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");
    private static final Long UID = 42L;

    private final ObjectMapper om = new ObjectMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private RecipeRepository repo;
    private MealPlanProperties props;
    private ScriptedGenerator generator;
    private MealPlanOrchestrator orchestrator;

    /**
     * 依 taskId 尾碼決定失敗；成功時名字 = "Dish {taskId 尾碼}"
     */
    static class ScriptedGenerator implements RecipeGenerator {
        final Set<String> failing;
        final List<RecipeGenerationRequest> requests = new CopyOnWriteArrayList<>();

        ScriptedGenerator(Set<String> failingSuffixes) {
            this.failing = failingSuffixes;
        }

        @Override
        public String providerCode() { return "TEST"; }

        @Override
        public GeneratorResult generate(RecipeGenerationRequest req) {
            requests.add(req);
            String suffix = req.taskId().substring(req.taskId().lastIndexOf(':') + 1);
            if (failing.contains(suffix)) throw new IllegalStateException("GENERATOR_UPSTREAM_5XX");
            ObjectNode draft = new ObjectMapper().createObjectNode();
            draft.put("name", "Dish " + suffix);
            draft.put("servings", 2);
            return new GeneratorResult(draft, "TEST");
        }
    }

    @BeforeEach
    void setUp() {
        repo = mock(RecipeRepository.class);
        props = new MealPlanProperties();
        AtomicInteger ids = new AtomicInteger();
        when(repo.save(any(RecipeEntity.class))).thenAnswer(inv -> {
            RecipeEntity e = inv.getArgument(0);
            e.setId("rec-" + ids.incrementAndGet());
            return e;
        });
        when(repo.findByUserId(UID)).thenReturn(List.of());
        build(Set.of());
    }

    private void build(Set<String> failing) {
        generator = new ScriptedGenerator(failing);
        PersistenceWriter writer = new PersistenceWriter(repo, mock(ImageEnrichment.class),
                new RecipeRetentionProperties(), om, clock, Runnable::run);
        orchestrator = new MealPlanOrchestrator(
                props,
                new PreferenceNormalizer(),
                new CuisineBalancer(),
                new TaskPlanner(),
                new GenerationScheduler(Runnable::run, new ResultValidator()),
                writer,
                new PartialResultAggregator(),
                generator,
                repo,
                clock
        );
    }

    @Test
    void full_success_returns_every_slot() throws Exception {
        PlanResult r = orchestrator.generatePlan(UID, om.readTree("{\"cuisines\":[\"Thai\"]}"), 2);

        assertThat(r.status()).isEqualTo(PlanStatus.SUCCESS);
        assertThat(r.recipes()).hasSize(6);
        assertThat(r.missingSlots()).isEmpty();
        assertThat(r.recipes()).allSatisfy(v -> assertThat(v.planId()).isEqualTo(r.planId()));
        assertThat(generator.requests).allSatisfy(q -> assertThat(q.cuisinePriority()).containsExactly("Thai"));
    }

    @Test
    void one_failed_slot_gives_partial_plan() {
        build(Set.of("d1-dinner"));

        PlanResult r = orchestrator.generatePlan(UID, null, 2);

        assertThat(r.status()).isEqualTo(PlanStatus.PARTIAL);
        assertThat(r.recipes()).hasSize(5);
        assertThat(r.missingSlots()).containsExactly(
                new MissingSlotRecord(1, MealSlot.DINNER, MissingSlotReason.GENERATION_FAILED));
        assertThat(r.recipes().size() + r.missingSlots().size()).isEqualTo(2 * 3);
    }

    @Test
    void below_floor_after_generation_writes_nothing() {
        build(Set.of("d1-breakfast", "d1-lunch", "d1-dinner", "d2-breakfast", "d2-lunch"));

        assertThatThrownBy(() -> orchestrator.generatePlan(UID, null, 2))
                .isInstanceOf(ViabilityFailureException.class);
        verify(repo, never()).save(any(RecipeEntity.class));
    }

    @Test
    void below_floor_after_saving_deletes_what_was_written() {
        AtomicInteger calls = new AtomicInteger();
        when(repo.save(any(RecipeEntity.class))).thenAnswer(inv -> {
            if (calls.incrementAndGet() > 1) throw new IllegalStateException("db down");
            RecipeEntity e = inv.getArgument(0);
            e.setId("only-one");
            return e;
        });

        assertThatThrownBy(() -> orchestrator.generatePlan(UID, null, 2))
                .isInstanceOf(ViabilityFailureException.class);
        verify(repo).deleteAllById(List.of("only-one"));
    }

    @Test
    void history_names_are_excluded_from_generation() {
        when(repo.findByUserId(UID)).thenReturn(List.of(recipe(UID, "Old Curry", "Indian")));

        orchestrator.generatePlan(UID, null, 1);

        assertThat(generator.requests).allSatisfy(q -> assertThat(q.excludeNames()).contains("Old Curry"));
    }

    @Test
    void repeating_a_history_name_does_not_drop_the_slot() {
        when(repo.findByUserId(UID)).thenReturn(List.of(
                recipe(UID, "Dish d1-breakfast", null),
                recipe(UID, "Dish d1-lunch", null),
                recipe(UID, "Dish d1-dinner", null)));

        PlanResult r = orchestrator.generatePlan(UID, null, 1);

        assertThat(r.status()).isEqualTo(PlanStatus.SUCCESS);
        assertThat(r.recipes()).hasSize(3);
        assertThat(r.missingSlots()).isEmpty();
        assertThat(generator.requests).allSatisfy(q -> assertThat(q.excludeNames())
                .contains("Dish d1-breakfast", "Dish d1-lunch", "Dish d1-dinner"));
    }

    @Test
    void days_outside_range_are_rejected() {
        assertThatThrownBy(() -> orchestrator.generatePlan(UID, null, 0))
                .isInstanceOf(IllegalArgumentException.class).hasMessage("DAYS_OUT_OF_RANGE");
        assertThatThrownBy(() -> orchestrator.generatePlan(UID, null, props.getMaxDays() + 1))
                .isInstanceOf(IllegalArgumentException.class).hasMessage("DAYS_OUT_OF_RANGE");
    }

    @Test
    void active_plan_blocks_a_new_one() {
        when(repo.existsByUserIdAndFavoritedFalseAndExpiresAtUtcAfter(UID, NOW)).thenReturn(true);

        assertThatThrownBy(() -> orchestrator.generatePlan(UID, null, 1))
                .isInstanceOf(ActivePlanExistsException.class);
        assertThat(generator.requests).isEmpty();
    }

    @Test
    void active_plan_guard_can_be_turned_off() {
        props.setSingleActivePlan(false);
        when(repo.existsByUserIdAndFavoritedFalseAndExpiresAtUtcAfter(UID, NOW)).thenReturn(true);

        assertThat(orchestrator.generatePlan(UID, null, 1).recipes()).hasSize(3);
    }

    @Test
    void regenerate_excludes_every_historical_name_and_replaces_the_slot() {
        RecipeEntity current = active(UID, "cur", "plan-9", 2, MealSlot.LUNCH, NOW.plusSeconds(3600));
        current.setName("Current Lunch");
        List<RecipeEntity> history = new ArrayList<>(List.of(current, recipe(UID, "Ancient Soup", null)));
        when(repo.findByUserId(UID)).thenReturn(history);
        when(repo.findActiveInSlot(UID, 2, MealSlot.LUNCH, NOW)).thenReturn(List.of(current));

        RecipeEntity fresh = orchestrator.regenerateOne(UID, 2, MealSlot.LUNCH, null);

        assertThat(generator.requests).hasSize(1);
        assertThat(generator.requests.get(0).excludeNames()).contains("Current Lunch", "Ancient Soup");
        assertThat(fresh.getPlanId()).isEqualTo("plan-9");
        assertThat(fresh.getPlanDay()).isEqualTo(2);
        assertThat(fresh.getMealSlot()).isEqualTo(MealSlot.LUNCH);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<RecipeEntity>> cap = ArgumentCaptor.forClass(List.class);
        verify(repo).saveAll(cap.capture());
        assertThat(cap.getValue()).singleElement()
                .satisfies(old -> assertThat(old.getExpiresAtUtc()).isEqualTo(NOW));
    }

    @Test
    void regenerate_failure_carries_the_reason() {
        build(Set.of("d1-dinner"));
        when(repo.findActiveInSlot(anyLong(), anyInt(), any(), any())).thenReturn(List.of());
        when(repo.findActiveByUserId(anyLong(), any())).thenReturn(List.of());

        assertThatThrownBy(() -> orchestrator.regenerateOne(UID, 1, MealSlot.DINNER, null))
                .isInstanceOf(SlotRegenerationException.class)
                .satisfies(e -> assertThat(((SlotRegenerationException) e).reason())
                        .isEqualTo(MissingSlotReason.GENERATION_FAILED));
        verify(repo, never()).save(any(RecipeEntity.class));
    }

    @Test
    void regenerate_rejects_a_name_the_user_already_has() {
        when(repo.findByUserId(UID)).thenReturn(List.of(recipe(UID, "Dish d1-dinner", null)));
        when(repo.findActiveInSlot(anyLong(), anyInt(), any(), any())).thenReturn(List.of());
        when(repo.findActiveByUserId(anyLong(), any())).thenReturn(List.of());

        assertThatThrownBy(() -> orchestrator.regenerateOne(UID, 1, MealSlot.DINNER, null))
                .isInstanceOf(SlotRegenerationException.class)
                .satisfies(e -> assertThat(((SlotRegenerationException) e).reason())
                        .isEqualTo(MissingSlotReason.DUPLICATE_NAME));
        verify(repo, never()).save(any(RecipeEntity.class));
    }

    @Test
    void active_recipes_are_ordered_by_day_then_slot() {
        Instant exp = NOW.plusSeconds(60);
        when(repo.findActiveByUserId(UID, NOW)).thenReturn(List.of(
                active(UID, "a", "p", 1, MealSlot.DINNER, exp),
                active(UID, "b", "p", 2, MealSlot.BREAKFAST, exp),
                active(UID, "c", "p", 1, MealSlot.BREAKFAST, exp),
                active(UID, "d", "p", 1, MealSlot.LUNCH, exp)
        ));

        assertThat(orchestrator.getActive(UID)).extracting(v -> v.id()).containsExactly("c", "d", "a", "b");
    }
}
