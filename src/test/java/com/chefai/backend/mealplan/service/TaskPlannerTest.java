package com.chefai.backend.mealplan.service;

import com.chefai.backend.mealplan.model.GenerationTask;
import com.chefai.backend.mealplan.model.MealSlot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskPlannerTest {

    private final TaskPlanner planner = new TaskPlanner();
    private final List<MealSlot> slots = List.of(MealSlot.BREAKFAST, MealSlot.LUNCH, MealSlot.DINNER);

    @Test
    void plans_days_times_slots_in_day_major_order() {
        List<GenerationTask> tasks = planner.plan("run1", 2, slots, List.of("Thai"));

        assertThat(tasks).hasSize(6);
        assertThat(tasks).extracting(GenerationTask::taskId).containsExactly(
                "run1:d1-breakfast", "run1:d1-lunch", "run1:d1-dinner",
                "run1:d2-breakfast", "run1:d2-lunch", "run1:d2-dinner");
        assertThat(tasks).extracting(GenerationTask::day).containsExactly(1, 1, 1, 2, 2, 2);
    }

    @Test
    void every_task_gets_an_immutable_copy_of_the_priority() {
        List<String> priority = new ArrayList<>(List.of("Mexican", "Italian"));
        List<GenerationTask> tasks = planner.plan("r", 1, slots, priority);

        priority.add("Greek");

        assertThat(tasks).allSatisfy(t -> assertThat(t.cuisinePriority()).containsExactly("Mexican", "Italian"));
        assertThatThrownBy(() -> tasks.get(0).cuisinePriority().add("x"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void zero_days_plans_nothing() {
        assertThat(planner.plan("r", 0, slots, List.of())).isEmpty();
    }
}
