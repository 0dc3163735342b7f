package com.chefai.backend.mealplan.service;

import com.chefai.backend.mealplan.model.GenerationTask;
import com.chefai.backend.mealplan.model.MealSlot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class TaskPlanner {

    /**
     * days × slots tasks, day-major, every task carrying the same cuisine priority snapshot.
     */
    public List<GenerationTask> plan(String runId, int days, List<MealSlot> mealSlots, List<String> cuisinePriority) {
        if (days <= 0 || mealSlots == null || mealSlots.isEmpty()) return List.of();

        List<String> priority = cuisinePriority == null ? List.of() : List.copyOf(cuisinePriority);
        List<GenerationTask> tasks = new ArrayList<>(days * mealSlots.size());
        for (int day = 1; day <= days; day++) {
            for (MealSlot slot : mealSlots) {
                tasks.add(new GenerationTask(taskId(runId, day, slot), day, slot, priority));
            }
        }
        return List.copyOf(tasks);
    }

    static String taskId(String runId, int day, MealSlot slot) {
        String prefix = (runId == null || runId.isBlank()) ? "" : runId + ":";
        return prefix + "d" + day + "-" + slot.wireName();
    }
}
