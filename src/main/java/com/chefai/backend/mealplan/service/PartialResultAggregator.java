package com.chefai.backend.mealplan.service;

import com.chefai.backend.mealplan.dto.PlanResult;
import com.chefai.backend.mealplan.dto.RecipeView;
import com.chefai.backend.mealplan.model.GenerationTask;
import com.chefai.backend.mealplan.model.MissingSlotReason;
import com.chefai.backend.mealplan.model.MissingSlotRecord;
import com.chefai.backend.mealplan.model.PlanStatus;
import com.chefai.backend.mealplan.model.SaveOutcome;
import com.chefai.backend.mealplan.model.TaskOutcome;
import com.chefai.backend.mealplan.web.ViabilityFailureException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns per-task outcomes into the plan result.
 * <p>
 * Viability floor: at least one usable recipe per requested day. Checked once after
 * generation (before anything is written) and again after persistence.
 * Every planned task ends up either in {@code recipes} or in {@code missingSlots}.
 */
@Component
public class PartialResultAggregator {

    public void checkViability(List<TaskOutcome> outcomes, int days) {
        int ok = 0;
        List<MissingSlotRecord> missing = new ArrayList<>();
        for (TaskOutcome o : outcomes) {
            if (o.succeeded()) ok++;
            else missing.add(MissingSlotRecord.of(o.task(), o.failureReason()));
        }
        if (ok < days) {
            throw new ViabilityFailureException(days, ok, missing);
        }
    }

    public PlanResult aggregate(String planId,
                                List<GenerationTask> tasks,
                                List<TaskOutcome> outcomes,
                                List<SaveOutcome> saves,
                                int days) {
        Map<String, TaskOutcome> byTask = new HashMap<>();
        for (TaskOutcome o : outcomes) byTask.put(o.task().taskId(), o);

        Map<String, SaveOutcome> savedByTask = new HashMap<>();
        for (SaveOutcome s : saves) savedByTask.put(s.task().taskId(), s);

        List<RecipeView> recipes = new ArrayList<>();
        List<MissingSlotRecord> missing = new ArrayList<>();

        for (GenerationTask t : tasks) {
            TaskOutcome o = byTask.get(t.taskId());
            if (o == null || !o.succeeded()) {
                MissingSlotReason reason = (o == null) ? MissingSlotReason.GENERATION_FAILED : o.failureReason();
                missing.add(MissingSlotRecord.of(t, reason));
                continue;
            }

            SaveOutcome s = savedByTask.get(t.taskId());
            if (s != null && s.saved()) {
                recipes.add(RecipeView.from(s.recipe()));
            } else {
                missing.add(MissingSlotRecord.of(t, MissingSlotReason.PERSISTENCE_FAILED));
            }
        }

        if (recipes.size() < days) {
            throw new ViabilityFailureException(days, recipes.size(), missing);
        }

        PlanStatus status = missing.isEmpty() ? PlanStatus.SUCCESS : PlanStatus.PARTIAL;
        return new PlanResult(planId, recipes, status, missing);
    }
}
