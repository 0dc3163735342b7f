package com.chefai.backend.mealplan.web;

import com.chefai.backend.mealplan.model.MissingSlotRecord;

import java.util.List;

/**
 * Fewer usable recipes than requested days: the plan is unusable and nothing is returned.
 */
public class ViabilityFailureException extends RuntimeException {

    private final int days;
    private final int produced;
    private final List<MissingSlotRecord> missingSlots;

    public ViabilityFailureException(int days, int produced, List<MissingSlotRecord> missingSlots) {
        super("MEAL_PLAN_NOT_VIABLE");
        this.days = days;
        this.produced = produced;
        this.missingSlots = (missingSlots == null) ? List.of() : List.copyOf(missingSlots);
    }

    public int days() { return days; }

    public int produced() { return produced; }

    public List<MissingSlotRecord> missingSlots() { return missingSlots; }
}
