package com.chefai.backend.mealplan.model;

/**
 * Result of one generation task: either a validated draft whose name was claimed,
 * or a failure with its reason. Exactly one of draft / failureReason is non-null.
 */
public record TaskOutcome(
        GenerationTask task,
        RecipeDraft draft,
        MissingSlotReason failureReason,
        String errorCode
) {
    public static TaskOutcome success(GenerationTask task, RecipeDraft draft) {
        return new TaskOutcome(task, draft, null, null);
    }

    public static TaskOutcome failure(GenerationTask task, MissingSlotReason reason, String errorCode) {
        return new TaskOutcome(task, null, reason, errorCode);
    }

    public boolean succeeded() {
        return draft != null;
    }
}
