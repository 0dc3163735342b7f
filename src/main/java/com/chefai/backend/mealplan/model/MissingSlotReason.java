package com.chefai.backend.mealplan.model;

public enum MissingSlotReason {
    GENERATION_FAILED,
    VALIDATION_FAILED,
    DUPLICATE_NAME,
    PERSISTENCE_FAILED
}
