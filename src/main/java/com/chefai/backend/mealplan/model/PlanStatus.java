package com.chefai.backend.mealplan.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PlanStatus {
    SUCCESS,
    PARTIAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
