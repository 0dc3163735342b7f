package com.chefai.backend.mealplan.web;

public class ActivePlanExistsException extends RuntimeException {
    public ActivePlanExistsException() {
        super("ACTIVE_MEAL_PLAN_EXISTS");
    }
}
