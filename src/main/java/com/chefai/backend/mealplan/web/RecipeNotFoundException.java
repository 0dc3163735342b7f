package com.chefai.backend.mealplan.web;

public class RecipeNotFoundException extends RuntimeException {
    public RecipeNotFoundException() {
        super("RECIPE_NOT_FOUND");
    }
}
