package com.chefai.backend.mealplan.web;

public class RecipeValidationException extends RuntimeException {

    public RecipeValidationException(String code) {
        super(code);
    }

    public String code() {
        return getMessage();
    }
}
