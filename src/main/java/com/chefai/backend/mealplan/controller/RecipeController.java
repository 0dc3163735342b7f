package com.chefai.backend.mealplan.controller;

import com.chefai.backend.auth.security.AuthContext;
import com.chefai.backend.mealplan.dto.RecipeView;
import com.chefai.backend.mealplan.service.RecipeFavoriteService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Recipe", description = "Favorite / unfavorite generated recipes")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/recipes")
public class RecipeController {

    private final AuthContext auth;
    private final RecipeFavoriteService favoriteService;

    @PostMapping("/{id}/favorite")
    public RecipeView favorite(@PathVariable("id") String id) {
        Long uid = auth.requireUserId();
        return RecipeView.from(favoriteService.favorite(uid, id));
    }

    @DeleteMapping("/{id}/favorite")
    public RecipeView unfavorite(@PathVariable("id") String id) {
        Long uid = auth.requireUserId();
        return RecipeView.from(favoriteService.unfavorite(uid, id));
    }
}
