package com.chefai.backend.mealplan.config;

import com.chefai.backend.mealplan.retention.RecipeRetentionProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({MealPlanProperties.class, RecipeRetentionProperties.class})
public class MealPlanConfig {

    /** ✅ 用 Clock 方便測試（expiresAt / retention cutoff） */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
