package com.chefai.backend.mealplan.config;

import com.chefai.backend.mealplan.model.MealSlot;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "app.mealplan")
public class MealPlanProperties {

    /** 一次最多產生幾天 */
    private int maxDays = 7;

    /** 每天要產生的餐別 */
    private List<MealSlot> mealSlots = new ArrayList<>(List.of(MealSlot.BREAKFAST, MealSlot.LUNCH, MealSlot.DINNER));

    /** 每個 task 交給 generator 的重試額度 */
    private int maxRetries = 2;

    /** 還有未過期（且未收藏）的 plan 時，不准再產新的 */
    private boolean singleActivePlan = true;

    private final Executor executor = new Executor();

    public int getMaxDays() { return maxDays; }
    public void setMaxDays(int maxDays) { this.maxDays = maxDays; }

    public List<MealSlot> getMealSlots() { return mealSlots; }
    public void setMealSlots(List<MealSlot> mealSlots) { this.mealSlots = mealSlots; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public boolean isSingleActivePlan() { return singleActivePlan; }
    public void setSingleActivePlan(boolean singleActivePlan) { this.singleActivePlan = singleActivePlan; }

    public Executor getExecutor() { return executor; }

    public static class Executor {
        /** generator 同時最多幾個呼叫（與 request 大小無關） */
        private int generationPoolSize = 4;
        private int generationQueueCapacity = 100;

        private int persistencePoolSize = 4;
        private int persistenceQueueCapacity = 100;

        private int enrichmentPoolSize = 2;
        private int enrichmentQueueCapacity = 200;

        public int getGenerationPoolSize() { return generationPoolSize; }
        public void setGenerationPoolSize(int generationPoolSize) { this.generationPoolSize = generationPoolSize; }

        public int getGenerationQueueCapacity() { return generationQueueCapacity; }
        public void setGenerationQueueCapacity(int generationQueueCapacity) { this.generationQueueCapacity = generationQueueCapacity; }

        public int getPersistencePoolSize() { return persistencePoolSize; }
        public void setPersistencePoolSize(int persistencePoolSize) { this.persistencePoolSize = persistencePoolSize; }

        public int getPersistenceQueueCapacity() { return persistenceQueueCapacity; }
        public void setPersistenceQueueCapacity(int persistenceQueueCapacity) { this.persistenceQueueCapacity = persistenceQueueCapacity; }

        public int getEnrichmentPoolSize() { return enrichmentPoolSize; }
        public void setEnrichmentPoolSize(int enrichmentPoolSize) { this.enrichmentPoolSize = enrichmentPoolSize; }

        public int getEnrichmentQueueCapacity() { return enrichmentQueueCapacity; }
        public void setEnrichmentQueueCapacity(int enrichmentQueueCapacity) { this.enrichmentQueueCapacity = enrichmentQueueCapacity; }
    }
}
