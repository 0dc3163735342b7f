package com.chefai.backend.mealplan.retention;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.retention.recipes")
public class RecipeRetentionProperties {

    /** 新產生的 recipe 保留多久（預設 2 天） */
    private Duration keep = Duration.ofDays(2);

    /** 收藏後延長到多久 */
    private Duration keepFavorited = Duration.ofDays(365);

    /** 每次掃描處理幾筆（避免單次太久） */
    private int batchSize = 200;

    private boolean enabled = true;

    public Duration getKeep() { return keep; }
    public void setKeep(Duration keep) { this.keep = keep; }

    public Duration getKeepFavorited() { return keepFavorited; }
    public void setKeepFavorited(Duration keepFavorited) { this.keepFavorited = keepFavorited; }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
