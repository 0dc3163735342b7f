package com.chefai.backend.mealplan.provider.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.generator.openai")
public class OpenAiProperties {

    private String baseUrl = "https://api.openai.com";

    /** 用環境變數帶入：OPENAI_API_KEY */
    private String apiKey;

    private String model = "gpt-3.5-turbo-1106";

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(60);

    /** 成本守門：輸出 token 上限 */
    private int maxTokens = 1000;

    private double temperature = 0.7;

    /** 是否順便產生 recipe 圖片（暫時 URL，之後由 ImageEnrichment 搬走） */
    private boolean imageEnabled = false;
    private String imageModel = "dall-e-3";
    private String imageSize = "1024x1024";

    /** 429 時最多等幾秒再重試（避免 worker 卡太久） */
    private int maxRateLimitWaitSec = 5;

    // ===== getters/setters =====
    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }

    public int getMaxTokens() { return maxTokens; }
    public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }

    public boolean isImageEnabled() { return imageEnabled; }
    public void setImageEnabled(boolean imageEnabled) { this.imageEnabled = imageEnabled; }

    public String getImageModel() { return imageModel; }
    public void setImageModel(String imageModel) { this.imageModel = imageModel; }

    public String getImageSize() { return imageSize; }
    public void setImageSize(String imageSize) { this.imageSize = imageSize; }

    public int getMaxRateLimitWaitSec() { return maxRateLimitWaitSec; }
    public void setMaxRateLimitWaitSec(int maxRateLimitWaitSec) { this.maxRateLimitWaitSec = maxRateLimitWaitSec; }
}
