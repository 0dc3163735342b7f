package com.chefai.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
public class BackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }

    /**
     * ✅ 測試環境不要啟動排程（retention worker 不該在測試中刪資料）
     */
    @Configuration
    @Profile("!test")
    @EnableScheduling
    static class SchedulingEnabledConfig {
        // no-op
    }
}
