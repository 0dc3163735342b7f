package com.chefai.backend.config;

import com.chefai.backend.common.web.RequestContextTaskDecorator;
import com.chefai.backend.mealplan.config.MealPlanProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncSchedulingConfig {

    /**
     * ✅ generator fan-out 上限：固定大小 pool，跟 request 幾天無關
     * queue 滿了由呼叫端自己跑（CallerRuns），task 不會被丟掉
     */
    @Bean("recipeGenerationExecutor")
    public TaskExecutor recipeGenerationExecutor(MealPlanProperties props) {
        MealPlanProperties.Executor cfg = props.getExecutor();
        return pool(cfg.getGenerationPoolSize(), cfg.getGenerationQueueCapacity(), "recipe-gen-",
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    @Bean("recipePersistenceExecutor")
    public TaskExecutor recipePersistenceExecutor(MealPlanProperties props) {
        MealPlanProperties.Executor cfg = props.getExecutor();
        return pool(cfg.getPersistencePoolSize(), cfg.getPersistenceQueueCapacity(), "recipe-save-",
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * 圖片搬移是 best-effort：queue 滿就直接拒絕（ImageEnrichment 會 log）
     */
    @Bean("imageEnrichmentExecutor")
    public TaskExecutor imageEnrichmentExecutor(MealPlanProperties props) {
        MealPlanProperties.Executor cfg = props.getExecutor();
        return pool(cfg.getEnrichmentPoolSize(), cfg.getEnrichmentQueueCapacity(), "image-enrich-",
                new ThreadPoolExecutor.AbortPolicy());
    }

    private static TaskExecutor pool(int size, int queue, String prefix, RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        int n = Math.max(1, size);
        ex.setCorePoolSize(n);
        ex.setMaxPoolSize(n);
        ex.setQueueCapacity(Math.max(0, queue));
        ex.setThreadNamePrefix(prefix);
        ex.setRejectedExecutionHandler(rejection);
        // worker thread 的 log 也帶 rid
        ex.setTaskDecorator(new RequestContextTaskDecorator());
        ex.initialize();
        return ex;
    }
}
