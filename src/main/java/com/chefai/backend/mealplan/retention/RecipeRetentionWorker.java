package com.chefai.backend.mealplan.retention;

import com.chefai.backend.mealplan.repo.RecipeRepository;
import com.chefai.backend.mealplan.storage.ImageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "app.retention.recipes", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RecipeRetentionWorker {

    /** 單次最多跑幾批（避免一直卡在同一輪） */
    static final int MAX_BATCHES_PER_RUN = 50;

    private final RecipeRetentionProperties props;
    private final RecipeRepository repo;
    private final ImageStore imageStore;
    private final Clock clock;

    // 每小時整點後 10 分跑
    @Scheduled(cron = "0 10 * * * *")
    public void runHourly() {
        if (!props.isEnabled()) return;

        Instant now = Instant.now(clock);
        int batchSize = Math.max(1, props.getBatchSize());

        int deleted = 0;
        int imagesFailed = 0;
        for (int i = 0; i < MAX_BATCHES_PER_RUN; i++) {
            // 已收藏的不會被撈到
            List<String> ids = repo.findExpiredIds(now, PageRequest.of(0, batchSize));
            if (ids.isEmpty()) break;

            repo.deleteAllByIdInBatch(ids);
            deleted += ids.size();

            // row 刪掉後再清圖片檔
            for (String id : ids) {
                try {
                    imageStore.delete(id);
                } catch (Exception e) {
                    imagesFailed++;
                    log.warn("recipe retention image delete failed. id={} err={}", id, e.toString());
                }
            }

            if (ids.size() < batchSize) break;
        }

        if (deleted > 0) {
            log.info("recipe retention done. deleted={} imageDeleteFailed={}", deleted, imagesFailed);
        }
    }
}
