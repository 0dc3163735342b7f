package com.chefai.backend.mealplan.task;

import com.chefai.backend.mealplan.mapper.GeneratorErrorMapper;
import com.chefai.backend.mealplan.model.GenerationTask;
import com.chefai.backend.mealplan.model.MissingSlotReason;
import com.chefai.backend.mealplan.model.Preferences;
import com.chefai.backend.mealplan.model.RecipeDraft;
import com.chefai.backend.mealplan.model.TaskOutcome;
import com.chefai.backend.mealplan.provider.RecipeGenerationRequest;
import com.chefai.backend.mealplan.provider.RecipeGenerator;
import com.chefai.backend.mealplan.service.NameDeduplicator;
import com.chefai.backend.mealplan.service.ResultValidator;
import com.chefai.backend.mealplan.web.RecipeValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Fans generation tasks out to the bounded generation pool and joins them all.
 * <p>
 * Per task: generate → validate → claim name. A failing task becomes a failure outcome and
 * never affects its siblings. Outcomes are returned in task order, not completion order.
 */
@Slf4j
@Component
public class GenerationScheduler {

    private final Executor executor;
    private final ResultValidator validator;

    public GenerationScheduler(@Qualifier("recipeGenerationExecutor") Executor executor,
                               ResultValidator validator) {
        this.executor = executor;
        this.validator = validator;
    }

    public List<TaskOutcome> run(List<GenerationTask> tasks,
                                 Preferences prefs,
                                 RecipeGenerator generator,
                                 NameDeduplicator dedup,
                                 int maxRetries) {
        if (tasks == null || tasks.isEmpty()) return List.of();

        List<CompletableFuture<TaskOutcome>> futures = new ArrayList<>(tasks.size());
        for (GenerationTask task : tasks) {
            futures.add(submit(task, prefs, generator, dedup, maxRetries));
        }

        // 單一 join point：全部完成才往下走
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<TaskOutcome> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<TaskOutcome> f : futures) outcomes.add(f.join());
        return outcomes;
    }

    private CompletableFuture<TaskOutcome> submit(GenerationTask task,
                                                  Preferences prefs,
                                                  RecipeGenerator generator,
                                                  NameDeduplicator dedup,
                                                  int maxRetries) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> runOne(task, prefs, generator, dedup, maxRetries), executor)
                    .exceptionally(ex -> {
                        log.error("generation_task_crashed taskId={}", task.taskId(), ex);
                        return TaskOutcome.failure(task, MissingSlotReason.GENERATION_FAILED, "UNEXPECTED_ERROR");
                    });
        } catch (RuntimeException rejected) {
            log.warn("generation_task_rejected taskId={} err={}", task.taskId(), rejected.toString());
            return CompletableFuture.completedFuture(
                    TaskOutcome.failure(task, MissingSlotReason.GENERATION_FAILED, "EXECUTOR_REJECTED"));
        }
    }

    TaskOutcome runOne(GenerationTask task,
                       Preferences prefs,
                       RecipeGenerator generator,
                       NameDeduplicator dedup,
                       int maxRetries) {
        // 每個 task 在出發前拍一次 used-name snapshot
        RecipeGenerationRequest req = new RecipeGenerationRequest(
                task.taskId(),
                prefs.dietary(),
                prefs.allergies(),
                task.cuisinePriority(),
                prefs.meatTypes(),
                task.mealSlot(),
                dedup.snapshot(),
                maxRetries
        );

        RecipeGenerator.GeneratorResult result;
        try {
            result = generator.generate(req);
            if (result == null || result.draft() == null) throw new IllegalStateException("GENERATOR_EMPTY_RESULT");
        } catch (Exception e) {
            if (e instanceof InterruptedException) Thread.currentThread().interrupt();
            GeneratorErrorMapper.Mapped mapped = GeneratorErrorMapper.map(e);
            log.warn("generation_failed taskId={} day={} slot={} code={}",
                    task.taskId(), task.day(), task.mealSlot().wireName(), mapped.code());
            return TaskOutcome.failure(task, MissingSlotReason.GENERATION_FAILED, mapped.code());
        }

        RecipeDraft draft;
        try {
            draft = validator.validate(result.draft(), task.cuisinePriority());
        } catch (RecipeValidationException e) {
            log.warn("generation_invalid taskId={} day={} slot={} code={}",
                    task.taskId(), task.day(), task.mealSlot().wireName(), e.code());
            return TaskOutcome.failure(task, MissingSlotReason.VALIDATION_FAILED, e.code());
        }

        // add-if-absent：同名只會有一個 task 拿到
        if (!dedup.claim(draft.name())) {
            log.warn("generation_duplicate taskId={} day={} slot={} name={}",
                    task.taskId(), task.day(), task.mealSlot().wireName(), draft.name());
            return TaskOutcome.failure(task, MissingSlotReason.DUPLICATE_NAME, "DUPLICATE_NAME");
        }

        log.debug("generation_ok taskId={} provider={} name={}", task.taskId(), result.provider(), draft.name());
        return TaskOutcome.success(task, draft);
    }
}
