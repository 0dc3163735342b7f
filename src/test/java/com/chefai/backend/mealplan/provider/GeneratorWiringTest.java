package com.chefai.backend.mealplan.provider;

import com.chefai.backend.mealplan.provider.config.GeneratorConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class GeneratorWiringTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(GeneratorConfig.class)
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withBean(GeneratorTelemetry.class, GeneratorTelemetry::new);

    @Test
    void stub_is_the_default() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(RecipeGenerator.class);
            assertThat(context.getBean(RecipeGenerator.class).providerCode()).isEqualTo("STUB");
        });
    }

    @Test
    void should_wire_openai_generator() {
        contextRunner
                .withPropertyValues(
                        "app.generator.provider=OPENAI",
                        "app.generator.openai.api-key=sk-test",
                        "app.generator.openai.base-url=http://localhost:9"
                )
                .run(context -> {
                    assertThat(context).hasSingleBean(RecipeGenerator.class);
                    assertThat(context.getBean(RecipeGenerator.class)).isInstanceOf(OpenAiRecipeGenerator.class);
                });
    }

    @Test
    void openai_without_key_fails_fast() {
        contextRunner
                .withPropertyValues("app.generator.provider=OPENAI")
                .run(context -> assertThat(context).hasFailed());
    }
}
