package com.chefai.backend.mealplan.provider.config;

import com.chefai.backend.mealplan.provider.GeneratorTelemetry;
import com.chefai.backend.mealplan.provider.OpenAiRecipeGenerator;
import com.chefai.backend.mealplan.provider.RecipeGenerator;
import com.chefai.backend.mealplan.provider.StubRecipeGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(OpenAiProperties.class)
public class GeneratorConfig {

    /**
     * ✅ 只有 provider=STUB（或沒設定）才提供 stub，避免 RecipeGenerator 變成兩個 Bean
     */
    @Bean
    @ConditionalOnProperty(prefix = "app.generator", name = "provider", havingValue = "STUB", matchIfMissing = true)
    public RecipeGenerator stubRecipeGenerator(ObjectMapper om) {
        return new StubRecipeGenerator(om);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.generator", name = "provider", havingValue = "OPENAI")
    public RestClient openAiRestClient(OpenAiProperties props) {
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout((int) props.getConnectTimeout().toMillis());
        f.setReadTimeout((int) props.getReadTimeout().toMillis());

        return RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(f)
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.generator", name = "provider", havingValue = "OPENAI")
    public RecipeGenerator openAiRecipeGenerator(
            RestClient openAiRestClient,
            OpenAiProperties props,
            ObjectMapper om,
            GeneratorTelemetry telemetry
    ) {
        // ✅ Fail-fast：啟動就抓到 key 缺失
        String k = props.getApiKey();
        if (k == null || k.isBlank()) throw new IllegalStateException("OPENAI_API_KEY_MISSING");
        if (props.getBaseUrl() == null || props.getBaseUrl().isBlank()) throw new IllegalStateException("OPENAI_BASE_URL_MISSING");

        return new OpenAiRecipeGenerator(openAiRestClient, props, om, telemetry);
    }
}
