package com.chefai.backend.mealplan.provider;

import com.chefai.backend.mealplan.mapper.GeneratorErrorMapper;
import com.chefai.backend.mealplan.provider.config.OpenAiProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
public class OpenAiRecipeGenerator implements RecipeGenerator {

    private static final String PROVIDER = "OPENAI";
    private static final int PREVIEW_LEN = 200;

    private static final String SYSTEM_PROMPT =
            "You are a professional chef and nutritionist. Create detailed, healthy recipes following the "
            + "dietary restrictions and allergies exactly. Always respond with complete, valid JSON containing all required fields.";

    private static final String JSON_SHAPE = """
            You must respond with a valid recipe in this exact JSON format:
            {
              "name": "Recipe Name",
              "description": "Brief description",
              "cuisine": "one of the preferred cuisines, or null",
              "prep_time": minutes (number),
              "cook_time": minutes (number),
              "servings": number,
              "ingredients": [{ "name": "ingredient", "amount": number, "unit": "unit" }],
              "instructions": ["step 1", "step 2"],
              "tags": ["tag1", "tag2"],
              "nutrition": { "calories": number, "protein": number, "carbs": number, "fat": number },
              "complexity": number (1 for easy, 2 for medium, 3 for hard)
            }""";

    private final RestClient http;
    private final OpenAiProperties props;
    private final ObjectMapper om;
    private final GeneratorTelemetry telemetry;

    public OpenAiRecipeGenerator(RestClient http, OpenAiProperties props, ObjectMapper om, GeneratorTelemetry telemetry) {
        this.http = http;
        this.props = props;
        this.om = om;
        this.telemetry = telemetry;
    }

    @Override
    public String providerCode() { return PROVIDER; }

    @Override
    public GeneratorResult generate(RecipeGenerationRequest req) throws Exception {
        long t0 = System.nanoTime();
        int maxAttempts = 1 + req.maxRetries();
        Set<String> excluded = req.excludeNames().stream()
                .map(OpenAiRecipeGenerator::nameKey)
                .collect(Collectors.toSet());

        Exception last = null;
        String rejectedName = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String prompt = buildPrompt(req, rejectedName);
                String content = callChatCompletion(prompt);

                ObjectNode draft = parseObjectOrNull(content);
                if (draft == null) {
                    log.warn("generator_unparseable taskId={} attempt={} preview={}",
                            req.taskId(), attempt, preview(content));
                    throw new IllegalStateException("GENERATOR_BAD_RESPONSE");
                }

                String name = draft.path("name").asText("").trim();
                if (!name.isEmpty() && excluded.contains(nameKey(name))) {
                    // 模型無視 excludeNames：算一次 attempt，帶著被拒的名字再要一次
                    log.info("generator_excluded_name taskId={} attempt={} name={}", req.taskId(), attempt, name);
                    rejectedName = name;
                    last = new IllegalStateException("GENERATOR_EXCLUDED_NAME");
                    continue;
                }

                if (props.isImageEnabled() && !name.isEmpty() && !draft.hasNonNull("image_url")) {
                    String imageUrl = tryGenerateImageUrl(name, req.taskId());
                    if (imageUrl != null) draft.put("image_url", imageUrl);
                }

                telemetry.ok(PROVIDER, props.getModel(), req.taskId(), msSince(t0), attempt, null, null);
                return new GeneratorResult(draft, PROVIDER);

            } catch (Exception e) {
                last = e;
                GeneratorErrorMapper.Mapped mapped = GeneratorErrorMapper.map(e);
                if (GeneratorErrorMapper.isNonRetryable(mapped.code()) || attempt >= maxAttempts) {
                    telemetry.fail(PROVIDER, props.getModel(), req.taskId(), msSince(t0), attempt,
                            mapped.code(), mapped.retryAfterSec());
                    throw e;
                }
                waitForRateLimit(mapped);
            }
        }

        GeneratorErrorMapper.Mapped mapped = GeneratorErrorMapper.map(last);
        telemetry.fail(PROVIDER, props.getModel(), req.taskId(), msSince(t0), maxAttempts, mapped.code(), null);
        throw (last != null) ? last : new IllegalStateException("GENERATOR_FAILED");
    }

    String buildPrompt(RecipeGenerationRequest req, String rejectedName) {
        String slot = req.mealSlot().wireName();
        StringBuilder sb = new StringBuilder();
        sb.append("Generate a unique and detailed recipe that is suitable for ").append(slot).append(". ")
          .append("Do not include recipes with Tofu unless the user chose Vegetarian or Vegan.\n");

        sb.append(req.dietary().isEmpty()
                ? "No specific dietary restrictions"
                : "Must follow dietary restrictions: " + String.join(", ", req.dietary())).append('\n');
        sb.append(req.allergies().isEmpty()
                ? "No allergies to consider"
                : "STRICT REQUIREMENT - Must completely avoid these allergens and any ingredients that contain them: "
                  + String.join(", ", req.allergies())).append('\n');
        // cuisinePriority 已經是「最少用到的排前面」
        sb.append(req.cuisinePriority().isEmpty()
                ? "No specific cuisine preference"
                : "Preferred cuisines, most preferred first: " + String.join(", ", req.cuisinePriority())).append('\n');
        sb.append(req.meatTypes().isEmpty()
                ? "No specific meat preference"
                : "Preferred meat types: " + String.join(", ", req.meatTypes())).append('\n');

        if (!req.excludeNames().isEmpty()) {
            sb.append("Must NOT generate any of these recipes: ").append(String.join(", ", req.excludeNames())).append('\n');
        }
        if (rejectedName != null) {
            sb.append("\"").append(rejectedName).append("\" was already used. Suggest a different recipe.\n");
        }
        sb.append('\n').append(JSON_SHAPE);
        return sb.toString();
    }

    private String callChatCompletion(String prompt) {
        requireApiKey();
        ObjectNode body = om.createObjectNode();
        body.put("model", props.getModel());
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
        messages.addObject().put("role", "user").put("content", prompt);
        body.putObject("response_format").put("type", "json_object");
        body.put("temperature", props.getTemperature());
        body.put("max_tokens", props.getMaxTokens());

        JsonNode resp = http.post()
                .uri("/v1/chat/completions")
                .header("Authorization", "Bearer " + props.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(JsonNode.class);

        if (resp == null) throw new IllegalStateException("GENERATOR_BAD_RESPONSE");
        JsonNode content = resp.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new IllegalStateException("GENERATOR_EMPTY_RESPONSE");
        }
        return content.asText();
    }

    /**
     * 圖片失敗不影響 recipe 本身（best-effort）
     */
    private String tryGenerateImageUrl(String recipeName, String taskId) {
        try {
            ObjectNode body = om.createObjectNode();
            body.put("model", props.getImageModel());
            body.put("prompt", "A professional, appetizing photo of " + recipeName
                               + ". The image should be well-lit, showing the complete dish from a top-down or 45-degree angle.");
            body.put("n", 1);
            body.put("size", props.getImageSize());

            JsonNode resp = http.post()
                    .uri("/v1/images/generations")
                    .header("Authorization", "Bearer " + props.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);

            String url = (resp == null) ? null : resp.path("data").path(0).path("url").asText(null);
            return (url == null || url.isBlank()) ? null : url;
        } catch (Exception e) {
            log.warn("generator_image_failed taskId={} name={} err={}", taskId, recipeName, e.toString());
            return null;
        }
    }

    private void waitForRateLimit(GeneratorErrorMapper.Mapped mapped) {
        if (!"GENERATOR_RATE_LIMITED".equals(mapped.code()) || mapped.retryAfterSec() == null) return;
        int sec = Math.min(mapped.retryAfterSec(), Math.max(0, props.getMaxRateLimitWaitSec()));
        if (sec <= 0) return;
        try {
            Thread.sleep(sec * 1000L);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("GENERATOR_INTERRUPTED", ie);
        }
    }

    private void requireApiKey() {
        String k = props.getApiKey();
        if (k == null || k.isBlank()) throw new IllegalStateException("GENERATOR_NOT_CONFIGURED");
    }

    private ObjectNode parseObjectOrNull(String content) {
        if (content == null || content.isBlank()) return null;
        String s = content.trim();
        // 偶爾會包 ```json ... ```
        if (s.startsWith("```")) {
            int first = s.indexOf('{');
            int lastBrace = s.lastIndexOf('}');
            if (first < 0 || lastBrace <= first) return null;
            s = s.substring(first, lastBrace + 1);
        }
        try {
            JsonNode n = om.readTree(s);
            return (n != null && n.isObject()) ? (ObjectNode) n : null;
        } catch (Exception e) {
            return null;
        }
    }

    static String nameKey(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    private static String preview(String s) {
        if (s == null) return "";
        String one = s.replace('\n', ' ').replace('\r', ' ');
        return one.length() > PREVIEW_LEN ? one.substring(0, PREVIEW_LEN) : one;
    }

    private static long msSince(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }
}
