package io.reminor.core.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.reminor.core.config.model.AnalysisConfig;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks an OpenAI-compatible chat completion endpoint to score a journal entry. The model is
 * told to answer with JSON only; any prose around the object is discarded.
 */
public final class LlmEmotionAnalyzer implements EmotionAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(LlmEmotionAnalyzer.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };
    private static final String SYSTEM_PROMPT = """
        You are a psychologist who analyses autobiographical writing. Identify the emotions \
        present in personal diary entries with precision and care. Always answer with valid \
        JSON only, with no text before or after it. If you cannot analyse the text, still \
        return valid JSON with every score set to 0.0.""";

    private final AnalysisConfig config;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public LlmEmotionAnalyzer(AnalysisConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.apiBase = HttpUrl.get(config.apiBase());
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(30))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return "llm:" + config.model();
    }

    @Override
    public AnalysisResult analyze(String text) throws IOException {
        if (config.apiKey() == null || config.apiKey().isBlank()) {
            throw new IOException("missing API key for analysis model " + config.model());
        }
        String excerpt = text == null ? "" : text;
        if (excerpt.length() > config.maxTextLength()) {
            LOG.debug("Truncating analysis input from {} to {} characters", excerpt.length(), config.maxTextLength());
            excerpt = excerpt.substring(0, config.maxTextLength()) + "...";
        }

        try (Response response = client.newCall(buildRequest(excerpt)).execute()) {
            ResponseBody body = response.body();
            String payload = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new IOException("analysis request failed: HTTP " + response.code() + " " + payload);
            }
            String content = mapper.readTree(payload).path("choices").path(0).path("message").path("content").asText("");
            return parse(content);
        }
    }

    AnalysisResult parse(String content) throws IOException {
        String json = extractJson(content);
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IOException("analysis reply is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new IOException("analysis reply is not a JSON object");
        }

        Map<String, Double> emotions = new LinkedHashMap<>();
        JsonNode scores = root.path("emotions");
        for (String emotion : Emotions.NAMES) {
            JsonNode score = scores.path(emotion);
            emotions.put(emotion, score.isNumber() ? Math.max(0.0, Math.min(1.0, score.asDouble())) : 0.0);
        }
        return new AnalysisResult(emotions, objectField(root, "daily_insights"), objectField(root, "profile_updates"));
    }

    static String extractJson(String content) {
        String trimmed = content == null ? "" : content.strip();
        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        return start >= 0 && end > start ? trimmed.substring(start, end + 1) : trimmed;
    }

    private Map<String, Object> objectField(JsonNode root, String name) {
        JsonNode node = root.path(name);
        return node.isObject() ? mapper.convertValue(node, OBJECT_MAP) : Map.of();
    }

    private Request buildRequest(String text) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", config.model());
        payload.put("messages", List.of(
            Map.of("role", "system", "content", SYSTEM_PROMPT),
            Map.of("role", "user", "content", prompt(text))
        ));
        payload.put("temperature", 0.3);
        payload.put("max_tokens", 1500);

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        return new Request.Builder()
            .url(apiBase.newBuilder().addPathSegment("chat").addPathSegment("completions").build())
            .post(body)
            .header("Authorization", "Bearer " + config.apiKey())
            .header("Content-Type", "application/json")
            .build();
    }

    static String prompt(String text) {
        StringBuilder scale = new StringBuilder();
        for (String emotion : Emotions.NAMES) {
            scale.append("    \"").append(emotion).append("\": 0.0,\n");
        }
        scale.setLength(scale.length() - 2);
        return """
            Analyse this personal diary entry and score each emotion from 0.0 (absent) to 1.0 \
            (very intense): 0.3 mild, 0.5 moderate, 0.7 strong. Several emotions may be present \
            at once. A neutral or descriptive entry gets low but non-zero serenity (sereno).

            TEXT:
            ---
            %s
            ---

            Answer ONLY with this JSON:
            {
              "emotions": {
            %s
              },
              "daily_insights": {
                "mood_summary": "one sentence describing the dominant mood",
                "energy_level": 0.5
              },
              "profile_updates": {}
            }""".formatted(text, scale);
    }
}
