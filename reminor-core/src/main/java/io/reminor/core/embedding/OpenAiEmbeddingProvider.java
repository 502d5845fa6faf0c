package io.reminor.core.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Calls an OpenAI-compatible {@code /embeddings} endpoint.
 */
public final class OpenAiEmbeddingProvider implements EmbeddingProvider {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String apiKey;
    private final HttpUrl apiBase;
    private final String model;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final int maxAttempts;

    public OpenAiEmbeddingProvider(String apiKey, String apiBase, String model) {
        this(apiKey, apiBase, model, 3);
    }

    public OpenAiEmbeddingProvider(String apiKey, String apiBase, String model, int maxAttempts) {
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.maxAttempts = Math.max(1, maxAttempts);
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(60))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return "openai:" + model;
    }

    @Override
    public float[] embed(String text) throws IOException {
        if (apiKey.isBlank()) {
            throw new IOException("missing API key for embedding model " + model);
        }

        long delayMs = 250;
        IOException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            boolean retryable;
            String payload = null;
            try (Response response = client.newCall(buildRequest(text)).execute()) {
                ResponseBody body = response.body();
                if (response.isSuccessful()) {
                    payload = body == null ? "" : body.string();
                    retryable = false;
                } else {
                    String errorBody = body == null ? "" : body.string();
                    last = new IOException("embedding request failed: HTTP " + response.code() + " " + errorBody);
                    retryable = response.code() == 429 || response.code() >= 500;
                }
            } catch (IOException ioe) {
                last = ioe;
                retryable = true;
            }

            if (payload != null) {
                return parse(payload);
            }
            if (!retryable || attempt == maxAttempts) {
                break;
            }
            sleep(delayMs);
            delayMs = Math.min(delayMs * 2, 2000);
        }
        throw last == null ? new IOException("embedding request exhausted retries") : last;
    }

    private Request buildRequest(String text) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("input", text == null ? "" : text);

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        return new Request.Builder()
            .url(apiBase.newBuilder().addPathSegment("embeddings").build())
            .post(body)
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .build();
    }

    private float[] parse(String body) throws IOException {
        JsonNode vector = mapper.readTree(body).path("data").path(0).path("embedding");
        if (!vector.isArray() || vector.isEmpty()) {
            throw new IOException("embedding response did not contain a vector");
        }
        float[] out = new float[vector.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = (float) vector.get(i).asDouble();
        }
        return out;
    }

    private void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
