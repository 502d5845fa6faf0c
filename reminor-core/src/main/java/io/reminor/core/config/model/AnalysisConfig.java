package io.reminor.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisConfig(
    @JsonAlias({"schema_version"}) String schemaVersion,
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    String model,
    @JsonAlias({"max_text_length"}) int maxTextLength,
    @JsonAlias({"min_text_length"}) int minTextLength
) {

    public static AnalysisConfig defaults() {
        return new AnalysisConfig("2.0", "", "https://api.groq.com/openai/v1", "llama-3.3-70b-versatile", 4000, 50);
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
