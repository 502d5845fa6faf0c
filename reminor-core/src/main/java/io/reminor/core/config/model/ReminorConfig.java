package io.reminor.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReminorConfig(
    JournalConfig journal,
    RetrievalConfig retrieval,
    EmbeddingConfig embedding,
    AnalysisConfig analysis
) {

    public static ReminorConfig defaults() {
        return new ReminorConfig(
            JournalConfig.defaults(),
            RetrievalConfig.defaults(),
            EmbeddingConfig.defaults(),
            AnalysisConfig.defaults()
        );
    }
}
