package io.reminor.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JournalConfig(
    @JsonAlias({"data_dir"}) String dataDir,
    String language,
    @JsonAlias({"annotation_backend"}) String annotationBackend
) {

    public static JournalConfig defaults() {
        return new JournalConfig("~/.reminor/journal", "it", "file");
    }
}
