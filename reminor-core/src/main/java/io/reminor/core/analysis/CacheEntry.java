package io.reminor.core.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheEntry(String contentHash, String schemaVersion, AnalysisResult result, Instant createdAt) {
}
