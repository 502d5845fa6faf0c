package io.reminor.core.analysis;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisResult(
    Map<String, Double> emotions,
    @JsonAlias({"daily_insights"}) Map<String, Object> dailyInsights,
    @JsonAlias({"profile_updates"}) Map<String, Object> profileUpdates
) {

    public AnalysisResult {
        emotions = copy(emotions);
        dailyInsights = copy(dailyInsights);
        profileUpdates = copy(profileUpdates);
    }

    /** Every known emotion at zero, no insights. */
    public static AnalysisResult empty() {
        return new AnalysisResult(Emotions.zeros(), Map.of(), Map.of());
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
