package io.reminor.core.analysis;

import io.reminor.core.annotation.AnnotationRecord;
import io.reminor.core.annotation.AnnotationStore;
import io.reminor.core.config.model.AnalysisConfig;
import io.reminor.core.journal.Entry;
import io.reminor.core.journal.EntryStore;
import java.io.IOException;
import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs emotion analysis for a journal day and records the outcome as its annotation.
 */
public final class EmotionAnalysisService {
    private static final Logger LOG = LoggerFactory.getLogger(EmotionAnalysisService.class);

    private final EntryStore entries;
    private final AnnotationStore annotations;
    private final AnalysisCache cache;
    private final EmotionAnalyzer analyzer;
    private final EmotionAnalyzer fallback;
    private final AnalysisConfig config;

    public EmotionAnalysisService(
        EntryStore entries,
        AnnotationStore annotations,
        AnalysisCache cache,
        EmotionAnalyzer analyzer,
        EmotionAnalyzer fallback,
        AnalysisConfig config
    ) {
        this.entries = Objects.requireNonNull(entries, "entries must not be null");
        this.annotations = Objects.requireNonNull(annotations, "annotations must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Analyzes the entry for {@code date} and saves the annotation.
     *
     * @return the saved annotation, or empty when there is no entry for that day
     */
    public Optional<AnnotationRecord> analyze(LocalDate date) throws IOException {
        Optional<Entry> entry = entries.find(date);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        AnalysisResult result = analyzeText(entry.get().text());
        Map<String, Object> insights = new LinkedHashMap<>(result.dailyInsights());
        if (!result.profileUpdates().isEmpty()) {
            insights.put("profile_updates", result.profileUpdates());
        }
        return Optional.of(annotations.save(date, result.emotions(), insights));
    }

    /**
     * Scores {@code text}. Short texts get an empty analysis that is not cached. Results from
     * the fallback analyzer are not cached either, so a later successful model call replaces
     * them.
     */
    public AnalysisResult analyzeText(String text) throws IOException {
        if (text == null || text.strip().length() < config.minTextLength()) {
            return AnalysisResult.empty();
        }
        try {
            return cache.getOrCompute(text, analyzer::analyze);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Analyzer {} failed, using {}: {}", analyzer.name(), fallback.name(), e.getMessage());
            return fallback.analyze(text);
        }
    }

    public Map<LocalDate, Map<String, Double>> weeklyEmotions(Collection<LocalDate> dates) {
        return annotations.loadRange(dates);
    }

    public Optional<String> dominantEmotion(Map<String, Double> emotions) {
        return Emotions.dominant(emotions);
    }
}
