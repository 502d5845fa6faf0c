package io.reminor.core.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import io.reminor.core.annotation.AnnotationRecord;
import io.reminor.core.annotation.FileAnnotationStore;
import io.reminor.core.config.model.AnalysisConfig;
import io.reminor.core.journal.FileEntryStore;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EmotionAnalysisServiceTest {
    private static final LocalDate DATE = LocalDate.of(2024, 6, 15);
    private static final String TEXT = "Oggi sono felice, pranzo al lago con Maria e tanta voglia di ripartire con energia.";

    @TempDir
    Path tempDir;

    private FileEntryStore entries;
    private FileAnnotationStore annotations;
    private FileAnalysisCache cache;

    @BeforeEach
    void setUp() throws Exception {
        entries = new FileEntryStore(tempDir.resolve("journal"));
        annotations = new FileAnnotationStore(tempDir.resolve("annotations"));
        cache = new FileAnalysisCache(tempDir.resolve("cache"), "2.0");
    }

    @Test
    void analyzeShouldSaveAnnotationWithProfileUpdates() throws Exception {
        entries.save(DATE, TEXT);
        StubAnalyzer analyzer = new StubAnalyzer();
        EmotionAnalysisService service = service(analyzer);

        Optional<AnnotationRecord> record = service.analyze(DATE);

        assertThat(record).hasValueSatisfying(saved -> {
            assertThat(saved.emotions()).containsEntry("grato", 0.9);
            assertThat(saved.insights()).containsEntry("mood_summary", "grateful");
            assertThat(saved.insights()).containsKey("profile_updates");
        });
        assertThat(annotations.load(DATE)).isPresent();
        assertThat(service.dominantEmotion(record.get().emotions())).contains("grato");
    }

    @Test
    void missingEntryShouldYieldNothing() throws Exception {
        assertThat(service(new StubAnalyzer()).analyze(DATE)).isEmpty();
        assertThat(annotations.dates()).isEmpty();
    }

    @Test
    void repeatedAnalysisShouldUseTheCache() throws Exception {
        StubAnalyzer analyzer = new StubAnalyzer();
        EmotionAnalysisService service = service(analyzer);

        service.analyzeText(TEXT);
        service.analyzeText(TEXT);

        assertThat(analyzer.calls).hasValue(1);
    }

    @Test
    void shortTextShouldNotReachTheAnalyzer() throws Exception {
        StubAnalyzer analyzer = new StubAnalyzer();

        AnalysisResult result = service(analyzer).analyzeText("Ok.");

        assertThat(analyzer.calls).hasValue(0);
        assertThat(result.emotions().values()).containsOnly(0.0);
    }

    @Test
    void analyzerFailureShouldFallBackWithoutCaching() throws Exception {
        StubAnalyzer analyzer = new StubAnalyzer();
        analyzer.failure = new IOException("model offline");
        EmotionAnalysisService service = service(analyzer);

        AnalysisResult fallback = service.analyzeText(TEXT);
        analyzer.failure = null;
        AnalysisResult recovered = service.analyzeText(TEXT);

        assertThat(Emotions.dominant(fallback.emotions())).contains("motivato");
        assertThat(Emotions.dominant(recovered.emotions())).contains("grato");
        assertThat(analyzer.calls).hasValue(2);
    }

    @Test
    void weeklyEmotionsShouldCoverEveryRequestedDay() throws Exception {
        annotations.save(DATE, Map.of("felice", 0.5), Map.of());

        Map<LocalDate, Map<String, Double>> week = service(new StubAnalyzer())
            .weeklyEmotions(List.of(DATE.minusDays(1), DATE));

        assertThat(week).containsEntry(DATE.minusDays(1), Map.of());
        assertThat(week.get(DATE)).containsEntry("felice", 0.5);
    }

    private EmotionAnalysisService service(EmotionAnalyzer analyzer) {
        return new EmotionAnalysisService(
            entries,
            annotations,
            cache,
            analyzer,
            new KeywordEmotionAnalyzer(),
            AnalysisConfig.defaults()
        );
    }

    private static final class StubAnalyzer implements EmotionAnalyzer {
        private final AtomicInteger calls = new AtomicInteger();
        private IOException failure;

        @Override
        public String name() {
            return "stub";
        }

        @Override
        public AnalysisResult analyze(String text) throws IOException {
            calls.incrementAndGet();
            if (failure != null) {
                throw failure;
            }
            Map<String, Double> emotions = Emotions.zeros();
            emotions.put("grato", 0.9);
            return new AnalysisResult(emotions, Map.of("mood_summary", "grateful"), Map.of("people", List.of("Maria")));
        }
    }
}
