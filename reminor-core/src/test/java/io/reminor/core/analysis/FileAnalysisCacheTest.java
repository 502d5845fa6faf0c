package io.reminor.core.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.reminor.core.text.ContentHash;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileAnalysisCacheTest {
    private static final String TEXT = "Oggi sono felice, pranzo al lago con Maria.";

    @TempDir
    Path tempDir;

    @Test
    void secondLookupShouldHitTheCache() throws Exception {
        FileAnalysisCache cache = new FileAnalysisCache(tempDir, "1.0");
        AtomicInteger calls = new AtomicInteger();

        AnalysisResult first = cache.getOrCompute(TEXT, text -> counted(calls));
        AnalysisResult second = cache.getOrCompute(TEXT, text -> counted(calls));

        assertThat(calls).hasValue(1);
        assertThat(second).isEqualTo(first);
        assertThat(cache.pathFor(ContentHash.sha256(TEXT))).exists();
    }

    @Test
    void schemaVersionChangeShouldInvalidateEntries() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        new FileAnalysisCache(tempDir, "1.0").getOrCompute(TEXT, text -> counted(calls));

        FileAnalysisCache upgraded = new FileAnalysisCache(tempDir, "2.0");
        upgraded.getOrCompute(TEXT, text -> counted(calls));
        upgraded.getOrCompute(TEXT, text -> counted(calls));

        assertThat(calls).hasValue(2);
    }

    @Test
    void failuresShouldPropagateWithoutWritingAnEntry() {
        FileAnalysisCache cache = new FileAnalysisCache(tempDir, "1.0");

        assertThatThrownBy(() -> cache.getOrCompute(TEXT, text -> {
            throw new IOException("model offline");
        })).isInstanceOf(IOException.class).hasMessage("model offline");
        assertThat(cache.pathFor(ContentHash.sha256(TEXT))).doesNotExist();
    }

    @Test
    void nullResultShouldBeRejected() {
        FileAnalysisCache cache = new FileAnalysisCache(tempDir, "1.0");

        assertThatThrownBy(() -> cache.getOrCompute(TEXT, text -> null)).isInstanceOf(IOException.class);
    }

    @Test
    void corruptEntryShouldBeRecomputed() throws Exception {
        FileAnalysisCache cache = new FileAnalysisCache(tempDir, "1.0");
        Files.writeString(cache.pathFor(ContentHash.sha256(TEXT)), "{ not json");
        AtomicInteger calls = new AtomicInteger();

        cache.getOrCompute(TEXT, text -> counted(calls));

        assertThat(calls).hasValue(1);
    }

    @Test
    void purgeStaleShouldRemoveOtherVersionsAndCorruptFiles() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        new FileAnalysisCache(tempDir, "1.0").getOrCompute("old text", text -> counted(calls));
        FileAnalysisCache cache = new FileAnalysisCache(tempDir, "2.0");
        cache.getOrCompute(TEXT, text -> counted(calls));
        Files.writeString(tempDir.resolve("broken.json"), "nope");

        assertThat(cache.purgeStale()).isEqualTo(2);
        assertThat(cache.pathFor(ContentHash.sha256(TEXT))).exists();
        assertThat(cache.pathFor(ContentHash.sha256("old text"))).doesNotExist();
    }

    @Test
    void blankSchemaVersionShouldBeRejected() {
        assertThatThrownBy(() -> new FileAnalysisCache(tempDir, " ")).isInstanceOf(IllegalArgumentException.class);
    }

    private static AnalysisResult counted(AtomicInteger calls) {
        calls.incrementAndGet();
        Map<String, Double> emotions = Emotions.zeros();
        emotions.put("felice", 0.7);
        return new AnalysisResult(emotions, Map.of("mood_summary", "happy"), Map.of());
    }
}
