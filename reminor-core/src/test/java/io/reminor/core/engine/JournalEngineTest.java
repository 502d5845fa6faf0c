package io.reminor.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.reminor.core.annotation.FileAnnotationStore;
import io.reminor.core.config.model.RetrievalConfig;
import io.reminor.core.embedding.HashingEmbeddingProvider;
import io.reminor.core.journal.FileEntryStore;
import io.reminor.core.search.SearchHit;
import io.reminor.core.search.SearchSource;
import io.reminor.core.search.entity.EntityIndex;
import io.reminor.core.search.entity.EntityIndexBuilder;
import io.reminor.core.search.entity.HeuristicEntityExtractor;
import io.reminor.core.search.lexical.Bm25LexicalIndex;
import io.reminor.core.search.vector.FileVectorStore;
import io.reminor.core.search.vector.VectorIndex;
import io.reminor.core.temporal.TemporalQueryResolver;
import io.reminor.core.text.Language;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JournalEngineTest {
    private static final LocalDate LUNCH = LocalDate.of(2024, 6, 15);
    private static final LocalDate SWIM = LocalDate.of(2024, 6, 16);

    @TempDir
    Path tempDir;

    @Test
    void entityQueryShouldReturnOnlyEntriesNamingThePerson() throws Exception {
        JournalEngine engine = engine();
        engine.saveEntry(LUNCH, "Lunch with Maria at the lake.");
        engine.saveEntry(SWIM, "Swim at the lake with friends.");

        List<SearchHit> hits = engine.search("what did I do with Maria at the lake?", 5);

        assertThat(hits).extracting(SearchHit::date).containsExactly(LUNCH);
        assertThat(hits.get(0).source()).isEqualTo(SearchSource.ENTITY);
    }

    @Test
    void savingTheSameTextTwiceShouldLeaveIndexesUnchanged() throws Exception {
        JournalEngine engine = engine();
        engine.saveEntry(LUNCH, "Lunch with Maria at the lake.");
        EntityIndex before = engine.entityIndex();
        EngineStatus statusBefore = engine.status();

        engine.saveEntry(LUNCH, "Lunch with Maria at the lake.");

        assertThat(engine.entityIndex()).isEqualTo(before);
        assertThat(engine.status()).isEqualTo(statusBefore);
    }

    @Test
    void overwritingAnEntryShouldDropStaleEntities() throws Exception {
        JournalEngine engine = engine();
        engine.saveEntry(LUNCH, "Lunch with Maria at the lake.");

        engine.saveEntry(LUNCH, "Dinner with Giulia in town.");

        assertThat(engine.entityIndex().mentions("maria")).isEmpty();
        assertThat(engine.search("Giulia", 5)).extracting(SearchHit::date).containsExactly(LUNCH);
    }

    @Test
    void startShouldIndexEntriesAlreadyOnDisk() throws Exception {
        Path journal = tempDir.resolve("journal");
        Files.createDirectories(journal);
        Files.writeString(journal.resolve("2024-06-15.txt"), "Lunch with Maria at the lake.");
        Files.writeString(journal.resolve("2024-06-16.txt"), "Swim at the lake with friends.");

        JournalEngine engine = engine();

        assertThat(engine.status()).isEqualTo(new EngineStatus(2, engine.entityIndex().size(), true, 2, true));
        assertThat(engine.entityIndex().entities()).contains("maria", "swim");
    }

    @Test
    void rebuildShouldPickUpFilesWrittenOutsideTheEngine() throws Exception {
        JournalEngine engine = engine();
        engine.saveEntry(LUNCH, "Lunch with Maria at the lake.");
        Files.writeString(tempDir.resolve("journal").resolve("2024-06-20.txt"), "Concert with Paolo downtown.");

        assertThat(engine.search("Paolo", 5)).extracting(SearchHit::date).doesNotContain(LocalDate.of(2024, 6, 20));
        engine.rebuildIndexes();

        assertThat(engine.search("Paolo", 5)).extracting(SearchHit::date).containsExactly(LocalDate.of(2024, 6, 20));
        assertThat(engine.status().vectors()).isEqualTo(2);
    }

    @Test
    void contextShouldIncludeYesterdayInFull() throws Exception {
        JournalEngine engine = engine();
        engine.saveEntry(LUNCH, "Lunch with Maria at the lake.");

        assertThat(engine.assembleContext("what did I do yesterday?"))
            .startsWith("=== 2024-06-15 ===\nLunch with Maria at the lake.\n");
    }

    @Test
    void annotationsShouldRoundTripThroughTheEngine() throws Exception {
        JournalEngine engine = engine();

        engine.saveAnnotation(LUNCH, Map.of("felice", 0.8), Map.of("mood_summary", "calm"));

        assertThat(engine.loadAnnotation(LUNCH)).hasValueSatisfying(record ->
            assertThat(record.emotions()).containsEntry("felice", 0.8));
        assertThat(engine.loadAnnotation(SWIM)).isEmpty();
    }

    @Test
    void failedVectorWriteShouldNotLeaveStaleDerivedState() throws Exception {
        Path vectorFile = tempDir.resolve("index").resolve("vectors.json");
        VectorIndex vectors = vectorIndex(vectorFile);
        Bm25LexicalIndex lexical = new Bm25LexicalIndex();
        JournalEngine engine = engine(vectors, lexical);
        engine.saveEntry(LUNCH, "Lunch with Maria at the lake.");
        assertThat(vectors.contains(LUNCH)).isTrue();

        Files.delete(vectorFile);
        Files.createDirectories(vectorFile);
        Files.writeString(vectorFile.resolve("blocker.txt"), "x");

        assertThatThrownBy(() -> engine.saveEntry(LUNCH, "Dinner with Giulia downtown."))
            .isInstanceOf(IOException.class);

        assertThat(engine.entry(LUNCH)).hasValueSatisfying(entry ->
            assertThat(entry.text()).isEqualTo("Dinner with Giulia downtown."));
        assertThat(vectors.contains(LUNCH)).isFalse();
        assertThat(vectors.query("Lunch with Maria at the lake.", 5)).isEmpty();
        assertThat(lexical.find("lake", 5)).isEmpty();
        assertThat(lexical.find("giulia", 5)).singleElement()
            .satisfies(hit -> assertThat(hit.date()).contains(LUNCH));
        assertThat(engine.entityIndex().mentions("maria")).isEmpty();
    }

    private JournalEngine engine() throws Exception {
        return engine(vectorIndex(tempDir.resolve("index").resolve("vectors.json")), new Bm25LexicalIndex());
    }

    private VectorIndex vectorIndex(Path vectorFile) {
        return new VectorIndex(
            Optional.of(new HashingEmbeddingProvider(256)),
            new FileVectorStore(vectorFile),
            RetrievalConfig.defaults().similarityFloor()
        );
    }

    private JournalEngine engine(VectorIndex vectors, Bm25LexicalIndex lexical) throws Exception {
        Clock clock = Clock.fixed(Instant.parse("2024-06-16T10:00:00Z"), ZoneOffset.UTC);
        RetrievalConfig config = RetrievalConfig.defaults();
        JournalEngine engine = new JournalEngine(
            new FileEntryStore(tempDir.resolve("journal")),
            vectors,
            Optional.of(lexical),
            new EntityIndexBuilder(new HeuristicEntityExtractor(Optional.empty(), List.of("lunch"))),
            new FileAnnotationStore(tempDir.resolve("annotations"), clock),
            new TemporalQueryResolver(clock, ZoneOffset.UTC),
            Language.ENGLISH,
            config
        );
        engine.start();
        return engine;
    }
}
