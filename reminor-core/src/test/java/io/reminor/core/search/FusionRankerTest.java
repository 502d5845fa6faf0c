package io.reminor.core.search;

import static org.assertj.core.api.Assertions.assertThat;

import io.reminor.core.config.model.RetrievalConfig;
import io.reminor.core.journal.FileEntryStore;
import io.reminor.core.search.entity.EntityIndex;
import io.reminor.core.search.entity.EntityIndexBuilder;
import io.reminor.core.search.entity.HeuristicEntityExtractor;
import io.reminor.core.search.lexical.LexicalDocument;
import io.reminor.core.search.lexical.LexicalHit;
import io.reminor.core.search.lexical.LexicalSearchProvider;
import io.reminor.core.search.vector.FileVectorStore;
import io.reminor.core.search.vector.VectorIndex;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FusionRankerTest {
    private static final LocalDate LUNCH = LocalDate.of(2024, 6, 15);
    private static final LocalDate SWIM = LocalDate.of(2024, 6, 16);

    @TempDir
    Path tempDir;

    private FileEntryStore entries;
    private VectorIndex vectors;

    @BeforeEach
    void setUp() throws Exception {
        entries = new FileEntryStore(tempDir.resolve("journal"));
        entries.save(LUNCH, "Lunch with Maria at the lake.");
        entries.save(SWIM, "Swim at the lake with friends.");
        vectors = new VectorIndex(Optional.empty(), new FileVectorStore(tempDir.resolve("vectors.json")), 0.2);
    }

    @Test
    void entityHitsShouldShortCircuitOtherStrategies() {
        EntityIndex index = new EntityIndexBuilder(new HeuristicEntityExtractor(Optional.empty(), List.of("lunch")))
            .build(entries.entries());
        FusionRanker ranker = ranker(() -> index, Optional.empty());

        List<SearchHit> hits = ranker.search("what did I do with Maria at the lake?", 5);

        assertThat(hits).singleElement().satisfies(hit -> {
            assertThat(hit.date()).isEqualTo(LUNCH);
            assertThat(hit.source()).isEqualTo(SearchSource.ENTITY);
            assertThat(hit.score()).isEqualTo(1.0);
            assertThat(hit.snippet()).isEqualTo("Lunch with Maria at the lake.");
        });
    }

    @Test
    void higherDirectScoreShouldReplaceLowerLexicalScore() {
        StubLexical lexical = new StubLexical(new LexicalHit("Journal 2024-06-15", "lexical", 3.0));
        FusionRanker ranker = ranker(EntityIndex::empty, Optional.of(lexical));

        List<SearchHit> hits = ranker.search("lake", 5);

        assertThat(hits).hasSize(2);
        assertThat(hits).filteredOn(hit -> hit.date().equals(LUNCH)).singleElement().satisfies(hit -> {
            assertThat(hit.source()).isEqualTo(SearchSource.DIRECT);
            assertThat(hit.score()).isEqualTo(9.0);
        });
    }

    @Test
    void strongerLexicalHitShouldSurviveAndRankFirst() {
        StubLexical lexical = new StubLexical(new LexicalHit("Journal 2024-06-15", "lexical", 12.0));
        FusionRanker ranker = ranker(EntityIndex::empty, Optional.of(lexical));

        List<SearchHit> hits = ranker.search("lake", 5);

        assertThat(hits.get(0).date()).isEqualTo(LUNCH);
        assertThat(hits.get(0).source()).isEqualTo(SearchSource.LEXICAL);
        assertThat(hits.get(0).score()).isEqualTo(12.0);
    }

    @Test
    void tiesShouldKeepTheEarlierStrategy() {
        StubLexical lexical = new StubLexical(new LexicalHit("Journal 2024-06-15", "lexical", 9.0));
        FusionRanker ranker = ranker(EntityIndex::empty, Optional.of(lexical));

        List<SearchHit> hits = ranker.search("lake", 5);

        assertThat(hits).extracting(SearchHit::source).containsExactly(SearchSource.LEXICAL, SearchSource.DIRECT);
    }

    @Test
    void lexicalHitsWithoutDatesShouldBeSkipped() {
        StubLexical lexical = new StubLexical(new LexicalHit("Shopping list", "lexical", 50.0));
        FusionRanker ranker = ranker(EntityIndex::empty, Optional.of(lexical));

        assertThat(ranker.search("lake", 5)).extracting(SearchHit::source).containsOnly(SearchSource.DIRECT);
    }

    @Test
    void failingStrategiesShouldDegradeToTheRemainingOnes() {
        StubLexical lexical = new StubLexical();
        lexical.failure = new IOException("index locked");
        FusionRanker ranker = ranker(() -> {
            throw new IllegalStateException("index not built");
        }, Optional.of(lexical));

        assertThat(ranker.search("lake", 5)).hasSize(2);
    }

    @Test
    void resultsShouldBeTruncatedToLimit() {
        FusionRanker ranker = ranker(EntityIndex::empty, Optional.empty());

        assertThat(ranker.search("lake", 1)).hasSize(1);
        assertThat(ranker.search("lake", 0)).isEmpty();
        assertThat(ranker.search(" ", 3)).isEmpty();
    }

    @Test
    void maximumLimitShouldStillReturnDirectMatches() {
        FusionRanker ranker = ranker(EntityIndex::empty, Optional.empty());

        List<SearchHit> hits = ranker.search("lake", Integer.MAX_VALUE);

        assertThat(hits).extracting(SearchHit::date).containsExactlyInAnyOrder(LUNCH, SWIM);
        assertThat(hits).extracting(SearchHit::source).containsOnly(SearchSource.DIRECT);
    }

    private FusionRanker ranker(Supplier<EntityIndex> index, Optional<LexicalSearchProvider> lexical) {
        RetrievalConfig config = RetrievalConfig.defaults();
        return new FusionRanker(index, vectors, lexical, new DirectTextMatcher(entries, config), entries, config);
    }

    private static final class StubLexical implements LexicalSearchProvider {
        private final List<LexicalHit> hits;
        private IOException failure;

        StubLexical(LexicalHit... hits) {
            this.hits = new ArrayList<>(List.of(hits));
        }

        @Override
        public void put(LexicalDocument document) {
        }

        @Override
        public void putMany(List<LexicalDocument> documents) {
        }

        @Override
        public List<LexicalHit> find(String query, int k) throws IOException {
            if (failure != null) {
                throw failure;
            }
            return hits;
        }

        @Override
        public void clear() {
        }
    }
}
