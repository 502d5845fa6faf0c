package io.reminor.core.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.reminor.core.config.model.RetrievalConfig;
import io.reminor.core.journal.FileEntryStore;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectTextMatcherTest {

    @TempDir
    Path tempDir;

    private DirectTextMatcher matcher;

    @BeforeEach
    void setUp() throws Exception {
        FileEntryStore entries = new FileEntryStore(tempDir);
        entries.save(LocalDate.of(2024, 6, 15), "Lunch with Maria at the lake. The lake was calm.");
        entries.save(LocalDate.of(2024, 6, 16), "Long day at the office.");
        entries.save(LocalDate.of(2024, 5, 2), "Picnic by the lake, it may rain later.");
        matcher = new DirectTextMatcher(entries, RetrievalConfig.defaults());
    }

    @Test
    void shouldScoreKeywordOccurrencesByLength() {
        List<SearchHit> hits = matcher.search("the lake?", 5);

        assertThat(hits).extracting(SearchHit::date)
            .containsExactly(LocalDate.of(2024, 6, 15), LocalDate.of(2024, 5, 2));
        assertThat(hits.get(0).score()).isEqualTo(18.0);
        assertThat(hits.get(0).source()).isEqualTo(SearchSource.DIRECT);
        assertThat(hits.get(1).score()).isEqualTo(9.0);
    }

    @Test
    void monthNamesShouldMatchEveryEntryOfThatMonth() {
        List<SearchHit> hits = matcher.search("what did I do in June?", 5);

        assertThat(hits).extracting(SearchHit::date)
            .containsExactly(LocalDate.of(2024, 6, 16), LocalDate.of(2024, 6, 15));
        assertThat(hits).extracting(SearchHit::score).containsOnly(15.0);
        assertThat(hits.get(0).snippet()).isEqualTo("Long day at the office.");
    }

    @Test
    void italianMonthNamesShouldAlsoFilter() {
        assertThat(matcher.search("cosa ho fatto a giugno", 5)).hasSize(2);
    }

    @Test
    void mayShouldBeTreatedAsAPlainKeyword() {
        List<SearchHit> hits = matcher.search("may", 5);

        assertThat(hits).singleElement().satisfies(hit -> {
            assertThat(hit.date()).isEqualTo(LocalDate.of(2024, 5, 2));
            assertThat(hit.score()).isEqualTo(8.0);
        });
    }

    @Test
    void snippetShouldCenterOnTheBestKeyword() throws Exception {
        FileEntryStore entries = new FileEntryStore(tempDir.resolve("long"));
        String text = "a".repeat(300) + " the lake " + "b".repeat(600);
        entries.save(LocalDate.of(2024, 7, 1), text);

        SearchHit hit = new DirectTextMatcher(entries, RetrievalConfig.defaults()).search("lake", 1).get(0);

        assertThat(hit.snippet()).startsWith("...").endsWith("...").contains("the lake");
        assertThat(hit.snippet()).hasSize(400 + 6);
    }

    @Test
    void stopwordOnlyQueriesShouldReturnNothing() {
        assertThat(matcher.search("what did you do", 5)).isEmpty();
        assertThat(matcher.search("   ", 5)).isEmpty();
    }

    @Test
    void limitShouldBeValidated() {
        assertThat(matcher.search("lake", 0)).isEmpty();
        assertThat(matcher.search("lake", 1)).hasSize(1);
        assertThatThrownBy(() -> matcher.search("lake", -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
