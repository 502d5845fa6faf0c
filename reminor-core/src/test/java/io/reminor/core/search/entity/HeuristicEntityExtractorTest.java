package io.reminor.core.search.entity;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class HeuristicEntityExtractorTest {

    @Test
    void shouldCollectCapitalizedWordsAndVocabulary() {
        HeuristicEntityExtractor extractor = new HeuristicEntityExtractor(Optional.empty(), List.of("Pizza"));

        Map<String, Integer> entities = extractor.extract(
            "Pizza with Maria and Luca in Roma. Maria was happy. Monday pizza again."
        );

        assertThat(entities).containsExactlyInAnyOrderEntriesOf(Map.of(
            "pizza", 2,
            "maria", 2,
            "luca", 1,
            "roma", 1
        ));
    }

    @Test
    void shouldSkipStopwordsAndCalendarWordsAtSentenceStart() {
        HeuristicEntityExtractor extractor = new HeuristicEntityExtractor(Optional.empty(), List.of());

        Map<String, Integer> entities = extractor.extract("The meeting was long. Oggi pioggia. Giugno caldo.");

        assertThat(entities).doesNotContainKeys("the", "oggi", "giugno");
    }

    @Test
    void vocabularyShouldMatchInsideLongerWordsButCountAtLeastOnce() {
        HeuristicEntityExtractor extractor = new HeuristicEntityExtractor(Optional.empty(), List.of("mare"));

        assertThat(extractor.extract("giornata al maremoto")).containsEntry("mare", 1);
    }

    @Test
    void shouldAddRecognizedPeoplePlacesAndOrganizations() {
        NamedEntityRecognizer recognizer = text -> List.of(
            new NamedEntity("New  York", EntityType.PLACE),
            new NamedEntity("Acme", EntityType.ORGANIZATION),
            new NamedEntity("42", EntityType.OTHER),
            new NamedEntity("Al", EntityType.PERSON)
        );
        HeuristicEntityExtractor extractor = new HeuristicEntityExtractor(Optional.of(recognizer), List.of());

        Map<String, Integer> entities = extractor.extract("flew to new york for acme");

        assertThat(entities).containsOnlyKeys("new york", "acme");
    }

    @Test
    void recognizerFailureShouldFallBackToHeuristics() {
        NamedEntityRecognizer broken = text -> {
            throw new IllegalStateException("model not loaded");
        };
        HeuristicEntityExtractor extractor = new HeuristicEntityExtractor(Optional.of(broken), List.of());

        assertThat(extractor.extract("Dinner with Giulia")).containsOnlyKeys("dinner", "giulia");
    }

    @Test
    void blankTextShouldYieldNothing() {
        HeuristicEntityExtractor extractor = new HeuristicEntityExtractor(Optional.empty(), List.of("pizza"));

        assertThat(extractor.extract("   ")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }
}
