package io.reminor.core.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class KeywordEmotionAnalyzerTest {
    private final KeywordEmotionAnalyzer analyzer = new KeywordEmotionAnalyzer();

    @Test
    void shouldScoreLexiconHitsInBothLanguages() {
        AnalysisResult result = analyzer.analyze(
            "Oggi sono felice, pranzo al lago con Maria e tanta voglia di ripartire con energia."
        );

        assertThat(result.emotions()).containsKeys(Emotions.NAMES.toArray(new String[0]));
        assertThat(result.emotions().get("felice")).isEqualTo(0.3);
        assertThat(result.emotions().get("motivato")).isEqualTo(0.6);
        assertThat(Emotions.dominant(result.emotions())).contains("motivato");
    }

    @Test
    void scoresShouldBeCappedAtOne() {
        AnalysisResult result = analyzer.analyze("anxious, worried, nervous, restless and full of anxiety");

        assertThat(result.emotions().get("ansioso")).isEqualTo(1.0);
    }

    @Test
    void neutralTextShouldHaveNoDominantEmotion() {
        AnalysisResult result = analyzer.analyze("Went to the post office.");

        assertThat(result.emotions().values()).containsOnly(0.0);
        assertThat(Emotions.dominant(result.emotions())).isEmpty();
    }

    @Test
    void singleWeakHitShouldNotDominate() {
        assertThat(Emotions.dominant(Map.of("felice", 0.2))).isEmpty();
        assertThat(Emotions.dominant(Map.of("felice", 0.21, "triste", 0.1))).contains("felice");
    }
}
