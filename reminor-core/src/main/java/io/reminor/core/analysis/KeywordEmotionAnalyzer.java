package io.reminor.core.analysis;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Offline analyzer: every lexicon word found in the text adds 0.3 to its emotion, capped at
 * 1.0. Used when no model is configured or the model call fails.
 */
public final class KeywordEmotionAnalyzer implements EmotionAnalyzer {
    static final double HIT_WEIGHT = 0.3;

    private static final Map<String, List<String>> LEXICON = Map.of(
        "felice", List.of("felice", "contento", "gioia", "bene", "fantastico", "ottimo",
            "happy", "glad", "joy", "great", "wonderful"),
        "triste", List.of("triste", "male", "depresso", "dolore", "piango", "sconforto",
            "sad", "depressed", "crying", "grief", "lonely"),
        "arrabbiato", List.of("arrabbiato", "furioso", "rabbia", "odio", "irritato",
            "angry", "furious", "rage", "hate", "annoyed"),
        "ansioso", List.of("ansioso", "ansia", "preoccupato", "nervoso", "agitato",
            "anxious", "anxiety", "worried", "nervous", "restless"),
        "sereno", List.of("sereno", "calmo", "tranquillo", "pace", "rilassato",
            "calm", "peaceful", "relaxed", "serene"),
        "stressato", List.of("stressato", "stress", "pressione", "sovraccarico",
            "stressed", "pressure", "overwhelmed"),
        "grato", List.of("grato", "grazie", "riconoscente", "apprezzo", "fortuna",
            "grateful", "thankful", "thanks", "lucky"),
        "motivato", List.of("motivato", "determinato", "energia", "voglia", "obiettivo",
            "motivated", "determined", "energy", "goal")
    );

    @Override
    public String name() {
        return "keywords";
    }

    @Override
    public AnalysisResult analyze(String text) {
        Map<String, Double> emotions = Emotions.zeros();
        if (text == null || text.isBlank()) {
            return new AnalysisResult(emotions, Map.of(), Map.of());
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        for (String emotion : Emotions.NAMES) {
            double score = 0.0;
            for (String word : LEXICON.get(emotion)) {
                if (lowered.contains(word)) {
                    score = Math.min(score + HIT_WEIGHT, 1.0);
                }
            }
            emotions.put(emotion, score);
        }
        return new AnalysisResult(emotions, Map.of(), Map.of());
    }
}
