package io.reminor.core.analysis;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class Emotions {
    public static final List<String> NAMES = List.of(
        "felice", "triste", "arrabbiato", "ansioso", "sereno", "stressato", "grato", "motivato"
    );
    static final double DOMINANCE_THRESHOLD = 0.2;

    private Emotions() {
    }

    public static Map<String, Double> zeros() {
        Map<String, Double> out = new LinkedHashMap<>();
        NAMES.forEach(name -> out.put(name, 0.0));
        return out;
    }

    /** Highest-scoring emotion, if it scores above {@value #DOMINANCE_THRESHOLD}. */
    public static Optional<String> dominant(Map<String, Double> emotions) {
        if (emotions == null || emotions.isEmpty()) {
            return Optional.empty();
        }
        String best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> entry : emotions.entrySet()) {
            if (entry.getValue() != null && entry.getValue() > bestScore) {
                best = entry.getKey();
                bestScore = entry.getValue();
            }
        }
        return bestScore > DOMINANCE_THRESHOLD ? Optional.ofNullable(best) : Optional.empty();
    }
}
