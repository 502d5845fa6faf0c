package io.reminor.core.annotation;

import java.io.IOException;
import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Date-keyed store for emotion scores and insights. Reads never fail: a record that cannot
 * be read or decoded is reported as absent.
 */
public interface AnnotationStore {
    AnnotationRecord save(LocalDate date, Map<String, Double> emotions, Map<String, Object> insights) throws IOException;

    Optional<AnnotationRecord> load(LocalDate date);

    /** Emotion scores for each requested date, in request order; missing dates map to an empty map. */
    default Map<LocalDate, Map<String, Double>> loadRange(Collection<LocalDate> dates) {
        Map<LocalDate, Map<String, Double>> out = new LinkedHashMap<>();
        for (LocalDate date : dates) {
            out.put(date, load(date).map(AnnotationRecord::emotions).orElse(Map.of()));
        }
        return out;
    }

    /** Annotated dates, oldest first. */
    List<LocalDate> dates();
}
