package io.reminor.cli;

import io.reminor.core.engine.ReminorRuntime;
import io.reminor.core.temporal.TemporalQueryResolver;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Iterator;

final class CliDates {

    private CliDates() {
    }

    /**
     * Accepts an ISO date or anything the temporal resolver understands ("ieri", "15 giugno").
     * A missing value means today.
     */
    static LocalDate parse(String raw, ReminorRuntime runtime) {
        if (raw == null || raw.isBlank()) {
            return runtime.today();
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException ignored) {
            // fall through to natural language
        }
        Iterator<LocalDate> resolved = new TemporalQueryResolver(runtime.clock(), runtime.clock().getZone())
            .resolve(raw)
            .iterator();
        if (!resolved.hasNext()) {
            throw new IllegalArgumentException("unrecognized date: " + raw);
        }
        return resolved.next();
    }
}
