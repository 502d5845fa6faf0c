package io.reminor.core.engine;

import io.reminor.core.analysis.AnalysisCache;
import io.reminor.core.analysis.EmotionAnalysisService;
import io.reminor.core.config.model.ReminorConfig;
import io.reminor.core.journal.EntryStore;
import io.reminor.core.journal.JournalStats;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;

/**
 * Everything a front end needs, wired from one configuration.
 */
public record ReminorRuntime(
    ReminorConfig config,
    Path dataDir,
    EntryStore entries,
    JournalEngine engine,
    EmotionAnalysisService analysis,
    AnalysisCache analysisCache,
    JournalImporter importer,
    Clock clock
) {

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public JournalStats stats() {
        return JournalStats.compute(entries.entries(), today());
    }
}
