package io.reminor.core.analysis;

import java.io.IOException;

/**
 * Memoizes analyses by content hash. Entries written under another schema version are
 * misses.
 */
public interface AnalysisCache {
    AnalysisResult getOrCompute(String text, AnalysisFunction fn) throws IOException;

    /** Deletes every entry whose schema version differs from the current one. */
    int purgeStale() throws IOException;

    String schemaVersion();
}
