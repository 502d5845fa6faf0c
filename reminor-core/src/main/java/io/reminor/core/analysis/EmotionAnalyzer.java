package io.reminor.core.analysis;

import java.io.IOException;

public interface EmotionAnalyzer {
    String name();

    AnalysisResult analyze(String text) throws IOException;
}
