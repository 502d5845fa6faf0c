package io.reminor.core.analysis;

import java.io.IOException;

@FunctionalInterface
public interface AnalysisFunction {
    AnalysisResult apply(String text) throws IOException;
}
