package io.reminor.cli;

import io.reminor.core.config.model.ReminorConfig;
import io.reminor.core.engine.ReminorRuntime;
import java.io.IOException;

@FunctionalInterface
public interface RuntimeOpener {
    ReminorRuntime open(ReminorConfig config) throws IOException;
}
