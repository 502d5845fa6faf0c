package io.reminor.cli;

import io.reminor.core.config.ConfigService;
import io.reminor.core.engine.ReminorRuntime;
import io.reminor.core.engine.ReminorRuntimeFactory;
import java.io.IOException;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    RuntimeOpener runtimeOpener
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, ReminorRuntimeFactory::open);
    }

    /** Loads the configuration and opens the journal it points to. */
    public ReminorRuntime openRuntime() throws IOException {
        return runtimeOpener.open(configService.load(configPath));
    }
}
