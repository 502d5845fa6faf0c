package io.reminor.cli;

import io.reminor.core.config.ConfigPaths;
import io.reminor.core.config.model.ReminorConfig;
import io.reminor.core.engine.EngineStatus;
import io.reminor.core.engine.ReminorRuntime;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and index status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ReminorConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Journal: " + ConfigPaths.resolveDataDir(config.journal().dataDir()));
            System.out.println("Language: " + config.journal().language());
            System.out.println("Annotation backend: " + config.journal().annotationBackend());
            System.out.println("Embedding provider: " + config.embedding().provider());
            System.out.println("Analysis model configured: " + config.analysis().configured());
            System.out.println("Analysis schema version: " + config.analysis().schemaVersion());

            ReminorRuntime runtime = context.runtimeOpener().open(config);
            EngineStatus status = runtime.engine().status();
            System.out.println("Entries: " + status.entries());
            System.out.println("Entities: " + status.entities());
            System.out.println("Semantic search: " + (status.semanticEnabled() ? status.vectors() + " vectors" : "disabled"));
            System.out.println("Lexical search: " + (status.lexicalEnabled() ? "enabled" : "disabled"));
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
