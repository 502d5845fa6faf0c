package io.reminor.cli;

import io.reminor.core.config.ConfigPaths;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "init", description = "Create or refresh the config file and the journal directory")
public final class InitCommand implements Callable<Integer> {
    private final CliContext context;

    public InitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            boolean created = context.configService().init(context.configPath());
            System.out.println((created ? "Created config: " : "Refreshed config: ") + context.configPath());
            String dataDir = context.configService().load(context.configPath()).journal().dataDir();
            System.out.println("Journal ready: " + ConfigPaths.resolveDataDir(dataDir));
            return 0;
        } catch (Exception e) {
            System.err.println("Init failed: " + e.getMessage());
            return 1;
        }
    }
}
