package io.reminor.cli;

import io.reminor.core.engine.EngineStatus;
import io.reminor.core.engine.ReminorRuntime;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "rebuild", description = "Rebuild search indexes from the journal files")
public final class RebuildCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--purge-cache", description = "Also delete analysis cache entries from older schema versions")
    boolean purgeCache;

    public RebuildCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ReminorRuntime runtime = context.openRuntime();
            runtime.engine().rebuildIndexes();
            EngineStatus status = runtime.engine().status();
            System.out.println("Indexed " + status.entries() + " entries, " + status.entities() + " entities, " + status.vectors() + " vectors");
            if (purgeCache) {
                System.out.println("Purged " + runtime.analysisCache().purgeStale() + " stale cache entries");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Rebuild failed: " + e.getMessage());
            return 1;
        }
    }
}
