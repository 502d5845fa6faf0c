package io.reminor.app;

import io.reminor.cli.AnalyzeCommand;
import io.reminor.cli.AnnotationCommand;
import io.reminor.cli.CliContext;
import io.reminor.cli.ContextCommand;
import io.reminor.cli.ImportCommand;
import io.reminor.cli.InitCommand;
import io.reminor.cli.RebuildCommand;
import io.reminor.cli.ReminorCliCommand;
import io.reminor.cli.SearchCommand;
import io.reminor.cli.ShowCommand;
import io.reminor.cli.StatsCommand;
import io.reminor.cli.StatusCommand;
import io.reminor.cli.WriteCommand;
import io.reminor.core.config.ConfigPaths;
import io.reminor.core.config.ConfigService;
import java.nio.file.Path;
import picocli.CommandLine;

public final class ReminorApplication {

    private ReminorApplication() {
    }

    public static void main(String[] args) {
        CommandLine commandLine = commandLine(new CliContext(new ConfigService(), resolveConfigPath()));
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new ReminorCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("write", new WriteCommand(context));
        commandLine.addSubcommand("show", new ShowCommand(context));
        commandLine.addSubcommand("search", new SearchCommand(context));
        commandLine.addSubcommand("context", new ContextCommand(context));
        commandLine.addSubcommand("analyze", new AnalyzeCommand(context));
        commandLine.addSubcommand("annotation", new AnnotationCommand(context));
        commandLine.addSubcommand("rebuild", new RebuildCommand(context));
        commandLine.addSubcommand("import", new ImportCommand(context));
        commandLine.addSubcommand("stats", new StatsCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        return commandLine;
    }

    private static Path resolveConfigPath() {
        String override = System.getenv("REMINOR_CONFIG");
        if (override == null || override.isBlank()) {
            return ConfigPaths.defaultConfigPath();
        }
        return ConfigPaths.expandHome(override.trim());
    }
}
