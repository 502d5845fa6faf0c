package io.reminor.cli;

import io.reminor.core.engine.JournalEngine;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "context", description = "Print the context block a companion model would receive for a question")
public final class ContextCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(arity = "0..*", description = "Question (omit for recent entries)")
    List<String> question;

    @Option(names = {"-n", "--max-snippets"}, description = "Maximum number of ranked snippets")
    Integer maxSnippets;

    public ContextCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            JournalEngine engine = context.openRuntime().engine();
            String query = question == null ? "" : String.join(" ", question);
            String block = maxSnippets == null ? engine.assembleContext(query) : engine.assembleContext(query, maxSnippets);
            System.out.println(block.isEmpty() ? "(no context)" : block);
            return 0;
        } catch (Exception e) {
            System.err.println("Context failed: " + e.getMessage());
            return 1;
        }
    }
}
