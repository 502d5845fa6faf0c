package io.reminor.cli;

import io.reminor.core.search.SearchHit;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "search", description = "Rank journal entries against a query")
public final class SearchCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(arity = "1..*", description = "Query")
    List<String> query;

    @Option(names = {"-n", "--limit"}, description = "Maximum number of results", defaultValue = "5")
    int limit;

    public SearchCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<SearchHit> hits = context.openRuntime().engine().search(String.join(" ", query), limit);
            if (hits.isEmpty()) {
                System.out.println("No matches");
                return 0;
            }
            for (SearchHit hit : hits) {
                System.out.println(String.format(Locale.ROOT, "%s  %.2f  %s", hit.date(), hit.score(), hit.source().name().toLowerCase(Locale.ROOT)));
                System.out.println("  " + hit.snippet().replace("\n", "\n  "));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Search failed: " + e.getMessage());
            return 1;
        }
    }
}
