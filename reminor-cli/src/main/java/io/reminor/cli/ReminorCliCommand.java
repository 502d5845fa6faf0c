package io.reminor.cli;

import picocli.CommandLine.Command;

@Command(name = "reminor", mixinStandardHelpOptions = true, description = "Personal journal with retrieval and emotion tracking")
public final class ReminorCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
