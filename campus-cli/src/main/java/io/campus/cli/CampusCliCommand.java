package io.campus.cli;

import picocli.CommandLine.Command;

@Command(name = "campus", mixinStandardHelpOptions = true, description = "Multilingual campus help desk assistant")
public final class CampusCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
