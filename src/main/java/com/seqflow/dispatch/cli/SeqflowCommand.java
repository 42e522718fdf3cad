package com.seqflow.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Seqflow.
 * Routes to one subcommand per pipeline.
 */
@Command(
        name = "seqflow",
        mixinStandardHelpOptions = true,
        version = "Seqflow 0.1.0",
        description = "Runs containerized sequencing pipelines over a sample sheet",
        subcommands = {
                AssembleFamliCommand.class,
                MapFamliCommand.class,
                MapVirusesCommand.class,
                Humann2Command.class,
                AnnotateGenomeCommand.class,
                FetchPatricCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SeqflowCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
