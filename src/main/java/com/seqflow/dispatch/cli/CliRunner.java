package com.seqflow.dispatch.cli;

import com.seqflow.core.SeqflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final SeqflowCommand seqflowCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SeqflowCommand seqflowCommand, IFactory factory) {
        this.seqflowCommand = seqflowCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine(seqflowCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Command line for the seqflow tree. A {@link SeqflowException} escaping a
     * command is printed without a stack trace and exits as a failed run;
     * anything else keeps picocli's handling.
     */
    static CommandLine commandLine(SeqflowCommand root, IFactory factory) {
        var commandLine = new CommandLine(root, factory);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof SeqflowException) {
                log.debug("Command {} failed", cmd.getCommandName(), ex);
                ConsoleOutput.error(ex.getMessage());
                return PipelineCommand.EXIT_RUN_FAILED;
            }
            throw ex;
        });
        return commandLine;
    }
}
