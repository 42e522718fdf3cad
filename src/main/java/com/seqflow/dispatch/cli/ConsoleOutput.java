package com.seqflow.dispatch.cli;

import com.seqflow.core.events.PipelineEvent;
import com.seqflow.core.scheduler.RunReport;
import com.seqflow.core.scheduler.TaskOutcome;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for Seqflow CLI.
 */
public class ConsoleOutput {

    private static final int OUTPUT_TAIL_LINES = 20;

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SEQFLOW v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SEQFLOW]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void task(String name, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [TASK " + name + "]|@ " + message));
    }

    /**
     * Live progress line for a run event. Unknown event types are ignored.
     */
    public static void watchEvent(PipelineEvent event) {
        switch (event.eventType()) {
            case "task.started" -> task(event.taskName(), "started (attempt " + event.payload().get("attempt") + ")");
            case "task.skipped" -> success(event.taskName() + " up to date, skipped");
            case "task.completed" -> success(event.taskName() + " completed in " + event.payload().get("elapsedMs") + "ms");
            case "task.retrying" -> task(event.taskName(), "retrying after: " + event.payload().get("error"));
            case "task.failed" -> error(event.taskName() + " failed: " + event.payload().get("error"));
            case "task.unreachable" -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|fg(yellow) -|@ " + event.taskName() + " unreachable: " + event.payload().get("reason")));
            default -> { }
        }
    }

    public static void report(RunReport report) {
        System.out.println();
        System.out.println("RUN " + report.runId());
        System.out.printf("  %d executed, %d skipped, %d failed, %d unreachable%n",
                report.executedCount(), report.skippedCount(), report.failed().size(), report.unreachable().size());

        for (TaskOutcome failed : report.failed()) {
            System.out.println();
            error(failed.name() + " (" + failed.type() + ", " + failed.attempts() + " attempt"
                    + (failed.attempts() != 1 ? "s" : "") + "): " + failed.message());
            printTail(failed.output());
        }
        if (!report.unreachable().isEmpty()) {
            System.out.println();
            System.out.println("UNREACHABLE:");
            for (TaskOutcome unreachable : report.unreachable()) {
                System.out.println("  " + unreachable.name() + " (" + unreachable.message() + ")");
            }
        }

        System.out.println();
        if (report.succeeded()) {
            success("Run complete.");
        } else {
            error("Run failed.");
        }
    }

    private static void printTail(String output) {
        if (output == null || output.isBlank()) {
            return;
        }
        String[] lines = output.strip().split("\\R");
        int from = Math.max(0, lines.length - OUTPUT_TAIL_LINES);
        for (int i = from; i < lines.length; i++) {
            System.out.println("    | " + lines[i]);
        }
    }
}
