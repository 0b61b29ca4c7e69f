package com.agentrelay.dispatch.cli;

import com.agentrelay.core.model.AggregatedResult;
import com.agentrelay.core.model.Task;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the AgentRelay CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AGENTRELAY v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [RELAY]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void taskEvent(String eventType, Task task) {
        String prefix = switch (eventType) {
            case "task.completed" -> "@|fg(green) [DONE]|@";
            case "task.failed" -> "@|fg(red) [FAILED]|@";
            default -> "@|fg(blue) [" + eventType + "]|@";
        };
        String detail = task.result() != null ? task.result() : task.error();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + task.worker() + " (attempt " + task.attempt() + "/" + task.maxAttempts() + ") "
                        + firstLine(detail)));
    }

    public static void result(AggregatedResult result) {
        System.out.println(RULE);
        String outcome = result.isError()
                ? "@|fg(red),bold " + result.outcome() + "|@"
                : "@|fg(green),bold " + result.outcome() + "|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Session|@ " + result.runId() + "  " + outcome
                        + "  (" + result.succeeded().size() + "/" + result.tasks().size() + " tasks)"));
        System.out.println();
        System.out.println(result.response());
    }

    private static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        int nl = text.indexOf('\n');
        return nl < 0 ? text : text.substring(0, nl) + " ...";
    }
}
