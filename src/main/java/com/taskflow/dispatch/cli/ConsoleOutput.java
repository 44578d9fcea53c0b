package com.taskflow.dispatch.cli;

import com.taskflow.core.audit.ReconciliationReport;
import com.taskflow.core.engine.CommandReport;
import com.taskflow.core.engine.GateReport;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Taskflow CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKFLOW v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TASKFLOW]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void gate(GateReport report) {
        String label = switch (report.result()) {
            case APPROVED -> "@|fg(green),bold [APPROVED]|@";
            case ALREADY_PASSED -> "@|fg(green) [PASSED]|@";
            case NEEDS_REVISION -> "@|fg(yellow),bold [NEEDS REVISION]|@";
            case REJECTED -> "@|fg(red),bold [REJECTED]|@";
            case AWAITING_CONFIRMATION -> "@|fg(cyan) [WAITING]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + label + " " + report.gate().key()
                        + (report.note() == null || report.note().isBlank() ? "" : ": " + report.note())));
    }

    public static void report(CommandReport report) {
        for (var gate : report.gates()) {
            gate(gate);
        }
        for (var message : report.messages()) {
            info(message);
        }
    }

    public static void status(TaskStatus status) {
        String color = switch (status) {
            case DONE -> "fg(green)";
            case BLOCKED -> "fg(red)";
            case ARCHIVED -> "faint";
            default -> "fg(cyan)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "Status: @|" + color + ",bold " + status + "|@"));
    }

    public static void taskRow(Task task) {
        System.out.printf("  %-14s %-26s %-9s %s%n",
                task.id(), task.status(), task.parentTaskId() == null ? "-" : "child", truncate(task.title(), 40));
    }

    public static void reconciliation(ReconciliationReport report) {
        if (report.detected().isEmpty()) {
            success(report.taskId() + " in sync (" + report.status() + ")");
            return;
        }
        String header = report.taskId() + ": " + report.detected().size() + " drift(s)";
        if (report.inSync()) {
            success(header + ", all repaired");
        } else {
            warn(header + ", " + report.remaining().size() + " remaining");
        }
        for (var drift : report.remaining()) {
            String last = drift.neverAttempted() ? "never attempted" : "last " + drift.lastResult()
                    + (drift.lastDetail() == null ? "" : " (" + drift.lastDetail() + ")");
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + drift.operation() + " " + drift.expectation() + ": " + last));
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
