package com.frameception.dispatch.cli;

import com.frameception.core.conversation.ConversationTurn;
import com.frameception.core.events.DashboardEvent;
import com.frameception.core.logs.AnnotatedBuildLogLine;
import com.frameception.core.model.LogEntry;
import com.frameception.core.model.ProjectState;
import com.frameception.core.model.ProjectStatus;
import picocli.CommandLine;

import java.time.format.DateTimeFormatter;
import java.time.ZoneOffset;

/**
 * ANSI-colored terminal output utilities for the Frameception CLI.
 */
public class ConsoleOutput {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneOffset.UTC);

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(magenta) FRAMECEPTION v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FRAMECEPTION]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void status(ProjectStatus status) {
        String color = switch (status.state()) {
            case DEPLOYED -> "fg(green)";
            case BUILDING -> "fg(yellow)";
            case ERROR -> "fg(red)";
            case CREATED -> "fg(cyan)";
        };
        String label = status.state().name();
        String suffix = status.state() == ProjectState.ERROR && status.error() != null
                ? " " + status.error() : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "Status: @|bold," + color + " " + label + "|@" + suffix));
    }

    public static void logEntry(LogEntry entry) {
        String when = entry.createdAt() != null ? TIME.format(entry.createdAt()) : "-";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|faint " + when + "|@ @|fg(blue) [" + entry.source().wireValue() + "]|@ " + entry.text()));
    }

    public static void buildLine(AnnotatedBuildLogLine line) {
        String text = line.line().text();
        String time = line.timestamp().isEmpty() ? "" : line.timestamp() + "  ";
        if (line.error()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  " + time + "@|fg(red) " + text + "|@"));
        } else {
            System.out.println("  " + time + text);
        }
    }

    public static void turn(ConversationTurn turn) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|bold you|@  " + turn.userText()));
        String color = turn.error() ? "fg(red)" : "fg(green)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|" + color + " bot|@  " + turn.botText()));
    }

    public static void watchEvent(DashboardEvent event) {
        String prefix = switch (event.eventType()) {
            case DashboardEvent.DASHBOARD_UPDATED -> "@|fg(cyan) [UPDATE]|@";
            case DashboardEvent.DEPLOYMENT_STATUS_CHANGED -> "@|bold,fg(yellow) [DEPLOYMENT]|@";
            case DashboardEvent.PROJECT_FETCH_FAILED -> "@|fg(red),bold [FETCH FAILED]|@";
            case DashboardEvent.ACTION_COMPLETED -> "@|fg(green),bold [ACTION]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + event.payload()));
    }
}
