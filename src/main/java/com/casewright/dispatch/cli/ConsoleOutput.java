package com.casewright.dispatch.cli;

import com.casewright.core.model.FunctionPoint;
import com.casewright.core.model.GenerationMeta;
import com.casewright.core.model.MatchConfidence;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Casewright CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CASEWRIGHT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CASEWRIGHT]|@ " + message));
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

    public static void functionPoint(FunctionPoint fp) {
        String lines = fp.matchedPositions() == null ? "-"
                : fp.matchedPositions().get(0) + "-" + fp.matchedPositions().get(1);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %-8s %s %-9s %s", fp.id(), confidence(fp.matchConfidence()), lines, fp.name())));
    }

    public static void generationSummary(GenerationMeta meta) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Generation Summary|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Function points: @|fg(green) " + meta.processedFunctionPoints() + " processed|@"
                + (meta.degradedFunctionPoints() > 0
                        ? ", @|fg(red) " + meta.degradedFunctionPoints() + " degraded|@" : "")
                + " of " + meta.totalFunctionPoints()));
        System.out.println("  Average quality: " + String.format("%.2f", meta.averageQualityScore()));
        System.out.println("  Cases with issues: " + meta.testCasesWithIssues());
        System.out.println("  Warnings: " + meta.totalWarnings());
    }

    public static void progressLine(String status, int percent, String message) {
        String color = switch (status) {
            case "completed" -> "fg(green)";
            case "failed" -> "fg(red)";
            default -> "fg(cyan)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|" + color + " [" + status.toUpperCase() + "]|@ " + percent + "% " + (message == null ? "" : message)));
    }

    private static String confidence(MatchConfidence confidence) {
        if (confidence == null) {
            return "@|fg(white) -     |@";
        }
        return switch (confidence) {
            case HIGH -> "@|fg(green) high  |@";
            case MEDIUM -> "@|fg(yellow) medium|@";
            case LOW -> "@|fg(red) low   |@";
        };
    }
}
