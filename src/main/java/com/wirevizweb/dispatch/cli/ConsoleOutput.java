package com.wirevizweb.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the WireViz-Web CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) WIREVIZ-WEB v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WIREVIZ-WEB]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * Prints captured engine output indented under an error line.
     */
    public static void engineOutput(String output) {
        if (output == null || output.isBlank()) {
            return;
        }
        for (String line : output.strip().split("\\R")) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(magenta) [ENGINE]|@ " + line));
        }
    }

    public static String formatBytes(long bytes) {
        if (bytes < 1024) return bytes + " B";
        if (bytes < 1024 * 1024) return String.format("%.1f KiB", bytes / 1024.0);
        return String.format("%.1f MiB", bytes / (1024.0 * 1024.0));
    }
}
