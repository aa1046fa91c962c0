package com.groupdispatch.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) GROUPDISPATCH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [DISPATCH]|@ " + message));
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

    public static void message(String timestamp, String sender, String content) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|faint " + timestamp + "|@ @|bold " + sender + "|@ " + truncate(content, 80)));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String flat = s.replace('\n', ' ');
        return flat.length() <= max ? flat : flat.substring(0, max - 3) + "...";
    }
}
