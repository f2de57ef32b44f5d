package com.a2dd.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored status lines. Everything goes to stderr so stdout carries only the
 * converted document.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void info(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [A2DD]|@ " + message));
    }

    public static void success(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }
}
