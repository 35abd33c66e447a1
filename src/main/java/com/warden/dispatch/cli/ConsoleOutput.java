package com.warden.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.warden.sandbox.relay.SandboxEvent;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Warden CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) WARDEN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WARDEN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void sandbox(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [SANDBOX]|@ " + message));
    }

    public static void event(SandboxEvent event) {
        String color = switch (event.type() == null ? "" : event.type()) {
            case "thought" -> "blue";
            case SandboxEvent.QUESTION -> "cyan";
            case "tool_start", "tool_end" -> "yellow";
            case "result" -> event.isCancelled() ? "red" : "green";
            case "error" -> "red";
            default -> "white";
        };
        String label = event.isCancelled() ? "INTERRUPTED" : String.valueOf(event.type()).toUpperCase();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(" + color + ") [" + label + "]|@ ") + describe(event.data()));
    }

    static String describe(JsonNode data) {
        if (data == null || data.isNull()) {
            return "";
        }
        if (data.isTextual()) {
            return data.asText();
        }
        if (data.hasNonNull("text")) {
            return data.get("text").asText();
        }
        if (data.hasNonNull("name")) {
            return data.get("name").asText();
        }
        return data.toString();
    }
}
