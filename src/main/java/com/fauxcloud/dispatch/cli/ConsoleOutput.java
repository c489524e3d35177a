package com.fauxcloud.dispatch.cli;

import com.fauxcloud.core.model.Instance;
import com.fauxcloud.core.model.InstanceEndpoints;
import com.fauxcloud.core.model.InstanceStatus;
import picocli.CommandLine;

import java.time.Duration;
import java.time.Instant;

/**
 * ANSI-colored terminal output utilities for the faux-cloud CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FAUX CLOUD v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FAUX-CLOUD]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static String status(InstanceStatus status) {
        String color = switch (status) {
            case RUNNING -> "fg(green)";
            case ERROR -> "fg(red)";
            case STOPPED, TERMINATED -> "fg(white)";
            default -> "fg(yellow)";
        };
        return CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + status + "|@");
    }

    /**
     * One row of the {@code list} table.
     */
    public static void instanceRow(Instance instance, Instant now) {
        System.out.printf("%-22s %-24s %-22s %-22s %s%n",
                instance.getId(),
                instance.getName(),
                instance.getConfig().topology(),
                status(instance.getStatus()),
                remaining(instance.getExpiresAt(), now));
    }

    public static void instanceDetail(Instance instance, Instant now) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold INSTANCE " + instance.getId() + "|@"));
        System.out.println("  Name:      " + instance.getName());
        System.out.println("  Status:    " + status(instance.getStatus()));
        System.out.println("  Topology:  " + instance.getConfig().topology());
        System.out.println("  Created:   " + instance.getCreatedAt());
        System.out.println("  Expires:   " + instance.getExpiresAt() + " (" + remaining(instance.getExpiresAt(), now) + ")");
        if (!instance.getLabels().isEmpty()) {
            System.out.println("  Labels:    " + instance.getLabels());
        }
        if (instance.getErrorMessage() != null) {
            error("Error: " + instance.getErrorMessage());
        }

        InstanceEndpoints endpoints = instance.getEndpoints();
        if (endpoints != null && !endpoints.isEmpty()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Endpoints|@"));
            printIfPresent("Web", endpoints.webUrl());
            printIfPresent("Management", endpoints.managementUrl());
            printIfPresent("Ingestion", endpoints.ingestionUrl());
            printIfPresent("Forwarding", endpoints.forwardingPort() != null ? String.valueOf(endpoints.forwardingPort()) : null);
            printIfPresent("Admin API", endpoints.adminApiUrl());
        }
        if (instance.getCredentials() != null) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Credentials|@"));
            System.out.println("  Username:  " + instance.getCredentials().adminUsername());
            System.out.println("  Password:  " + instance.getCredentials().adminPassword());
        }
    }

    static String remaining(Instant expiresAt, Instant now) {
        Duration left = Duration.between(now, expiresAt);
        if (left.isNegative() || left.isZero()) {
            return "expired";
        }
        long hours = left.toHours();
        long minutes = left.toMinutesPart();
        return hours > 0 ? hours + "h " + minutes + "m left" : minutes + "m left";
    }

    private static void printIfPresent(String label, String value) {
        if (value != null) {
            System.out.printf("  %-11s%s%n", label + ":", value);
        }
    }
}
