package com.proofmend.core.executor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One way of checking a single file, e.g. {@code lake env lean --make}.
 * Tiers are tried in order; the next tier is used only when the previous
 * tier's binary could not be launched.
 */
public final class CheckTier {

    private final String name;
    private final List<String> commandPrefix;

    public CheckTier(String name, List<String> commandPrefix) {
        if (commandPrefix == null || commandPrefix.isEmpty()) {
            throw new IllegalArgumentException("Check tier '" + name + "' has no command");
        }
        this.name = name;
        this.commandPrefix = List.copyOf(commandPrefix);
    }

    /** Parses a whitespace-separated command line such as {@code "lake env lean --make"}. */
    public static CheckTier parse(String commandLine) {
        String trimmed = commandLine == null ? "" : commandLine.trim();
        List<String> parts = trimmed.isEmpty() ? List.of() : Arrays.asList(trimmed.split("\\s+"));
        return new CheckTier(trimmed, parts);
    }

    public List<String> commandFor(Path file) {
        List<String> command = new ArrayList<>(commandPrefix);
        command.add(file.toString());
        return command;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
