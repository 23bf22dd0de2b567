package com.proofmend.cli;

import picocli.CommandLine;

/**
 * Root command. Does nothing on its own; {@code run} is the only subcommand.
 */
@CommandLine.Command(
        name = "proofmend",
        description = "Repairs, extends and documents a single Lean file until it builds",
        version = "0.1.0",
        mixinStandardHelpOptions = true)
public class ProofMendCommand implements Runnable {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand (try 'run')");
    }
}
