package com.proofmend.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Hands the process arguments to picocli and keeps the exit code for {@code SpringApplication.exit}.
 */
@Component
@ConditionalOnProperty(prefix = "proofmend.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final RunCommand runCommand;
    private int exitCode;

    public CliRunner(RunCommand runCommand) {
        this.runCommand = runCommand;
    }

    @Override
    public void run(String... args) {
        exitCode = createCommandLine().execute(args);
    }

    CommandLine createCommandLine() {
        return new CommandLine(new ProofMendCommand())
                .addSubcommand("run", runCommand)
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
