package com.wobble.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and runs the {@code wobble} command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final WobbleCommand wobbleCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(WobbleCommand wobbleCommand, IFactory factory) {
        this.wobbleCommand = wobbleCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = WobbleCommand.commandLine(wobbleCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
