package com.warden.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.List;

/**
 * Runs the {@code warden} command line once the Spring context is up and keeps its exit
 * code for {@link org.springframework.boot.SpringApplication#exit}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final WardenCommand wardenCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(WardenCommand wardenCommand, IFactory factory) {
        this.wardenCommand = wardenCommand;
        this.factory = factory;
    }

    /**
     * Command line with Warden's error handling: rejected input is printed as a one-line
     * error with exit code 1, anything else keeps picocli's stack trace.
     */
    static CommandLine commandLine(WardenCommand wardenCommand, IFactory factory) {
        return new CommandLine(wardenCommand, factory)
                .setExecutionExceptionHandler((e, commandLine, parseResult) -> {
                    if (e instanceof IllegalArgumentException) {
                        ConsoleOutput.error(e.getMessage());
                        return 1;
                    }
                    throw e;
                });
    }

    @Override
    public void run(String... args) throws Exception {
        // ServeCommand leaves the servlet container running; nothing to execute here.
        if (List.of(args).contains("serve")) {
            return;
        }
        exitCode = commandLine(wardenCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
