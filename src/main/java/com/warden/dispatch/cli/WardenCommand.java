package com.warden.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Warden.
 */
@Command(
        name = "warden",
        mixinStandardHelpOptions = true,
        version = "Warden 0.1.0",
        description = "Provision isolated agent sandboxes with proxy-injected credentials",
        subcommands = {
                CreateCommand.class,
                StatusCommand.class,
                DeleteCommand.class,
                ExecCommand.class,
                InterruptCommand.class,
                AnswerCommand.class,
                TokenCommand.class,
                ProxyConfigCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class WardenCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
