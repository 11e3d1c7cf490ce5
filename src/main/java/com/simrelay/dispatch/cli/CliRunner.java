package com.simrelay.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree for the one-shot subcommands ({@code agent}, {@code sign},
 * {@code health}) and hands their exit code to {@link org.springframework.boot.SpringApplication#exit}.
 * In serve mode it does nothing and the embedded server keeps the JVM alive.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final SimRelayCommand simRelayCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(SimRelayCommand simRelayCommand, IFactory factory) {
        this.simRelayCommand = simRelayCommand;
        this.factory = factory;
    }

    /**
     * True when the subcommand is {@code serve}. Options such as {@code --server.port=9090}
     * before it are skipped; a later {@code serve} (e.g. a file passed to {@code sign}) does not count.
     */
    public static boolean isServeMode(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return "serve".equals(arg);
            }
        }
        return false;
    }

    @Override
    public void run(String... args) {
        if (isServeMode(args)) {
            return;
        }
        exitCode = new CommandLine(simRelayCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
