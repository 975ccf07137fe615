package com.hcltech.bgjobs.commands;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Runs a command line through the platform shell ({@code sh -c} or {@code cmd /c}). */
public final class ProcessCommandRunner implements CommandRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    private final List<String> shell;

    public ProcessCommandRunner() {
        this(System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows")
                ? List.of("cmd", "/c")
                : List.of("sh", "-c"));
    }

    ProcessCommandRunner(List<String> shell) {
        this.shell = List.copyOf(shell);
    }

    @Override
    public CommandResult run(String commandLine) throws IOException, InterruptedException {
        List<String> argv = new ArrayList<>(shell);
        argv.add(commandLine);
        log.debug("Running {}", argv);

        Process process = new ProcessBuilder(argv).redirectErrorStream(true).start();
        try {
            String output;
            try (InputStream in = process.getInputStream()) {
                output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exitCode = process.waitFor();
            log.debug("Finished {} with exit code {}", commandLine, exitCode);
            return new CommandResult(commandLine, exitCode, output);
        } finally {
            if (process.isAlive()) {
                log.debug("Destroying {}", commandLine);
                process.destroy();
            }
        }
    }
}
