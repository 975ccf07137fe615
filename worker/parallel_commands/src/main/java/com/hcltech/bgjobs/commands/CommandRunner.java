package com.hcltech.bgjobs.commands;

import java.io.IOException;

@FunctionalInterface
public interface CommandRunner {
    /** Runs {@code commandLine} to completion. A non-zero exit is a result, not an exception. */
    CommandResult run(String commandLine) throws IOException, InterruptedException;
}
