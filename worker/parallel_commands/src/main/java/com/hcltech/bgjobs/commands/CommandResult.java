package com.hcltech.bgjobs.commands;

/**
 * Outcome of one shell command.
 *
 * @param command  the command line as given
 * @param exitCode process exit code, 0 for success
 * @param output   stdout and stderr, interleaved
 */
public record CommandResult(String command, int exitCode, String output) {
    public boolean succeeded() {
        return exitCode == 0;
    }
}
