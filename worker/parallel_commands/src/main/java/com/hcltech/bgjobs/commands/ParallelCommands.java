package com.hcltech.bgjobs.commands;

import com.hcltech.bgjobs.common.IEnvGetter;
import com.hcltech.bgjobs.jobs.BackgroundJobsFailedException;
import com.hcltech.bgjobs.jobs.BgResult;
import com.hcltech.bgjobs.jobs.JobFailure;
import com.hcltech.bgjobs.jobs.Jobs;
import com.hcltech.bgjobs.jobs.JobsConfig;
import com.hcltech.bgjobs.jobs.JobsConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs independent shell commands side by side and waits for all of them:
 * <pre>
 *   BGJOBS_LIMIT=2 java -jar parallel-commands.jar "make docs" "make test" "make lint"
 * </pre>
 * Results are printed in argument order. {@code BGJOBS_LIMIT} defaults to the number of commands.
 * Exit code: 0 all succeeded, 1 a command failed or could not be run, 2 usage or configuration error.
 */
public final class ParallelCommands {
    private static final Logger log = LoggerFactory.getLogger(ParallelCommands.class);

    private ParallelCommands() {
    }

    public static void main(String[] args) {
        System.exit(run(List.of(args), IEnvGetter.env, new ProcessCommandRunner(), System.out));
    }

    static int run(List<String> commands, IEnvGetter env, CommandRunner runner, PrintStream out) {
        if (commands.isEmpty()) {
            out.println("usage: ParallelCommands <command> [<command> ...]");
            return 2;
        }
        JobsConfig config;
        try {
            config = JobsConfig.fromEnv(withDefaultLimit(env, commands.size()));
        } catch (JobsConfigurationException e) {
            out.println("configuration error: " + e.getMessage());
            return 2;
        }

        try {
            List<CommandResult> results = runAll(commands, config, runner);
            boolean allOk = true;
            for (CommandResult r : results) {
                out.println("[" + r.exitCode() + "] " + r.command());
                if (!r.output().isEmpty()) out.print(r.output());
                allOk &= r.succeeded();
            }
            return allOk ? 0 : 1;
        } catch (BackgroundJobsFailedException e) {
            for (JobFailure f : e.failures()) {
                out.println("[error] " + f.jobName() + ": " + f.error());
            }
            return 1;
        }
    }

    /** Runs every command in the background and returns the results in the order given. */
    public static List<CommandResult> runAll(List<String> commands, JobsConfig config, CommandRunner runner) {
        MDC.put("commands", String.valueOf(commands.size()));
        try {
            List<BgResult<CommandResult>> pending = Jobs.jobs(config, jobs -> {
                List<BgResult<CommandResult>> launched = new ArrayList<>(commands.size());
                for (String command : commands) {
                    launched.add(jobs.background(command, runner::run));
                }
                return launched;
            });
            List<CommandResult> results = new ArrayList<>(pending.size());
            for (BgResult<CommandResult> r : pending) {
                results.add(r.get());
            }
            log.info("Ran {} command(s) with limit {}", results.size(), config.limit());
            return results;
        } finally {
            MDC.remove("commands");
        }
    }

    private static IEnvGetter withDefaultLimit(IEnvGetter env, int commandCount) {
        return name -> {
            String value = env.get(name);
            if (JobsConfig.LIMIT_ENV.equals(name) && (value == null || value.isBlank())) {
                return String.valueOf(commandCount);
            }
            return value;
        };
    }
}
