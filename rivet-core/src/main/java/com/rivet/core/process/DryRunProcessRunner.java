package com.rivet.core.process;

import java.io.PrintStream;
import java.util.Objects;

/**
 * {@link ProcessRunner} that prints each command instead of running it.
 *
 * <p>Used by {@code deploy --dry-run}. Every command reports success.
 */
public class DryRunProcessRunner implements ProcessRunner {

    private final PrintStream out;

    public DryRunProcessRunner(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public ProcessResult run(ProcessInvocation invocation) {
        out.println("  [dry-run] " + invocation.commandLine());
        return ProcessResult.success();
    }

    @Override
    public RunningProcess start(ProcessInvocation invocation) {
        run(invocation);
        return new RunningProcess() {
            @Override
            public int waitFor() {
                return 0;
            }

            @Override
            public boolean isAlive() {
                return false;
            }

            @Override
            public void stop() {
                // nothing was started
            }
        };
    }

    @Override
    public boolean isAvailable(String program) {
        return true;
    }
}
