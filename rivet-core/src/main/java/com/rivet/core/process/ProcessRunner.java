package com.rivet.core.process;

import com.rivet.core.exception.DelegatedFailureException;

/**
 * Runs external tools on behalf of delegated commands.
 *
 * <p>Every shell-out in Rivet goes through this interface so that dry runs and tests can
 * substitute a runner that records or prints invocations instead of executing them.
 *
 * @see SystemProcessRunner
 * @see DryRunProcessRunner
 */
public interface ProcessRunner {

    /**
     * Runs a command to completion.
     *
     * @param invocation command to run
     * @return exit code and captured output
     * @throws DelegatedFailureException if the command cannot be started
     */
    ProcessResult run(ProcessInvocation invocation);

    /**
     * Starts a command without waiting for it.
     *
     * @param invocation command to start
     * @return handle on the running process
     * @throws DelegatedFailureException if the command cannot be started
     */
    RunningProcess start(ProcessInvocation invocation);

    /**
     * Returns whether a program can be found on the PATH.
     *
     * @param program program name (e.g. "git", "docker")
     * @return true if the program is available
     */
    boolean isAvailable(String program);

    /**
     * Runs a command and fails unless it exits with code 0.
     *
     * @param invocation command to run
     * @return result of the successful run
     * @throws DelegatedFailureException if the command fails or cannot be started
     */
    default ProcessResult runOrFail(ProcessInvocation invocation) {
        ProcessResult result = run(invocation);
        if (!result.succeeded()) {
            String detail = result.stderr().isBlank() ? result.stdout() : result.stderr();
            throw new DelegatedFailureException(invocation.command(), result.exitCode(), detail);
        }
        return result;
    }
}
