package com.rivet.core.process;

/**
 * Handle on a long-running child process such as a development server.
 */
public interface RunningProcess {

    /**
     * Blocks until the process exits.
     *
     * @return exit code
     * @throws InterruptedException if the waiting thread is interrupted
     */
    int waitFor() throws InterruptedException;

    /**
     * Returns whether the process is still running.
     *
     * @return true while running
     */
    boolean isAlive();

    /**
     * Stops the process and its descendants, waiting briefly for a clean exit.
     */
    void stop();
}
