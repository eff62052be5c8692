package com.rivet.core.process;

/**
 * Outcome of a finished external command.
 *
 * @param exitCode process exit code
 * @param stdout captured standard output (empty when output was inherited)
 * @param stderr captured standard error (empty when output was inherited)
 */
public record ProcessResult(int exitCode, String stdout, String stderr) {

    public ProcessResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public static ProcessResult success() {
        return new ProcessResult(0, "", "");
    }

    public boolean succeeded() {
        return exitCode == 0;
    }
}
