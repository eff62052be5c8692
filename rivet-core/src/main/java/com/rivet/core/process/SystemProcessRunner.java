package com.rivet.core.process;

import com.rivet.core.exception.DelegatedFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}.
 *
 * <p>Captured output is drained on a separate thread for stderr so that a chatty tool
 * cannot block on a full pipe.
 */
public class SystemProcessRunner implements ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(SystemProcessRunner.class);
    private static final long STOP_GRACE_SECONDS = 10;

    @Override
    public ProcessResult run(ProcessInvocation invocation) {
        Process process = launch(invocation);
        try {
            if (invocation.inheritIo()) {
                int exitCode = process.waitFor();
                log.debug("'{}' exited with {}", invocation.commandLine(), exitCode);
                return new ProcessResult(exitCode, "", "");
            }

            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
            String stdout = drain(process.getInputStream());
            int exitCode = process.waitFor();
            log.debug("'{}' exited with {}", invocation.commandLine(), exitCode);
            return new ProcessResult(exitCode, stdout, stderr.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new DelegatedFailureException(invocation.command(), e);
        } catch (ExecutionException e) {
            throw new DelegatedFailureException(invocation.command(), e.getCause());
        }
    }

    @Override
    public RunningProcess start(ProcessInvocation invocation) {
        Process process = launch(invocation.inheritingIo());
        return new RunningProcess() {
            @Override
            public int waitFor() throws InterruptedException {
                return process.waitFor();
            }

            @Override
            public boolean isAlive() {
                return process.isAlive();
            }

            @Override
            public void stop() {
                process.descendants().forEach(ProcessHandle::destroy);
                process.destroy();
                try {
                    if (!process.waitFor(STOP_GRACE_SECONDS, TimeUnit.SECONDS)) {
                        log.warn("Process did not stop within {}s, killing it", STOP_GRACE_SECONDS);
                        process.destroyForcibly();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    process.destroyForcibly();
                }
            }
        };
    }

    @Override
    public boolean isAvailable(String program) {
        String path = System.getenv("PATH");
        if (path == null) {
            return false;
        }
        boolean windows = System.getProperty("os.name", "").toLowerCase().contains("win");
        for (String directory : path.split(File.pathSeparator)) {
            if (directory.isBlank()) {
                continue;
            }
            Path candidate = Path.of(directory, program);
            if (Files.isExecutable(candidate)) {
                return true;
            }
            if (windows && (Files.isExecutable(Path.of(directory, program + ".exe"))
                || Files.isExecutable(Path.of(directory, program + ".cmd")))) {
                return true;
            }
        }
        return false;
    }

    private Process launch(ProcessInvocation invocation) {
        log.debug("Running '{}' in {}", invocation.commandLine(), invocation.workingDirectory());
        ProcessBuilder builder = new ProcessBuilder(invocation.command())
            .directory(invocation.workingDirectory().toFile());
        builder.environment().putAll(invocation.environment());
        if (invocation.inheritIo()) {
            builder.inheritIO();
        }
        try {
            return builder.start();
        } catch (IOException e) {
            throw new DelegatedFailureException(invocation.command(), e);
        }
    }

    private static String drain(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read process output", e);
        }
    }
}
