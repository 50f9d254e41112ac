/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.report.infrastructure.process;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs external commands (git, prince) with a hard timeout. Standard output and
 * error are drained on background threads so a chatty process cannot block on
 * a full pipe.
 */
@Component
@Slf4j
public class ProcessRunner {

    private static final long DRAIN_TIMEOUT_SECONDS = 5;

    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "process-io");
        thread.setDaemon(true);
        return thread;
    });

    public record ProcessOutput(int exitCode, String stdout, String stderr) {

        public boolean isSuccess() {
            return exitCode == 0;
        }
    }

    /**
     * Run a command and wait for it.
     *
     * @param command
     *            program and arguments, no shell interpretation
     * @param workDir
     *            working directory, null for the current one
     * @param stdin
     *            text piped to the process, null for none
     * @param timeout
     *            wall-clock limit; the process is killed when exceeded
     * @throws IOException
     *             when the process cannot be started or is interrupted
     * @throws TimeoutException
     *             when the timeout elapses
     */
    public ProcessOutput run(List<String> command, Path workDir, String stdin, Duration timeout)
            throws IOException, TimeoutException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }
        log.debug("[Process] Running {}", command);
        Process process = pb.start();
        boolean completed = false;
        try {
            Future<?> input = executor.submit(() -> feed(process.getOutputStream(), stdin));
            Future<String> stdout = executor.submit(() -> drain(process.getInputStream()));
            Future<String> stderr = executor.submit(() -> drain(process.getErrorStream()));
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new TimeoutException(command.get(0) + " timed out after " + timeout.toMillis() + "ms");
            }
            ProcessOutput output = new ProcessOutput(process.exitValue(),
                    stdout.get(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS),
                    stderr.get(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS));
            awaitInput(input, output);
            completed = true;
            return output;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException(command.get(0) + " interrupted");
        } catch (ExecutionException e) {
            throw new IOException("Failed to read output of " + command.get(0), e.getCause());
        } finally {
            if (!completed) {
                process.destroyForcibly();
            }
        }
    }

    private static Void feed(OutputStream in, String stdin) throws IOException {
        try (in) {
            if (stdin != null) {
                in.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        }
        return null;
    }

    /**
     * A process may exit without consuming all of its input. The exit code
     * decides the outcome; an unconsumed input is only logged.
     */
    private static void awaitInput(Future<?> input, ProcessOutput output)
            throws InterruptedException, TimeoutException {
        try {
            input.get(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            if (output.isSuccess()) {
                log.debug("[Process] Input not fully consumed: {}", e.getCause().getMessage());
            } else {
                log.warn("[Process] Input write failed (exit {}): {}", output.exitCode(),
                        e.getCause().getMessage());
            }
        }
    }

    private static String drain(InputStream stream) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (stream) {
            stream.transferTo(buffer);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
