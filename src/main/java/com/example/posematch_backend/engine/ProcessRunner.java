package com.example.posematch_backend.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.time.Duration;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external tool with merged stdout/stderr, a hard timeout and interrupt-driven cancellation.
 * A timed out or interrupted process is destroyed before this method returns.
 */
public class ProcessRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRunner.class);

    public record ProcessResult(int code, String output, boolean timedOut) {
    }

    public ProcessResult run(List<String> cmd, Duration timeout) throws IOException, InterruptedException {
        LOGGER.debug("exec: {}", String.join(" ", cmd));
        Process p = new ProcessBuilder(cmd).redirectErrorStream(true).start();
        StringJoiner joiner = new StringJoiner(System.lineSeparator());
        Thread reader = new Thread(() -> {
            try (var buffered = new BufferedReader(new InputStreamReader(p.getInputStream()))) {
                String line;
                while ((line = buffered.readLine()) != null) {
                    synchronized (joiner) {
                        joiner.add(line);
                    }
                }
            } catch (IOException ignored) {
                // stream closes when the process is destroyed; exit code and timeout carry the outcome
            }
        }, "proc-reader");
        reader.setDaemon(true);
        reader.start();

        boolean finished;
        try {
            finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            LOGGER.warn("Interrupted while waiting for {}, destroying process", cmd.get(0));
            p.destroyForcibly();
            p.waitFor(5, TimeUnit.SECONDS);
            Thread.currentThread().interrupt();
            throw e;
        }
        if (!finished) {
            p.destroyForcibly();
            p.waitFor(5, TimeUnit.SECONDS);
        }
        reader.join(TimeUnit.SECONDS.toMillis(5));
        int code = finished ? p.exitValue() : -1;
        String output;
        synchronized (joiner) {
            output = joiner.toString();
        }
        return new ProcessResult(code, output, !finished);
    }

    static String truncate(String output, int max) {
        if (output == null || output.isBlank()) {
            return "<no output>";
        }
        if (output.length() <= max) {
            return output;
        }
        return output.substring(0, max) + "...";
    }
}
