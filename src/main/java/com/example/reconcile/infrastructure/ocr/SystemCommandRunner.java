package com.example.reconcile.infrastructure.ocr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Standard output goes to a temporary file so a
 * chatty process can never block on a full pipe; standard error is discarded.
 */
@Component
public class SystemCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(SystemCommandRunner.class);

    @Override
    public CommandResult run(List<String> command, Duration timeout) throws IOException {
        Path output = Files.createTempFile("command-output", ".txt");
        try {
            Process process = new ProcessBuilder(command)
                    .redirectOutput(output.toFile())
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            boolean finished = waitFor(process, timeout);
            if (!finished) {
                process.destroyForcibly();
                log.warn("Command {} timed out after {}", command.get(0), timeout);
                return new CommandResult(-1, "", true);
            }
            return new CommandResult(process.exitValue(), Files.readString(output, StandardCharsets.UTF_8), false);
        } finally {
            Files.deleteIfExists(output);
        }
    }

    private boolean waitFor(Process process, Duration timeout) throws IOException {
        try {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while waiting for " + process.pid(), e);
        }
    }
}
