package com.example.reconcile.infrastructure.ocr;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external program with a bounded wall-clock time.
 */
public interface CommandRunner {

    /**
     * @param command program followed by its arguments
     * @param timeout limit after which the process is killed
     * @return exit status and standard output
     * @throws IOException when the program cannot be started, e.g. because it is not installed
     */
    CommandResult run(List<String> command, Duration timeout) throws IOException;
}
