package com.example.reconcile.infrastructure.ocr;

/**
 * Outcome of an external command.
 *
 * @param exitCode process exit code, {@code -1} when the process was killed
 * @param output   captured standard output
 * @param timedOut whether the process was killed after exceeding its timeout
 */
public record CommandResult(int exitCode, String output, boolean timedOut) {

    public CommandResult {
        output = output == null ? "" : output;
    }

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
