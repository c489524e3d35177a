package com.fauxcloud.orchestration;

/**
 * Exit status and captured output of a finished command.
 */
public record ProcessResult(int exitCode, String stdout, String stderr) {

    public boolean succeeded() {
        return exitCode == 0;
    }

    /**
     * Runtime diagnostics: stderr when present, otherwise stdout.
     */
    public String diagnostics() {
        return stderr != null && !stderr.isBlank() ? stderr.strip() : stdout.strip();
    }
}
