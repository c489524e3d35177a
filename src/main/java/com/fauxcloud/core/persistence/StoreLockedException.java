package com.fauxcloud.core.persistence;

import java.nio.file.Path;

/**
 * Raised when another manager, in this process or another one, already owns the instance state.
 */
public class StoreLockedException extends IllegalStateException {

    private final Path stateDir;

    public StoreLockedException(Path stateDir) {
        super("Instance state in " + stateDir + " is owned by another running manager. "
                + "Stop it, or send requests to its REST API instead.");
        this.stateDir = stateDir;
    }

    public Path getStateDir() {
        return stateDir;
    }
}
