package com.fauxcloud.dispatch.cli;

import com.fauxcloud.core.error.InstanceException;
import com.fauxcloud.core.error.ValidationException;

import java.util.concurrent.Callable;

/**
 * Shared error reporting for commands that call the lifecycle manager.
 */
final class InstanceCommands {

    static final int OK = 0;
    static final int FAILED = 1;

    private InstanceCommands() {}

    /**
     * Runs the action, printing any lifecycle error in red and mapping it to a non-zero exit code.
     */
    static Integer run(Callable<Integer> action) throws Exception {
        try {
            return action.call();
        } catch (ValidationException e) {
            ConsoleOutput.error("Invalid request");
            e.violations().forEach(v -> ConsoleOutput.error("  " + v));
            return FAILED;
        } catch (InstanceException e) {
            ConsoleOutput.error(e.getMessage());
            return FAILED;
        }
    }
}
