package com.fauxcloud.core.error;

import java.util.List;

/**
 * Request rejected before any resource was touched.
 */
public class ValidationException extends InstanceException {

    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super(null, "Invalid request: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
