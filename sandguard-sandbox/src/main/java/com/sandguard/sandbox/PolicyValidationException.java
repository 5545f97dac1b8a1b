package com.sandguard.sandbox;

import java.nio.file.Path;

/**
 * Thrown when an explicitly supplied sandbox policy file exists but does not
 * match the policy schema. The message names the offending field.
 */
public class PolicyValidationException extends RuntimeException {

    private final String field;
    private final Path policyPath;

    public PolicyValidationException(String field, Path policyPath) {
        super("Invalid sandbox policy" + (policyPath != null ? " " + policyPath : "")
                + ": missing or invalid field '" + field + "'");
        this.field = field;
        this.policyPath = policyPath;
    }

    /**
     * Dotted path of the field that failed validation, e.g. {@code profiles} or
     * {@code profiles.testing.safe_commands}.
     */
    public String getField() {
        return field;
    }

    public Path getPolicyPath() {
        return policyPath;
    }
}
