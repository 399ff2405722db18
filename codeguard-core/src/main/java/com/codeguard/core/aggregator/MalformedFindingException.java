package com.codeguard.core.aggregator;

/**
 * Raised when a finding lacks a required field. The aggregator logs and drops such findings.
 *
 * @since 1.0.0
 */
public class MalformedFindingException extends Exception {

    private final String analyzerId;
    private final String missingField;

    public MalformedFindingException(String analyzerId, String missingField) {
        super("Finding from " + analyzerId + " is missing required field '" + missingField + "'");
        this.analyzerId = analyzerId;
        this.missingField = missingField;
    }

    public String getAnalyzerId() {
        return analyzerId;
    }

    public String getMissingField() {
        return missingField;
    }
}
