package com.codeguard.core.analyzer;

/**
 * Raised when an analyzer cannot complete on one file.
 *
 * <p>The scheduler turns it into a FAILED outcome for that single task; it never aborts
 * the run.
 *
 * @since 1.0.0
 */
public class AnalyzerExecutionException extends Exception {

    private final String analyzerId;
    private final String filePath;

    public AnalyzerExecutionException(String analyzerId, String filePath, String message) {
        this(analyzerId, filePath, message, null);
    }

    public AnalyzerExecutionException(String analyzerId, String filePath, String message, Throwable cause) {
        super(message, cause);
        this.analyzerId = analyzerId;
        this.filePath = filePath;
    }

    public String getAnalyzerId() {
        return analyzerId;
    }

    public String getFilePath() {
        return filePath;
    }
}
