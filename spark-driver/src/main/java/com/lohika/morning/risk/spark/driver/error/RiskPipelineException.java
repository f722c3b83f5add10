package com.lohika.morning.risk.spark.driver.error;

import java.nio.file.Path;

/**
 * Root of the pipeline error taxonomy. Every failure names the operation that failed
 * and, where one is involved, the path it was working on.
 */
public class RiskPipelineException extends RuntimeException {

    private final String operation;
    private final Path path;

    public RiskPipelineException(String operation, Path path, String message) {
        this(operation, path, message, null);
    }

    public RiskPipelineException(String operation, Path path, String message, Throwable cause) {
        super(format(operation, path, message), cause);
        this.operation = operation;
        this.path = path;
    }

    public String getOperation() {
        return operation;
    }

    public Path getPath() {
        return path;
    }

    private static String format(String operation, Path path, String message) {
        if (path == null) {
            return operation + ": " + message;
        }
        return operation + " [" + path + "]: " + message;
    }
}
