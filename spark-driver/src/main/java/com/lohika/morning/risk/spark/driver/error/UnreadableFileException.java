package com.lohika.morning.risk.spark.driver.error;

import java.nio.file.Path;

/** A source file could not be parsed as a table of the fixed schema. */
public class UnreadableFileException extends RiskPipelineException {

    public UnreadableFileException(String operation, Path path, String message) {
        super(operation, path, message);
    }

    public UnreadableFileException(String operation, Path path, String message, Throwable cause) {
        super(operation, path, message, cause);
    }
}
