package com.lohika.morning.risk.spark.driver.error;

import java.nio.file.Path;

/** No records or no source files where at least one is required. */
public class NoInputDataException extends RiskPipelineException {

    public NoInputDataException(String operation, Path path, String message) {
        super(operation, path, message);
    }

    public NoInputDataException(String operation, Path path, String message, Throwable cause) {
        super(operation, path, message, cause);
    }
}
