package com.lohika.morning.risk.spark.driver.error;

import java.nio.file.Path;

/** A model artifact is missing or cannot be deserialized. */
public class ModelLoadException extends RiskPipelineException {

    public ModelLoadException(String operation, Path path, String message) {
        super(operation, path, message);
    }

    public ModelLoadException(String operation, Path path, String message, Throwable cause) {
        super(operation, path, message, cause);
    }
}
