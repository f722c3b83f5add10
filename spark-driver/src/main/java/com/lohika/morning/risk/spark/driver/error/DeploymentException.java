package com.lohika.morning.risk.spark.driver.error;

import java.nio.file.Path;

/** Promotion into the production slot failed. */
public class DeploymentException extends RiskPipelineException {

    public DeploymentException(String operation, Path path, String message) {
        super(operation, path, message);
    }

    public DeploymentException(String operation, Path path, String message, Throwable cause) {
        super(operation, path, message, cause);
    }
}
