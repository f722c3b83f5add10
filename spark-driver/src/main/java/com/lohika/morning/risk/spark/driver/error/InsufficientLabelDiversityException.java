package com.lohika.morning.risk.spark.driver.error;

import java.nio.file.Path;

/** The test set holds a single label class, so ROC and AUC are undefined. */
public class InsufficientLabelDiversityException extends RiskPipelineException {

    public InsufficientLabelDiversityException(String operation, Path path, String message) {
        super(operation, path, message);
    }

    public InsufficientLabelDiversityException(String operation, Path path, String message, Throwable cause) {
        super(operation, path, message, cause);
    }
}
