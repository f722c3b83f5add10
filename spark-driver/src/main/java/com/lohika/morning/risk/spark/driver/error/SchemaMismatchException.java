package com.lohika.morning.risk.spark.driver.error;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/** An expected column is absent from a dataset. */
public class SchemaMismatchException extends RiskPipelineException {

    private final List<String> missingColumns;

    public SchemaMismatchException(String operation, Path path, List<String> missingColumns) {
        super(operation, path, "missing expected columns " + missingColumns);
        this.missingColumns = Collections.unmodifiableList(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
