package com.lohika.morning.risk.spark.driver.service.ingestion;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lohika.morning.risk.spark.driver.error.RiskPipelineException;
import com.lohika.morning.risk.spark.driver.util.JsonFiles;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Names of the source files consumed by a merge, stored as a JSON array next to the
 * merged dataset and, after deployment, inside the production slot.
 */
public final class IngestionManifest {

    public static final String FILE_NAME = "ingestedfiles.json";

    private IngestionManifest() {
    }

    public static Path write(Path folder, List<String> fileNames) {
        Path manifest = folder.resolve(FILE_NAME);
        try {
            JsonFiles.write(manifest, new ArrayList<>(fileNames));
        } catch (IOException e) {
            throw new RiskPipelineException("write manifest", manifest, e.getMessage(), e);
        }
        return manifest;
    }

    public static List<String> read(Path folder) {
        Path manifest = folder.resolve(FILE_NAME);
        try {
            List<String> fileNames = JsonFiles.read(manifest, new TypeReference<List<String>>() {});
            return fileNames == null ? new ArrayList<>() : fileNames;
        } catch (IOException e) {
            throw new RiskPipelineException("read manifest", manifest, e.getMessage(), e);
        }
    }
}
