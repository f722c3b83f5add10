package com.lohika.morning.risk.spark.driver.service.ingestion;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

public class IngestionResult {

    private final Path datasetFile;
    private final Path manifestFile;
    private final List<String> ingestedFiles;
    private final long recordCount;
    private final long duplicatesRemoved;

    public IngestionResult(Path datasetFile, Path manifestFile, List<String> ingestedFiles,
                           long recordCount, long duplicatesRemoved) {
        this.datasetFile = datasetFile;
        this.manifestFile = manifestFile;
        this.ingestedFiles = Collections.unmodifiableList(ingestedFiles);
        this.recordCount = recordCount;
        this.duplicatesRemoved = duplicatesRemoved;
    }

    public Path getDatasetFile() {
        return datasetFile;
    }

    public Path getManifestFile() {
        return manifestFile;
    }

    public List<String> getIngestedFiles() {
        return ingestedFiles;
    }

    public long getRecordCount() {
        return recordCount;
    }

    public long getDuplicatesRemoved() {
        return duplicatesRemoved;
    }

    @Override
    public String toString() {
        return "IngestionResult{datasetFile=" + datasetFile + ", ingestedFiles=" + ingestedFiles
                + ", recordCount=" + recordCount + ", duplicatesRemoved=" + duplicatesRemoved + "}";
    }
}
