package com.lohika.morning.risk.spark.driver.service.scoring;

import java.nio.file.Path;

/** An F1 score together with the dataset and model it was computed from. */
public class ScoreRecord {

    private final double value;
    private final Path datasetFile;
    private final Path modelPath;

    public ScoreRecord(double value, Path datasetFile, Path modelPath) {
        this.value = value;
        this.datasetFile = datasetFile;
        this.modelPath = modelPath;
    }

    public double getValue() {
        return value;
    }

    public Path getDatasetFile() {
        return datasetFile;
    }

    public Path getModelPath() {
        return modelPath;
    }

    @Override
    public String toString() {
        return "ScoreRecord{value=" + value + ", dataset=" + datasetFile + ", model=" + modelPath + "}";
    }
}
