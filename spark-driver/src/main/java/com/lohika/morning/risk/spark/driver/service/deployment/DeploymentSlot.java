package com.lohika.morning.risk.spark.driver.service.deployment;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/** The live production slot: deployed model, its baseline score and the files it was built from. */
public class DeploymentSlot {

    private final Path path;
    private final Path modelPath;
    private final double baselineScore;
    private final List<String> ingestedFiles;

    public DeploymentSlot(Path path, Path modelPath, double baselineScore, List<String> ingestedFiles) {
        this.path = path;
        this.modelPath = modelPath;
        this.baselineScore = baselineScore;
        this.ingestedFiles = Collections.unmodifiableList(ingestedFiles);
    }

    public Path getPath() {
        return path;
    }

    public Path getModelPath() {
        return modelPath;
    }

    public double getBaselineScore() {
        return baselineScore;
    }

    public List<String> getIngestedFiles() {
        return ingestedFiles;
    }

    @Override
    public String toString() {
        return "DeploymentSlot{path=" + path + ", baselineScore=" + baselineScore + ", ingestedFiles=" + ingestedFiles + "}";
    }
}
