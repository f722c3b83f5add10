package com.lohika.morning.risk.spark.driver.service.reporting;

import com.lohika.morning.risk.spark.driver.service.model.ConfusionMatrix;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/** Confusion matrix and ROC curve of the deployed model on the test set, with the files written for them. */
public class ModelReport {

    private final ConfusionMatrix confusionMatrix;
    private final RocCurve rocCurve;
    private final List<Path> files;

    public ModelReport(ConfusionMatrix confusionMatrix, RocCurve rocCurve, List<Path> files) {
        this.confusionMatrix = confusionMatrix;
        this.rocCurve = rocCurve;
        this.files = Collections.unmodifiableList(files);
    }

    public ConfusionMatrix getConfusionMatrix() {
        return confusionMatrix;
    }

    public RocCurve getRocCurve() {
        return rocCurve;
    }

    public double getAreaUnderCurve() {
        return rocCurve.getAreaUnderCurve();
    }

    public List<Path> getFiles() {
        return files;
    }
}
