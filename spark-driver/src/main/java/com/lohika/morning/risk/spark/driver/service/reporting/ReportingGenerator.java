package com.lohika.morning.risk.spark.driver.service.reporting;

import static com.lohika.morning.risk.spark.distributed.library.function.map.risk.Column.CORPORATION;
import static com.lohika.morning.risk.spark.distributed.library.function.map.risk.Column.EXITED;
import static org.apache.spark.sql.functions.col;

import com.lohika.morning.risk.spark.driver.error.InsufficientLabelDiversityException;
import com.lohika.morning.risk.spark.driver.error.RiskPipelineException;
import com.lohika.morning.risk.spark.driver.service.MLService;
import com.lohika.morning.risk.spark.driver.service.dataset.RiskDatasetReader;
import com.lohika.morning.risk.spark.driver.service.model.ConfusionMatrix;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class ReportingGenerator {

    private static final Logger log = LoggerFactory.getLogger(ReportingGenerator.class);

    public static final String CONFUSION_MATRIX_JSON = "confusionmatrix.json";
    public static final String CONFUSION_MATRIX_PNG = "confusionmatrix.png";
    public static final String ROC_JSON = "auc.json";
    public static final String ROC_PNG = "auc.png";

    private static final String OPERATION = "reporting";

    @Autowired
    private RiskDatasetReader datasetReader;

    @Autowired
    private MLService mlService;

    @Autowired
    private ChartRenderer chartRenderer;

    /**
     * Scores the model in {@code modelFolder} on the test set and writes the confusion matrix and
     * ROC curve, each as a figure description and as a PNG, to {@code outputFolder}.
     *
     * @throws InsufficientLabelDiversityException if the test set does not contain both labels
     */
    public ModelReport generate(Path testDataFile, Path modelFolder, Path outputFolder) {
        log.info("Generating report for {} on {}", modelFolder, testDataFile);
        Dataset<Row> data = datasetReader.read(testDataFile, OPERATION);
        try {
            long classes = data.filter(col(EXITED.getName()).isNotNull())
                    .select(EXITED.getName())
                    .distinct()
                    .count();
            if (classes < 2) {
                log.error("Test set {} has {} label class(es), ROC needs both", testDataFile, classes);
                throw new InsufficientLabelDiversityException(OPERATION, testDataFile,
                        "need both label classes, found " + classes);
            }
            datasetReader.requireFeatures(data, testDataFile, OPERATION);

            Dataset<Row> predictions = mlService.loadClassifier(modelFolder)
                    .predict(data.drop(CORPORATION.getName()))
                    .cache();
            try {
                ConfusionMatrix matrix = ConfusionMatrix.of(predictions);
                log.info("Generated confusion matrix {}", matrix);
                RocCurve roc = RocCurve.of(predictions);
                log.info("Created ROC curve, AUC={}", roc.getAreaUnderCurve());
                return new ModelReport(matrix, roc, write(matrix, roc, outputFolder));
            } finally {
                predictions.unpersist();
            }
        } finally {
            data.unpersist();
        }
    }

    private List<Path> write(ConfusionMatrix matrix, RocCurve roc, Path outputFolder) {
        Path matrixJson = outputFolder.resolve(CONFUSION_MATRIX_JSON);
        Path matrixPng = outputFolder.resolve(CONFUSION_MATRIX_PNG);
        Path rocJson = outputFolder.resolve(ROC_JSON);
        Path rocPng = outputFolder.resolve(ROC_PNG);
        Path current = matrixJson;
        try {
            FigureDescription.confusionMatrix(matrix).write(matrixJson);
            current = matrixPng;
            chartRenderer.renderConfusionMatrix(matrix, matrixPng);
            current = rocJson;
            FigureDescription.roc(roc).write(rocJson);
            current = rocPng;
            chartRenderer.renderRocCurve(roc, rocPng);
        } catch (IOException e) {
            log.error("Could not write report figure {}", current, e);
            throw new RiskPipelineException(OPERATION, current, "cannot write figure: " + e.getMessage(), e);
        }
        log.info("Saved confusion matrix and ROC curve to {}", outputFolder);
        return List.of(matrixJson, matrixPng, rocJson, rocPng);
    }
}
