package com.lohika.morning.risk.spark.driver.service.scoring;

import com.lohika.morning.risk.spark.distributed.library.function.map.risk.Column;
import com.lohika.morning.risk.spark.driver.error.NoInputDataException;
import com.lohika.morning.risk.spark.driver.service.MLService;
import com.lohika.morning.risk.spark.driver.service.dataset.RiskDatasetReader;
import com.lohika.morning.risk.spark.driver.service.model.Classifier;
import com.lohika.morning.risk.spark.driver.service.model.ConfusionMatrix;
import java.nio.file.Path;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class ModelScorer {

    private static final Logger log = LoggerFactory.getLogger(ModelScorer.class);

    private static final String OPERATION = "scoring";

    @Autowired
    private RiskDatasetReader datasetReader;

    @Autowired
    private MLService mlService;

    /**
     * F1 of the positive class for the model in {@code modelFolder} on {@code testDataFile}.
     * The score is written to {@code outputFolder/latestscore.txt}, replacing the previous one.
     */
    public ScoreRecord score(Path testDataFile, Path modelFolder, Path outputFolder) {
        log.info("Scoring model {} on {}", modelFolder, testDataFile);
        Dataset<Row> data = datasetReader.read(testDataFile, OPERATION);
        try {
            if (data.isEmpty()) {
                log.error("Test data {} has no records", testDataFile);
                throw new NoInputDataException(OPERATION, testDataFile, "dataset has no records");
            }
            datasetReader.requireFeatures(data, testDataFile, OPERATION);

            Classifier classifier = mlService.loadClassifier(modelFolder);
            Dataset<Row> predictions = classifier.predict(data.drop(Column.CORPORATION.getName()));
            ConfusionMatrix matrix = ConfusionMatrix.of(predictions);
            double f1 = matrix.f1();
            log.info("F1 score is {} ({})", f1, matrix);

            Path scoreFile = ScoreFile.write(outputFolder, f1);
            log.info("Saved score to {}", scoreFile);
            return new ScoreRecord(f1, testDataFile, mlService.modelPath(modelFolder));
        } finally {
            data.unpersist();
        }
    }
}
