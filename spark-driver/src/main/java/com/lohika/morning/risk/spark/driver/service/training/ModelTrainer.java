package com.lohika.morning.risk.spark.driver.service.training;

import static com.lohika.morning.risk.spark.distributed.library.function.map.risk.Column.CORPORATION;
import static com.lohika.morning.risk.spark.distributed.library.function.map.risk.Column.EXITED;
import static com.lohika.morning.risk.spark.distributed.library.function.map.risk.Column.FEATURES;
import static org.apache.spark.sql.functions.col;

import com.lohika.morning.risk.spark.distributed.library.function.map.risk.Column;
import com.lohika.morning.risk.spark.driver.error.NoInputDataException;
import com.lohika.morning.risk.spark.driver.service.MLService;
import com.lohika.morning.risk.spark.driver.service.dataset.RiskDatasetReader;
import com.lohika.morning.risk.spark.driver.service.diagnostics.StageTimings;
import com.lohika.morning.risk.spark.driver.service.ingestion.DataMerger;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.spark.ml.Pipeline;
import org.apache.spark.ml.PipelineModel;
import org.apache.spark.ml.PipelineStage;
import org.apache.spark.ml.classification.LogisticRegression;
import org.apache.spark.ml.classification.LogisticRegressionModel;
import org.apache.spark.ml.feature.VectorAssembler;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fits the risk classifier on the merged dataset and saves it to the staging model folder.
 */
@Component
public class ModelTrainer {

    private static final Logger log = LoggerFactory.getLogger(ModelTrainer.class);

    private static final String OPERATION = "training";

    /** Inverse regularization strength, as in the usual {@code C} formulation of logistic regression. */
    static final double INVERSE_REGULARIZATION = 1.0;
    static final int MAX_ITERATIONS = 100;
    static final double TOLERANCE = 1e-4;

    @Autowired
    private RiskDatasetReader datasetReader;

    @Autowired
    private MLService mlService;

    @Autowired
    private StageTimings stageTimings;

    /**
     * Trains on {@code datasetFolder/finaldata.csv} and writes the model to
     * {@code modelFolder/trainedmodel}, replacing any model already there.
     *
     * @return path of the saved model
     */
    public Path train(Path datasetFolder, Path modelFolder) {
        long started = System.nanoTime();
        Path datasetFile = datasetFolder.resolve(DataMerger.DATASET_FILE);
        log.info("Reading training data from {}", datasetFile);

        Dataset<Row> data = datasetReader.read(datasetFile, OPERATION);
        try {
            Dataset<Row> trainingSet = data
                    .drop(CORPORATION.getName())
                    .filter(col(EXITED.getName()).isNotNull())
                    .na().drop(Column.featureColumnNames());
            long count = trainingSet.count();
            if (count == 0) {
                log.error("No labeled records in {}", datasetFile);
                throw new NoInputDataException(OPERATION, datasetFile, "no labeled records to train on");
            }
            long labeled = data.filter(col(EXITED.getName()).isNotNull()).count();
            if (labeled > count) {
                log.warn("Skipping {} labeled records with missing feature values", labeled - count);
            }
            log.info("Training logistic regression on {} records", count);

            PipelineModel model = pipeline(count).fit(trainingSet);

            LogisticRegressionModel regression = (LogisticRegressionModel) model.stages()[model.stages().length - 1];
            log.info("Logistic Regression Coefficients: {}", regression.coefficients());
            log.info("Logistic Regression Intercept: {}", regression.intercept());

            Path modelPath = mlService.saveModel(model, modelFolder);
            stageTimings.record(datasetFolder, StageTimings.Stage.TRAINING, Duration.ofNanos(System.nanoTime() - started));
            return modelPath;
        } finally {
            data.unpersist();
        }
    }

    Pipeline pipeline(long recordCount) {
        VectorAssembler assembler = new VectorAssembler()
                .setInputCols(Column.featureColumnNames())
                .setOutputCol(FEATURES.getName())
                .setHandleInvalid("error");

        // Spark scales the penalty by the record count, C does not
        LogisticRegression logisticRegression = new LogisticRegression()
                .setFeaturesCol(FEATURES.getName())
                .setLabelCol(EXITED.getName())
                .setFamily("binomial")
                .setRegParam(1.0 / (INVERSE_REGULARIZATION * recordCount))
                .setElasticNetParam(0.0)
                .setFitIntercept(true)
                .setStandardization(false)
                .setMaxIter(MAX_ITERATIONS)
                .setTol(TOLERANCE);

        return new Pipeline().setStages(new PipelineStage[]{assembler, logisticRegression});
    }
}
