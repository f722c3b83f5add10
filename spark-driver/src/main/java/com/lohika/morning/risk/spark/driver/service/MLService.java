package com.lohika.morning.risk.spark.driver.service;

import com.lohika.morning.risk.spark.driver.error.ModelLoadException;
import com.lohika.morning.risk.spark.driver.error.RiskPipelineException;
import com.lohika.morning.risk.spark.driver.service.model.Classifier;
import com.lohika.morning.risk.spark.driver.service.model.SparkPipelineClassifier;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.spark.ml.PipelineModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Saves and loads model artifacts. A model folder (staging or production) holds the
 * fitted pipeline under {@value #MODEL_DIRECTORY}.
 */
@Component
public class MLService {

    private static final Logger log = LoggerFactory.getLogger(MLService.class);

    public static final String MODEL_DIRECTORY = "trainedmodel";

    public Path modelPath(Path modelFolder) {
        return modelFolder.resolve(MODEL_DIRECTORY);
    }

    public Path saveModel(PipelineModel model, Path modelFolder) {
        Path modelPath = modelPath(modelFolder);
        log.info("Saving model to {}", modelPath);
        try {
            Files.createDirectories(modelFolder);
            model.write().overwrite().save(modelPath.toAbsolutePath().toString());
        } catch (IOException e) {
            log.error("Error writing model to {}", modelPath, e);
            throw new RiskPipelineException("save model", modelPath, "cannot write model: " + e.getMessage(), e);
        }
        return modelPath;
    }

    public PipelineModel loadPipelineModel(Path modelFolder) {
        Path modelPath = modelPath(modelFolder);
        if (!Files.isDirectory(modelPath)) {
            log.error("No model found at {}. Has it been trained?", modelPath);
            throw new ModelLoadException("load model", modelPath, "model artifact does not exist");
        }
        log.info("Loading model from path: {}", modelPath);
        try {
            return PipelineModel.load(modelPath.toAbsolutePath().toString());
        } catch (Exception e) {
            log.error("Failed to load model from {}", modelPath, e);
            throw new ModelLoadException("load model", modelPath, "cannot deserialize model: " + e.getMessage(), e);
        }
    }

    public Classifier loadClassifier(Path modelFolder) {
        return new SparkPipelineClassifier(loadPipelineModel(modelFolder));
    }
}
