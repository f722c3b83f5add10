package com.lohika.morning.risk.spark.driver.service.diagnostics;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lohika.morning.risk.spark.driver.error.RiskPipelineException;
import com.lohika.morning.risk.spark.driver.util.JsonFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Wall-clock duration of the latest ingestion and training runs, kept in
 * {@value #FILE_NAME} in the dataset folder.
 */
@Component
public class StageTimings {

    private static final Logger log = LoggerFactory.getLogger(StageTimings.class);

    public static final String FILE_NAME = "timings.json";

    public enum Stage {
        INGESTION("ingestion_time"),
        TRAINING("training_time");

        private final String key;

        Stage(String key) {
            this.key = key;
        }

        public String getKey() {
            return key;
        }
    }

    /**
     * Records the duration of a finished stage. A timing that cannot be stored is logged and
     * dropped: the stage itself already succeeded.
     */
    public void record(Path folder, Stage stage, Duration duration) {
        Path file = folder.resolve(FILE_NAME);
        try {
            Map<String, Double> timings = Files.exists(file) ? read(folder) : new LinkedHashMap<>();
            timings.put(stage.getKey(), duration.toNanos() / 1e9);
            JsonFiles.write(file, timings);
            log.info("Collected {} of {} seconds", stage.getKey(), timings.get(stage.getKey()));
        } catch (IOException | RiskPipelineException e) {
            log.warn("Could not record {} in {}", stage.getKey(), file, e);
        }
    }

    public Map<String, Double> read(Path folder) {
        Path file = folder.resolve(FILE_NAME);
        if (!Files.exists(file)) {
            throw new RiskPipelineException("read timings", file, "no stage has been timed yet");
        }
        try {
            return new LinkedHashMap<>(JsonFiles.read(file, new TypeReference<Map<String, Double>>() {}));
        } catch (IOException e) {
            throw new RiskPipelineException("read timings", file, e.getMessage(), e);
        }
    }
}
