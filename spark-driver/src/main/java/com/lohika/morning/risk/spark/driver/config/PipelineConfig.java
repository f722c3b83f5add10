package com.lohika.morning.risk.spark.driver.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lohika.morning.risk.spark.driver.error.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paths and settings shared by every pipeline component, read from {@code config.json}.
 * <p>
 * There are no defaults: a key is only checked when a component asks for it, so a missing key
 * fails the component that needs it and nothing else.
 */
public final class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String INPUT_FOLDER_PATH = "input_folder_path";
    public static final String OUTPUT_FOLDER_PATH = "output_folder_path";
    public static final String OUTPUT_MODEL_PATH = "output_model_path";
    public static final String PROD_DEPLOYMENT_PATH = "prod_deployment_path";
    public static final String TEST_DATA_PATH = "test_data_path";
    public static final String INPUT_FILE_EXTENSION = "input_file_extension";
    public static final String URL = "url";

    public static final String TEST_DATA_FILE = "testdata.csv";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path source;
    private final Map<String, String> values;

    private PipelineConfig(Path source, Map<String, String> values) {
        this.source = source;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static PipelineConfig load(Path configFile) {
        log.info("Loading pipeline configuration from {}", configFile);
        if (!Files.isRegularFile(configFile)) {
            throw new ConfigurationException(configFile, "configuration file does not exist", null);
        }
        try {
            Map<String, String> values = MAPPER.readValue(configFile.toFile(), new TypeReference<Map<String, String>>() {});
            return new PipelineConfig(configFile, values == null ? Collections.emptyMap() : values);
        } catch (IOException e) {
            log.error("Cannot parse configuration file {}", configFile, e);
            throw new ConfigurationException(configFile, "cannot parse configuration: " + e.getMessage(), e);
        }
    }

    public static PipelineConfig of(Map<String, String> values) {
        return new PipelineConfig(null, values);
    }

    public Path inputFolderPath() {
        return path(INPUT_FOLDER_PATH);
    }

    public Path outputFolderPath() {
        return path(OUTPUT_FOLDER_PATH);
    }

    public Path outputModelPath() {
        return path(OUTPUT_MODEL_PATH);
    }

    public Path prodDeploymentPath() {
        return path(PROD_DEPLOYMENT_PATH);
    }

    public Path testDataPath() {
        return path(TEST_DATA_PATH);
    }

    public Path testDataFile() {
        return testDataPath().resolve(TEST_DATA_FILE);
    }

    public String inputFileExtension() {
        return require(INPUT_FILE_EXTENSION);
    }

    public String url() {
        return require(URL);
    }

    public Path getSource() {
        return source;
    }

    private Path path(String key) {
        return Paths.get(require(key));
    }

    private String require(String key) {
        String value = values.get(key);
        if (value == null || value.trim().isEmpty()) {
            log.error("Configuration key '{}' is missing (source: {})", key, source);
            throw new ConfigurationException(source, key);
        }
        return value.trim();
    }

    @Override
    public String toString() {
        return "PipelineConfig" + values;
    }
}
