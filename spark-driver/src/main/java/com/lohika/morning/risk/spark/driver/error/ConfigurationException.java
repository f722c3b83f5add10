package com.lohika.morning.risk.spark.driver.error;

import java.nio.file.Path;

/** A required configuration key is absent, or the configuration file cannot be read. */
public class ConfigurationException extends RiskPipelineException {

    private final String key;

    public ConfigurationException(Path path, String key) {
        super("configuration", path, "required key '" + key + "' is missing");
        this.key = key;
    }

    public ConfigurationException(Path path, String message, Throwable cause) {
        super("configuration", path, message, cause);
        this.key = null;
    }

    public String getKey() {
        return key;
    }
}
