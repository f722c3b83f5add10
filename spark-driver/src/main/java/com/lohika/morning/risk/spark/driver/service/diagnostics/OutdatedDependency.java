package com.lohika.morning.risk.spark.driver.service.diagnostics;

import com.fasterxml.jackson.annotation.JsonProperty;

public class OutdatedDependency {

    private final String name;
    private final String installedVersion;
    private final String latestVersion;

    public OutdatedDependency(String name, String installedVersion, String latestVersion) {
        this.name = name;
        this.installedVersion = installedVersion;
        this.latestVersion = latestVersion;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("installed_version")
    public String getInstalledVersion() {
        return installedVersion;
    }

    @JsonProperty("latest_version")
    public String getLatestVersion() {
        return latestVersion;
    }

    @Override
    public String toString() {
        return name + " " + installedVersion + " -> " + latestVersion;
    }
}
