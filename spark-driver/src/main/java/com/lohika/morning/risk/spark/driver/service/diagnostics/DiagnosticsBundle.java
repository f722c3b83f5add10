package com.lohika.morning.risk.spark.driver.service.diagnostics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health report of the deployed model and its data. A section that could not be collected
 * is left {@code null} and its failure is listed under {@code errors}.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public class DiagnosticsBundle {

    private Map<String, Map<String, Double>> summaryStatistics;
    private Map<String, Long> missingData;
    private Map<String, Double> timings;
    private List<OutdatedDependency> outdatedPackages;
    private final Map<String, String> errors = new LinkedHashMap<>();

    @JsonProperty("summary_statistics")
    public Map<String, Map<String, Double>> getSummaryStatistics() {
        return summaryStatistics;
    }

    public void setSummaryStatistics(Map<String, Map<String, Double>> summaryStatistics) {
        this.summaryStatistics = summaryStatistics;
    }

    @JsonProperty("missing_data")
    public Map<String, Long> getMissingData() {
        return missingData;
    }

    public void setMissingData(Map<String, Long> missingData) {
        this.missingData = missingData;
    }

    @JsonProperty("timings")
    public Map<String, Double> getTimings() {
        return timings;
    }

    public void setTimings(Map<String, Double> timings) {
        this.timings = timings;
    }

    @JsonProperty("outdated_packages")
    public List<OutdatedDependency> getOutdatedPackages() {
        return outdatedPackages;
    }

    public void setOutdatedPackages(List<OutdatedDependency> outdatedPackages) {
        this.outdatedPackages = outdatedPackages;
    }

    @JsonProperty("errors")
    public Map<String, String> getErrors() {
        return errors;
    }

    public void addError(String section, String message) {
        errors.put(section, message);
    }
}
