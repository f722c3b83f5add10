package com.lohika.morning.risk.api.service;

import com.lohika.morning.risk.spark.driver.config.PipelineConfig;
import com.lohika.morning.risk.spark.driver.error.RiskPipelineException;
import com.lohika.morning.risk.spark.driver.service.diagnostics.DiagnosticsBundle;
import com.lohika.morning.risk.spark.driver.service.diagnostics.DiagnosticsCollector;
import com.lohika.morning.risk.spark.driver.service.scoring.ScoreFile;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class RiskService {

    private static final Logger log = LoggerFactory.getLogger(RiskService.class);

    @Autowired
    private PipelineConfig pipelineConfig;

    @Autowired
    private DiagnosticsCollector diagnosticsCollector;

    public List<Integer> predict(String filepath) {
        log.info("Predicting {} with the deployed model", filepath);
        return diagnosticsCollector.modelPredictions(Paths.get(filepath), pipelineConfig.prodDeploymentPath());
    }

    /** Baseline score of the deployed model, as stored in the production slot. */
    public String latestScore() {
        Path file = pipelineConfig.prodDeploymentPath().resolve(ScoreFile.FILE_NAME);
        try {
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Cannot read score from {}", file, e);
            throw new RiskPipelineException("read score", file, "no deployed score: " + e.getMessage(), e);
        }
    }

    public Map<String, Map<String, Double>> summaryStatistics() {
        return diagnosticsCollector.dataframeSummary(pipelineConfig.outputFolderPath());
    }

    public Map<String, Object> diagnostics() {
        DiagnosticsBundle bundle = diagnosticsCollector.collect(pipelineConfig);
        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("timings", bundle.getTimings());
        diagnostics.put("missing_data", bundle.getMissingData());
        diagnostics.put("outdated_packages", bundle.getOutdatedPackages());
        if (!bundle.getErrors().isEmpty()) {
            diagnostics.put("errors", bundle.getErrors());
        }
        return diagnostics;
    }
}
