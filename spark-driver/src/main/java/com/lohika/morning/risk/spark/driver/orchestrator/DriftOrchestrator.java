package com.lohika.morning.risk.spark.driver.orchestrator;

import com.lohika.morning.risk.spark.driver.config.PipelineConfig;
import com.lohika.morning.risk.spark.driver.service.deployment.DeploymentSlot;
import com.lohika.morning.risk.spark.driver.service.deployment.ModelDeployer;
import com.lohika.morning.risk.spark.driver.service.diagnostics.DiagnosticsCollector;
import com.lohika.morning.risk.spark.driver.service.ingestion.DataMerger;
import com.lohika.morning.risk.spark.driver.service.reporting.ReportingGenerator;
import com.lohika.morning.risk.spark.driver.service.scoring.ModelScorer;
import com.lohika.morning.risk.spark.driver.service.training.ModelTrainer;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Checks for new data, re-scores the deployed model on it and, if the model has drifted,
 * retrains, redeploys and reports.
 * <p>
 * Component failures are not caught here: any of them ends the run, leaving the production
 * slot as it was unless the deployment itself already completed.
 */
@Component
public class DriftOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DriftOrchestrator.class);

    private final DataMerger dataMerger;
    private final ModelScorer modelScorer;
    private final ModelTrainer modelTrainer;
    private final ModelDeployer modelDeployer;
    private final ReportingGenerator reportingGenerator;
    private final DiagnosticsCollector diagnosticsCollector;

    @Autowired
    public DriftOrchestrator(DataMerger dataMerger,
                             ModelScorer modelScorer,
                             ModelTrainer modelTrainer,
                             ModelDeployer modelDeployer,
                             ReportingGenerator reportingGenerator,
                             DiagnosticsCollector diagnosticsCollector) {
        this.dataMerger = dataMerger;
        this.modelScorer = modelScorer;
        this.modelTrainer = modelTrainer;
        this.modelDeployer = modelDeployer;
        this.reportingGenerator = reportingGenerator;
        this.diagnosticsCollector = diagnosticsCollector;
    }

    public RunReport run(PipelineConfig config) {
        RunReport report = new RunReport();
        Path prodDeploymentPath = config.prodDeploymentPath();
        Path outputFolder = config.outputFolderPath();
        Path modelFolder = config.outputModelPath();

        report.visit(PipelineState.CHECK_NEW_DATA);
        Optional<DeploymentSlot> slot = modelDeployer.currentSlot(prodDeploymentPath);
        report.setBootstrap(!slot.isPresent());
        Set<String> ingested = new HashSet<>(slot.map(DeploymentSlot::getIngestedFiles).orElse(Collections.emptyList()));
        List<String> newFiles = DataMerger.listSourceFiles(config.inputFolderPath(), config.inputFileExtension()).stream()
                .map(file -> file.getFileName().toString())
                .filter(name -> !ingested.contains(name))
                .collect(Collectors.toList());
        report.setNewFiles(newFiles);
        if (newFiles.isEmpty()) {
            log.info("No new data found, ending process");
            return done(report);
        }
        log.info("Found new files {}", newFiles);

        report.visit(PipelineState.INGEST);
        dataMerger.merge(config.inputFolderPath(), outputFolder, config.inputFileExtension());
        Path datasetFile = outputFolder.resolve(DataMerger.DATASET_FILE);

        if (slot.isPresent()) {
            report.visit(PipelineState.SCORE);
            double working = modelScorer.score(datasetFile, prodDeploymentPath, outputFolder).getValue();
            double baseline = slot.get().getBaselineScore();
            report.setWorkingScore(working);
            report.setBaselineScore(baseline);

            report.visit(PipelineState.COMPARE);
            boolean drift = DriftPolicy.isDrift(baseline, working);
            report.setDrift(drift);
            if (!drift) {
                log.info("No model drift detected (baseline {}, working {}), ending process", baseline, working);
                return done(report);
            }
            log.info("Model drift detected (baseline {}, working {})", baseline, working);
        } else {
            log.info("No model deployed yet, training the first one");
            report.setDrift(true);
        }

        report.visit(PipelineState.RETRAIN);
        modelTrainer.train(outputFolder, modelFolder);

        report.visit(PipelineState.REDEPLOY);
        double newScore = modelScorer.score(datasetFile, modelFolder, outputFolder).getValue();
        report.setNewModelScore(newScore);
        DeploymentSlot deployed = modelDeployer.deploy(outputFolder, modelFolder, prodDeploymentPath);
        log.info("Deployed new model with baseline {}", deployed.getBaselineScore());

        report.visit(PipelineState.REPORT);
        reportingGenerator.generate(config.testDataFile(), prodDeploymentPath, modelFolder);
        diagnosticsCollector.collect(config);

        return done(report);
    }

    private static RunReport done(RunReport report) {
        report.visit(PipelineState.DONE);
        log.info("Run finished: {}", report);
        return report;
    }
}
