package com.lohika.morning.risk.spark.driver.cli;

import com.lohika.morning.risk.spark.driver.config.PipelineConfig;
import com.lohika.morning.risk.spark.driver.orchestrator.DriftOrchestrator;
import com.lohika.morning.risk.spark.driver.orchestrator.RunReport;
import com.lohika.morning.risk.spark.driver.service.deployment.ModelDeployer;
import com.lohika.morning.risk.spark.driver.service.diagnostics.DiagnosticsBundle;
import com.lohika.morning.risk.spark.driver.service.diagnostics.DiagnosticsCollector;
import com.lohika.morning.risk.spark.driver.service.ingestion.DataMerger;
import com.lohika.morning.risk.spark.driver.service.reporting.ReportingGenerator;
import com.lohika.morning.risk.spark.driver.service.scoring.ModelScorer;
import com.lohika.morning.risk.spark.driver.service.training.ModelTrainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationContext;

/**
 * Pipeline steps that can be run one at a time, plus {@link #fullprocess} for the whole drift check.
 */
public enum PipelineCommand {

    ingest("Merge the input folder into the canonical dataset") {
        @Override
        int execute(ApplicationContext context, PipelineConfig config) {
            log.info("Ingested {}", context.getBean(DataMerger.class)
                    .merge(config.inputFolderPath(), config.outputFolderPath(), config.inputFileExtension()));
            return 0;
        }
    },
    train("Train a model on the canonical dataset into the staging model folder") {
        @Override
        int execute(ApplicationContext context, PipelineConfig config) {
            log.info("Trained model saved to {}", context.getBean(ModelTrainer.class)
                    .train(config.outputFolderPath(), config.outputModelPath()));
            return 0;
        }
    },
    score("Score the staged model on the test data") {
        @Override
        int execute(ApplicationContext context, PipelineConfig config) {
            log.info("Scored {}", context.getBean(ModelScorer.class)
                    .score(config.testDataFile(), config.outputModelPath(), config.outputFolderPath()));
            return 0;
        }
    },
    deploy("Promote the staged model, its score and the ingestion manifest to production") {
        @Override
        int execute(ApplicationContext context, PipelineConfig config) {
            log.info("Deployed {}", context.getBean(ModelDeployer.class)
                    .deploy(config.outputFolderPath(), config.outputModelPath(), config.prodDeploymentPath()));
            return 0;
        }
    },
    diagnostics("Collect diagnostics of the deployed model and the dataset") {
        @Override
        int execute(ApplicationContext context, PipelineConfig config) {
            DiagnosticsBundle bundle = context.getBean(DiagnosticsCollector.class).collect(config);
            if (!bundle.getErrors().isEmpty()) {
                log.warn("Diagnostics sections failed: {}", bundle.getErrors());
            }
            return 0;
        }
    },
    report("Plot the confusion matrix and ROC curve of the deployed model") {
        @Override
        int execute(ApplicationContext context, PipelineConfig config) {
            log.info("Report written to {}", context.getBean(ReportingGenerator.class)
                    .generate(config.testDataFile(), config.prodDeploymentPath(), config.outputModelPath())
                    .getFiles());
            return 0;
        }
    },
    fullprocess("Check for new data and redeploy on model drift") {
        @Override
        int execute(ApplicationContext context, PipelineConfig config) {
            RunReport report = context.getBean(DriftOrchestrator.class).run(config);
            log.info("Visited {}", report.getStates());
            return 0;
        }
    };

    private static final Logger log = LoggerFactory.getLogger(PipelineCommand.class);

    private final String description;

    PipelineCommand(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    abstract int execute(ApplicationContext context, PipelineConfig config);
}
