package com.lohika.morning.risk.spark.driver.orchestrator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.lohika.morning.risk.spark.driver.config.PipelineConfig;
import com.lohika.morning.risk.spark.driver.error.RiskPipelineException;
import com.lohika.morning.risk.spark.driver.service.deployment.DeploymentSlot;
import com.lohika.morning.risk.spark.driver.service.deployment.ModelDeployer;
import com.lohika.morning.risk.spark.driver.service.diagnostics.DiagnosticsCollector;
import com.lohika.morning.risk.spark.driver.service.ingestion.DataMerger;
import com.lohika.morning.risk.spark.driver.service.reporting.ReportingGenerator;
import com.lohika.morning.risk.spark.driver.service.scoring.ModelScorer;
import com.lohika.morning.risk.spark.driver.service.scoring.ScoreRecord;
import com.lohika.morning.risk.spark.driver.service.training.ModelTrainer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.InOrder;

public class DriftOrchestratorTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private final DataMerger dataMerger = mock(DataMerger.class);
    private final ModelScorer modelScorer = mock(ModelScorer.class);
    private final ModelTrainer modelTrainer = mock(ModelTrainer.class);
    private final ModelDeployer modelDeployer = mock(ModelDeployer.class);
    private final ReportingGenerator reportingGenerator = mock(ReportingGenerator.class);
    private final DiagnosticsCollector diagnosticsCollector = mock(DiagnosticsCollector.class);

    private DriftOrchestrator orchestrator;
    private PipelineConfig config;
    private Path input;
    private Path output;
    private Path models;
    private Path production;
    private Path dataset;

    @Before
    public void setUp() throws Exception {
        orchestrator = new DriftOrchestrator(dataMerger, modelScorer, modelTrainer, modelDeployer,
                reportingGenerator, diagnosticsCollector);

        input = temporaryFolder.newFolder("input").toPath();
        output = temporaryFolder.getRoot().toPath().resolve("output");
        models = temporaryFolder.getRoot().toPath().resolve("models");
        production = temporaryFolder.getRoot().toPath().resolve("production");
        dataset = output.resolve(DataMerger.DATASET_FILE);

        Map<String, String> values = new HashMap<>();
        values.put(PipelineConfig.INPUT_FOLDER_PATH, input.toString());
        values.put(PipelineConfig.OUTPUT_FOLDER_PATH, output.toString());
        values.put(PipelineConfig.OUTPUT_MODEL_PATH, models.toString());
        values.put(PipelineConfig.PROD_DEPLOYMENT_PATH, production.toString());
        values.put(PipelineConfig.TEST_DATA_PATH, temporaryFolder.getRoot().toPath().resolve("testdata").toString());
        values.put(PipelineConfig.INPUT_FILE_EXTENSION, "csv");
        config = PipelineConfig.of(values);

        Files.createFile(input.resolve("a.csv"));
    }

    @Test
    public void endsWithoutWritingWhenThereIsNoNewData() {
        deployed(0.70, "a.csv");

        RunReport report = orchestrator.run(config);

        assertEquals(Arrays.asList(PipelineState.CHECK_NEW_DATA, PipelineState.DONE), report.getStates());
        assertTrue(report.isNoOp());
        assertTrue(report.getNewFiles().isEmpty());
        verifyNoInteractions(dataMerger, modelScorer, modelTrainer, reportingGenerator, diagnosticsCollector);
        verify(modelDeployer, never()).deploy(any(), any(), any());
    }

    @Test
    public void equalScoreIsNotDrift() throws Exception {
        deployed(0.70, "a.csv");
        Files.createFile(input.resolve("b.csv"));
        when(modelScorer.score(dataset, production, output)).thenReturn(score(0.70));

        RunReport report = orchestrator.run(config);

        assertEquals(Arrays.asList(PipelineState.CHECK_NEW_DATA, PipelineState.INGEST, PipelineState.SCORE,
                PipelineState.COMPARE, PipelineState.DONE), report.getStates());
        assertEquals(Arrays.asList("b.csv"), report.getNewFiles());
        assertFalse(report.isDrift());
        verify(dataMerger).merge(input, output, "csv");
        verifyNoInteractions(modelTrainer, reportingGenerator);
        verify(modelDeployer, never()).deploy(any(), any(), any());
    }

    @Test
    public void driftRetrainsRedeploysAndReports() throws Exception {
        deployed(0.85, "a.csv");
        Files.createFile(input.resolve("b.csv"));
        when(modelScorer.score(dataset, production, output)).thenReturn(score(0.80));
        when(modelScorer.score(dataset, models, output)).thenReturn(score(0.82));
        when(modelDeployer.deploy(output, models, production))
                .thenReturn(new DeploymentSlot(production, production.resolve("trainedmodel"), 0.82,
                        Arrays.asList("a.csv", "b.csv")));

        RunReport report = orchestrator.run(config);

        assertEquals(Arrays.asList(PipelineState.values()), report.getStates());
        assertTrue(report.isDrift());
        assertTrue(report.isRedeployed());
        assertEquals(0.85, report.getBaselineScore(), 0.0);
        assertEquals(0.80, report.getWorkingScore(), 0.0);
        assertEquals(0.82, report.getNewModelScore(), 0.0);

        InOrder order = inOrder(dataMerger, modelScorer, modelTrainer, modelDeployer, reportingGenerator, diagnosticsCollector);
        order.verify(dataMerger).merge(input, output, "csv");
        order.verify(modelScorer).score(dataset, production, output);
        order.verify(modelTrainer).train(output, models);
        order.verify(modelScorer).score(dataset, models, output);
        order.verify(modelDeployer).deploy(output, models, production);
        order.verify(reportingGenerator).generate(config.testDataFile(), production, models);
        order.verify(diagnosticsCollector).collect(config);
    }

    @Test
    public void firstRunTrainsAndDeploysWithoutComparing() {
        when(modelScorer.score(dataset, models, output)).thenReturn(score(0.90));
        when(modelDeployer.deploy(output, models, production))
                .thenReturn(new DeploymentSlot(production, production.resolve("trainedmodel"), 0.90, Arrays.asList("a.csv")));

        RunReport report = orchestrator.run(config);

        assertTrue(report.isBootstrap());
        assertTrue(report.isDrift());
        assertEquals(Arrays.asList("a.csv"), report.getNewFiles());
        assertEquals(Arrays.asList(PipelineState.CHECK_NEW_DATA, PipelineState.INGEST, PipelineState.RETRAIN,
                PipelineState.REDEPLOY, PipelineState.REPORT, PipelineState.DONE), report.getStates());
        assertNull(report.getBaselineScore());
        assertNull(report.getWorkingScore());
        verify(modelScorer, never()).score(dataset, production, output);
        verify(modelDeployer).deploy(output, models, production);
    }

    @Test
    public void componentFailureEndsRunBeforeDeployment() throws Exception {
        deployed(0.85, "a.csv");
        Files.createFile(input.resolve("b.csv"));
        when(modelScorer.score(dataset, production, output)).thenReturn(score(0.80));
        RiskPipelineException failure = new RiskPipelineException("training", dataset, "disk full");
        when(modelTrainer.train(output, models)).thenThrow(failure);

        try {
            orchestrator.run(config);
            fail("Expected the training failure to propagate");
        } catch (RiskPipelineException e) {
            assertSame(failure, e);
        }
        verify(modelDeployer, never()).deploy(any(), any(), any());
        verifyNoInteractions(reportingGenerator, diagnosticsCollector);
    }

    private void deployed(double baseline, String... ingested) {
        List<String> files = Arrays.asList(ingested);
        when(modelDeployer.currentSlot(production))
                .thenReturn(Optional.of(new DeploymentSlot(production, production.resolve("trainedmodel"), baseline, files)));
    }

    private ScoreRecord score(double value) {
        return new ScoreRecord(value, dataset, models);
    }
}
