package com.lohika.morning.risk.spark.driver.service.deployment;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.lohika.morning.risk.spark.driver.BaseTest;
import com.lohika.morning.risk.spark.driver.error.DeploymentException;
import com.lohika.morning.risk.spark.driver.service.MLService;
import com.lohika.morning.risk.spark.driver.service.ingestion.IngestionManifest;
import com.lohika.morning.risk.spark.driver.service.scoring.ScoreFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.stream.Stream;
import org.junit.Before;
import org.junit.Test;
import org.springframework.beans.factory.annotation.Autowired;

public class ModelDeployerTest extends BaseTest {

    @Autowired
    private ModelDeployer modelDeployer;

    private Path output;
    private Path models;
    private Path production;

    @Before
    public void setUp() throws Exception {
        output = newFolder("output");
        models = newFolder("models");
        production = temporaryFolder.getRoot().toPath().resolve("production");
    }

    @Test
    public void promotesModelScoreAndManifest() throws Exception {
        stage("model-v1", 0.75, "a.csv");

        DeploymentSlot slot = modelDeployer.deploy(output, models, production);

        assertEquals(0.75, slot.getBaselineScore(), 0.0);
        assertEquals(Arrays.asList("a.csv"), slot.getIngestedFiles());
        assertEquals("model-v1", modelMarker(production));
        assertTrue(modelDeployer.isDeployed(production));
        assertNoLeftovers();
    }

    @Test
    public void replacesPreviousSlotAsAWhole() throws Exception {
        stage("model-v1", 0.75, "a.csv");
        Files.write(models.resolve(MLService.MODEL_DIRECTORY).resolve("only-in-v1"), new byte[]{1});
        modelDeployer.deploy(output, models, production);

        Files.delete(models.resolve(MLService.MODEL_DIRECTORY).resolve("only-in-v1"));
        stage("model-v2", 0.82, "a.csv", "b.csv");
        DeploymentSlot slot = modelDeployer.deploy(output, models, production);

        assertEquals(0.82, slot.getBaselineScore(), 0.0);
        assertEquals(Arrays.asList("a.csv", "b.csv"), slot.getIngestedFiles());
        assertEquals("model-v2", modelMarker(production));
        assertFalse(Files.exists(production.resolve(MLService.MODEL_DIRECTORY).resolve("only-in-v1")));
        assertNoLeftovers();
    }

    @Test
    public void failedStagingLeavesPreviousSlotIntact() throws Exception {
        stage("model-v1", 0.75, "a.csv");
        modelDeployer.deploy(output, models, production);
        byte[] manifest = Files.readAllBytes(production.resolve(IngestionManifest.FILE_NAME));

        stage("model-v2", 0.82, "a.csv", "b.csv");
        Files.delete(output.resolve(ScoreFile.FILE_NAME));
        try {
            modelDeployer.deploy(output, models, production);
            fail("Expected DeploymentException");
        } catch (DeploymentException e) {
            assertEquals(output.resolve(ScoreFile.FILE_NAME), e.getPath());
        }

        assertEquals("model-v1", modelMarker(production));
        assertEquals(0.75, modelDeployer.currentSlot(production).get().getBaselineScore(), 0.0);
        assertArrayEquals(manifest, Files.readAllBytes(production.resolve(IngestionManifest.FILE_NAME)));
        assertNoLeftovers();
    }

    @Test
    public void emptySlotIsNotDeployed() throws Exception {
        assertFalse(modelDeployer.isDeployed(production));
        assertFalse(modelDeployer.currentSlot(production).isPresent());

        Files.createDirectories(production);
        ScoreFile.write(production, 0.5);
        assertFalse(modelDeployer.currentSlot(production).isPresent());
    }

    private void stage(String marker, double score, String... ingested) throws Exception {
        Path model = models.resolve(MLService.MODEL_DIRECTORY);
        Files.createDirectories(model.resolve("metadata"));
        Files.write(model.resolve("metadata").resolve("part-00000"), marker.getBytes(StandardCharsets.UTF_8));
        ScoreFile.write(output, score);
        IngestionManifest.write(output, Arrays.asList(ingested));
    }

    private static String modelMarker(Path slot) throws Exception {
        Path part = slot.resolve(MLService.MODEL_DIRECTORY).resolve("metadata").resolve("part-00000");
        return new String(Files.readAllBytes(part), StandardCharsets.UTF_8);
    }

    private void assertNoLeftovers() throws Exception {
        try (Stream<Path> entries = Files.list(temporaryFolder.getRoot().toPath())) {
            assertTrue(entries.noneMatch(entry -> entry.getFileName().toString().startsWith(".production")));
        }
    }
}
