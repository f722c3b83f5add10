package com.lohika.morning.risk.spark.driver.service.deployment;

import com.lohika.morning.risk.spark.driver.error.DeploymentException;
import com.lohika.morning.risk.spark.driver.service.MLService;
import com.lohika.morning.risk.spark.driver.service.ingestion.IngestionManifest;
import com.lohika.morning.risk.spark.driver.service.scoring.ScoreFile;
import com.lohika.morning.risk.spark.driver.util.FileTrees;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Promotes a trained model, its score and the ingestion manifest into the production slot.
 * <p>
 * The new slot is assembled in a sibling directory and swapped in by renames. Readers may find
 * the slot missing for the duration of two renames, but never find old and new artifacts mixed.
 */
@Component
public class ModelDeployer {

    private static final Logger log = LoggerFactory.getLogger(ModelDeployer.class);

    private static final String OPERATION = "deployment";

    @Autowired
    private MLService mlService;

    public DeploymentSlot deploy(Path outputFolder, Path modelFolder, Path prodDeploymentPath) {
        Path slot = prodDeploymentPath.toAbsolutePath().normalize();
        Path parent = slot.getParent();
        String name = slot.getFileName().toString();

        Path model = mlService.modelPath(modelFolder);
        Path score = outputFolder.resolve(ScoreFile.FILE_NAME);
        Path manifest = outputFolder.resolve(IngestionManifest.FILE_NAME);
        for (Path artifact : List.of(model, score, manifest)) {
            if (!Files.exists(artifact)) {
                log.error("Cannot deploy, {} does not exist", artifact);
                throw new DeploymentException(OPERATION, artifact, "artifact to deploy does not exist");
            }
        }

        Path staging = parent.resolve("." + name + "-staging-" + UUID.randomUUID());
        log.info("Staging deployment in {}", staging);
        try {
            Files.createDirectories(staging);
            FileTrees.copy(model, staging.resolve(MLService.MODEL_DIRECTORY));
            FileTrees.copy(score, staging.resolve(ScoreFile.FILE_NAME));
            FileTrees.copy(manifest, staging.resolve(IngestionManifest.FILE_NAME));
        } catch (IOException e) {
            log.error("Failed to stage deployment, production slot {} is untouched", slot, e);
            DeploymentException failure = new DeploymentException(OPERATION, staging, "cannot stage artifacts: " + e.getMessage(), e);
            deleteQuietly(staging, failure);
            throw failure;
        }

        swap(staging, slot, parent.resolve("." + name + "-retired-" + UUID.randomUUID()));
        log.info("Deployed model, score and ingested file list to {}", slot);

        return currentSlot(slot).orElseThrow(() ->
                new DeploymentException(OPERATION, slot, "slot is incomplete after deployment"));
    }

    /** The live slot, or empty if nothing has been deployed yet. */
    public Optional<DeploymentSlot> currentSlot(Path prodDeploymentPath) {
        if (!isDeployed(prodDeploymentPath)) {
            return Optional.empty();
        }
        double baseline = ScoreFile.read(prodDeploymentPath).orElseThrow(() ->
                new DeploymentException("read slot", prodDeploymentPath, "baseline score is missing"));
        return Optional.of(new DeploymentSlot(
                prodDeploymentPath,
                mlService.modelPath(prodDeploymentPath),
                baseline,
                IngestionManifest.read(prodDeploymentPath)));
    }

    public boolean isDeployed(Path prodDeploymentPath) {
        return Files.isDirectory(mlService.modelPath(prodDeploymentPath))
                && Files.isRegularFile(prodDeploymentPath.resolve(ScoreFile.FILE_NAME))
                && Files.isRegularFile(prodDeploymentPath.resolve(IngestionManifest.FILE_NAME));
    }

    private void swap(Path staging, Path slot, Path retired) {
        boolean hadSlot = Files.exists(slot);
        try {
            if (hadSlot) {
                Files.move(slot, retired, StandardCopyOption.ATOMIC_MOVE);
            }
        } catch (IOException e) {
            log.error("Could not retire current slot {}", slot, e);
            DeploymentException failure = new DeploymentException(OPERATION, slot, "cannot retire current slot: " + e.getMessage(), e);
            deleteQuietly(staging, failure);
            throw failure;
        }

        try {
            Files.move(staging, slot, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Could not move staged slot into {}, restoring previous slot", slot, e);
            DeploymentException failure = new DeploymentException(OPERATION, slot, "cannot swap in staged slot: " + e.getMessage(), e);
            if (hadSlot) {
                try {
                    Files.move(retired, slot, StandardCopyOption.ATOMIC_MOVE);
                } catch (IOException restore) {
                    log.error("Could not restore previous slot from {}", retired, restore);
                    failure.addSuppressed(restore);
                }
            }
            deleteQuietly(staging, failure);
            throw failure;
        }

        if (hadSlot) {
            try {
                FileTrees.delete(retired);
            } catch (IOException e) {
                log.warn("Could not remove retired slot {}", retired, e);
            }
        }
    }

    private static void deleteQuietly(Path directory, DeploymentException failure) {
        try {
            FileTrees.delete(directory);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
