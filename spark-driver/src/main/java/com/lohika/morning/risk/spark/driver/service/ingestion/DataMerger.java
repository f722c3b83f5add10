package com.lohika.morning.risk.spark.driver.service.ingestion;

import com.lohika.morning.risk.spark.distributed.library.function.map.risk.Column;
import com.lohika.morning.risk.spark.driver.error.NoInputDataException;
import com.lohika.morning.risk.spark.driver.error.RiskPipelineException;
import com.lohika.morning.risk.spark.driver.service.dataset.RiskDatasetReader;
import com.lohika.morning.risk.spark.driver.service.diagnostics.StageTimings;
import com.lohika.morning.risk.spark.driver.util.FileTrees;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Merges every raw file of the input folder into one de-duplicated dataset and records
 * which files it consumed.
 */
@Component
public class DataMerger {

    private static final Logger log = LoggerFactory.getLogger(DataMerger.class);

    public static final String DATASET_FILE = "finaldata.csv";

    private static final String OPERATION = "ingestion";

    @Autowired
    private RiskDatasetReader datasetReader;

    @Autowired
    private StageTimings stageTimings;

    /**
     * Reads all {@code *.extension} files of {@code inputFolder}, concatenates them, drops exact
     * duplicate rows and writes {@value #DATASET_FILE} and the ingestion manifest to
     * {@code outputFolder}, replacing earlier versions.
     * <p>
     * Nothing is written unless every file was read: a file that fails to parse
     * ({@link com.lohika.morning.risk.spark.driver.error.UnreadableFileException}) or lacks a column
     * ({@link com.lohika.morning.risk.spark.driver.error.SchemaMismatchException}) aborts the merge.
     * Rows are written sorted by all columns, so merging unchanged input again yields the same bytes.
     */
    public IngestionResult merge(Path inputFolder, Path outputFolder, String extension) {
        long started = System.nanoTime();

        List<Path> sourceFiles = listSourceFiles(inputFolder, extension);
        if (sourceFiles.isEmpty()) {
            log.error("Input folder {} does not contain .{} files", inputFolder, normalize(extension));
            throw new NoInputDataException(OPERATION, inputFolder, "no ." + normalize(extension) + " files found");
        }
        log.info("Found ({}) files in the input folder", sourceFiles.size());

        List<Dataset<Row>> frames = new ArrayList<>();
        Dataset<Row> merged = null;
        try {
            for (Path sourceFile : sourceFiles) {
                log.info("Reading file: {}", sourceFile);
                frames.add(datasetReader.read(sourceFile, OPERATION));
                log.info("Successfully read file: {}", sourceFile);
            }

            Dataset<Row> concatenated = frames.stream().reduce(Dataset::union).get();
            long total = concatenated.count();

            merged = concatenated.dropDuplicates().cache();
            long unique = merged.count();
            log.info("Removed {} duplicates", total - unique);

            Path datasetFile = outputFolder.resolve(DATASET_FILE);
            log.info("Writing output file to {}", outputFolder);
            writeDataset(merged, outputFolder, datasetFile);
            log.info("Successfully wrote output file to {}", datasetFile);

            List<String> ingestedFiles = sourceFiles.stream()
                    .map(file -> file.getFileName().toString())
                    .collect(Collectors.toList());
            log.info("Saving ingested file names {}", ingestedFiles);
            Path manifestFile = IngestionManifest.write(outputFolder, ingestedFiles);

            stageTimings.record(outputFolder, StageTimings.Stage.INGESTION, Duration.ofNanos(System.nanoTime() - started));
            return new IngestionResult(datasetFile, manifestFile, ingestedFiles, unique, total - unique);
        } finally {
            if (merged != null) {
                merged.unpersist();
            }
            frames.forEach(Dataset::unpersist);
        }
    }

    /**
     * Regular files of {@code inputFolder} ending with {@code .extension}, ordered by file name.
     * A missing folder has no files.
     */
    public static List<Path> listSourceFiles(Path inputFolder, String extension) {
        if (!Files.isDirectory(inputFolder)) {
            return new ArrayList<>();
        }
        String suffix = "." + normalize(extension);
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(inputFolder)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file) && file.getFileName().toString().endsWith(suffix)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            log.error("Could not list input folder {}", inputFolder, e);
            throw new RiskPipelineException(OPERATION, inputFolder, "cannot list input folder: " + e.getMessage(), e);
        }
        files.sort(Comparator.comparing(file -> file.getFileName().toString()));
        return files;
    }

    private void writeDataset(Dataset<Row> merged, Path outputFolder, Path datasetFile) {
        Path staging = outputFolder.resolve("." + DATASET_FILE + "-" + UUID.randomUUID());
        RiskPipelineException failure = null;
        try {
            Files.createDirectories(outputFolder);
            merged.coalesce(1)
                    .sortWithinPartitions(RiskDatasetReader.columns(Column.dataColumnNames()))
                    .write()
                    .option("header", "true")
                    .csv(staging.toAbsolutePath().toString());

            Path part;
            try (DirectoryStream<Path> parts = Files.newDirectoryStream(staging, "part-*.csv")) {
                part = parts.iterator().next();
            }
            Files.move(part, datasetFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Could not write merged dataset to {}", datasetFile, e);
            failure = new RiskPipelineException(OPERATION, datasetFile, "cannot write merged dataset: " + e.getMessage(), e);
            throw failure;
        } finally {
            try {
                FileTrees.delete(staging);
            } catch (IOException e) {
                if (failure != null) {
                    failure.addSuppressed(e);
                } else {
                    log.warn("Could not remove staging directory {}", staging, e);
                }
            }
        }
    }

    private static String normalize(String extension) {
        return extension.startsWith(".") ? extension.substring(1) : extension;
    }
}
