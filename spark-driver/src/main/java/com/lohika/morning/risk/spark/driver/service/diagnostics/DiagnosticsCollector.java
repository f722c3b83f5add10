package com.lohika.morning.risk.spark.driver.service.diagnostics;

import static com.lohika.morning.risk.spark.distributed.library.function.map.risk.Column.CORPORATION;
import static com.lohika.morning.risk.spark.distributed.library.function.map.risk.Column.EXITED;
import static com.lohika.morning.risk.spark.distributed.library.function.map.risk.Column.PREDICTION;
import static org.apache.spark.sql.functions.col;
import static org.apache.spark.sql.functions.count;
import static org.apache.spark.sql.functions.sum;
import static org.apache.spark.sql.functions.trim;
import static org.apache.spark.sql.functions.when;

import com.lohika.morning.risk.spark.distributed.library.function.map.risk.Column;
import com.lohika.morning.risk.spark.driver.config.PipelineConfig;
import com.lohika.morning.risk.spark.driver.error.NoInputDataException;
import com.lohika.morning.risk.spark.driver.error.RiskPipelineException;
import com.lohika.morning.risk.spark.driver.service.MLService;
import com.lohika.morning.risk.spark.driver.service.dataset.RiskDatasetReader;
import com.lohika.morning.risk.spark.driver.service.ingestion.DataMerger;
import com.lohika.morning.risk.spark.driver.util.JsonFiles;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Read-only health checks of the deployed model and the merged dataset.
 */
@Component
public class DiagnosticsCollector {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsCollector.class);

    public static final String CACHE_FILE = "diagnostics.json";

    private static final String OPERATION = "diagnostics";

    static final String[] SUMMARY_STATISTICS = {"count", "mean", "stddev", "min", "25%", "50%", "75%", "max"};

    @Autowired
    private RiskDatasetReader datasetReader;

    @Autowired
    private MLService mlService;

    @Autowired
    private StageTimings stageTimings;

    @Autowired
    private ClasspathDependencyScanner dependencyScanner;

    @Autowired
    private VersionCatalog versionCatalog;

    /**
     * Predictions of the model in {@code modelFolder} for every record of {@code dataFile}, in file order.
     */
    public List<Integer> modelPredictions(Path dataFile, Path modelFolder) {
        log.info("Getting model predictions for {}", dataFile);
        Dataset<Row> data = datasetReader.read(dataFile, OPERATION);
        try {
            if (data.isEmpty()) {
                log.error("No data to make predictions on in {}", dataFile);
                throw new NoInputDataException(OPERATION, dataFile, "dataset has no records");
            }
            datasetReader.requireFeatures(data, dataFile, OPERATION);
            Dataset<Row> predictions = mlService.loadClassifier(modelFolder)
                    .predict(data.drop(CORPORATION.getName(), EXITED.getName()));
            return predictions.select(col(PREDICTION.getName())).collectAsList().stream()
                    .map(row -> (int) row.getDouble(0))
                    .collect(Collectors.toList());
        } finally {
            data.unpersist();
        }
    }

    /**
     * count, mean, std, min, quartiles and max of every numeric column of the merged dataset,
     * keyed by column and then by statistic.
     */
    public Map<String, Map<String, Double>> dataframeSummary(Path datasetFolder) {
        log.info("Getting summary statistics");
        Dataset<Row> data = datasetReader.read(datasetFolder.resolve(DataMerger.DATASET_FILE), OPERATION);
        try {
            String[] numericColumns = numericColumnNames();
            List<Row> rows = data.select(RiskDatasetReader.columns(numericColumns))
                    .summary(SUMMARY_STATISTICS)
                    .collectAsList();

            Map<String, Map<String, Double>> summary = new LinkedHashMap<>();
            for (String column : numericColumns) {
                summary.put(column, new LinkedHashMap<>());
            }
            for (Row row : rows) {
                String statistic = row.getString(0);
                String key = "stddev".equals(statistic) ? "std" : statistic;
                for (int i = 0; i < numericColumns.length; i++) {
                    String value = row.getString(i + 1);
                    summary.get(numericColumns[i]).put(key, value == null ? null : Double.valueOf(value));
                }
            }
            return summary;
        } finally {
            data.unpersist();
        }
    }

    /** Null or blank values per column of the merged dataset. */
    public Map<String, Long> missingData(Path datasetFolder) {
        log.info("Getting missing data");
        Dataset<Row> data = datasetReader.read(datasetFolder.resolve(DataMerger.DATASET_FILE), OPERATION);
        try {
            String[] names = Column.dataColumnNames();
            org.apache.spark.sql.Column[] counters = Arrays.stream(names)
                    .map(name -> Column.fromName(name).getRole() == Column.Role.IDENTIFIER
                            ? sum(when(col(name).isNull().or(trim(col(name)).equalTo("")), 1).otherwise(0))
                            : count(when(col(name).isNull(), 1)))
                    .toArray(org.apache.spark.sql.Column[]::new);
            Row row = data.agg(counters[0], Arrays.copyOfRange(counters, 1, counters.length)).first();

            Map<String, Long> missing = new LinkedHashMap<>();
            for (int i = 0; i < names.length; i++) {
                missing.put(names[i], row.isNullAt(i) ? 0L : ((Number) row.get(i)).longValue());
            }
            log.info("Collected stats on missing data.");
            return missing;
        } finally {
            data.unpersist();
        }
    }

    /** Seconds taken by the latest ingestion and training runs. */
    public Map<String, Double> executionTime(Path datasetFolder) {
        log.info("Getting execution time");
        return stageTimings.read(datasetFolder);
    }

    /** Classpath artifacts with a newer release on Maven Central. */
    public List<OutdatedDependency> outdatedDependencies() {
        log.info("Getting outdated packages");
        List<InstalledDependency> installed;
        try {
            installed = dependencyScanner.scan();
        } catch (IOException e) {
            throw new RiskPipelineException(OPERATION, null, "cannot scan classpath: " + e.getMessage(), e);
        }

        List<OutdatedDependency> outdated = new ArrayList<>();
        for (InstalledDependency dependency : installed) {
            Optional<String> latest = versionCatalog.latestVersion(dependency.getGroupId(), dependency.getArtifactId());
            if (latest.isPresent() && !latest.get().equals(dependency.getVersion())) {
                outdated.add(new OutdatedDependency(dependency.getName(), dependency.getVersion(), latest.get()));
            }
        }
        log.info("Collected stats on outdated packages, {} of {} are behind", outdated.size(), installed.size());
        return outdated;
    }

    /**
     * Runs every section on its own; a failing section is logged and reported under
     * {@code errors} while the others are still collected. The result is cached in
     * {@code output_folder_path/diagnostics.json}.
     */
    public DiagnosticsBundle collect(PipelineConfig config) {
        DiagnosticsBundle bundle = new DiagnosticsBundle();

        section(bundle, "summary_statistics", () -> dataframeSummary(config.outputFolderPath()), bundle::setSummaryStatistics);
        section(bundle, "missing_data", () -> missingData(config.outputFolderPath()), bundle::setMissingData);
        section(bundle, "timings", () -> executionTime(config.outputFolderPath()), bundle::setTimings);
        section(bundle, "outdated_packages", this::outdatedDependencies, bundle::setOutdatedPackages);

        Path cache = config.outputFolderPath().resolve(CACHE_FILE);
        try {
            JsonFiles.write(cache, bundle);
        } catch (IOException e) {
            log.error("Could not write diagnostics to {}", cache, e);
            throw new RiskPipelineException(OPERATION, cache, "cannot write diagnostics: " + e.getMessage(), e);
        }
        log.info("Saved diagnostics to {}", cache);
        return bundle;
    }

    private static <T> void section(DiagnosticsBundle bundle, String name, Supplier<T> collector, Consumer<T> target) {
        try {
            target.accept(collector.get());
        } catch (RuntimeException e) {
            log.error("Diagnostics section {} failed", name, e);
            bundle.addError(name, e.getMessage() == null ? e.getClass().getName() : e.getMessage());
        }
    }

    private static String[] numericColumnNames() {
        return Arrays.stream(Column.dataColumns())
                .filter(column -> column.getRole() != Column.Role.IDENTIFIER)
                .map(Column::getName)
                .toArray(String[]::new);
    }
}
