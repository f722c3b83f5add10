package com.lohika.morning.risk.spark.driver.service.dataset;

import com.lohika.morning.risk.spark.distributed.library.function.map.risk.Column;
import com.lohika.morning.risk.spark.driver.error.SchemaMismatchException;
import com.lohika.morning.risk.spark.driver.error.UnreadableFileException;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.functions;
import org.apache.spark.sql.types.DataType;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructField;
import org.apache.spark.sql.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reads risk CSV files (header row, fixed columns) into frames with the canonical column order
 * and types. Columns a file carries beyond the fixed schema are dropped.
 */
@Component
public class RiskDatasetReader {

    private static final Logger log = LoggerFactory.getLogger(RiskDatasetReader.class);

    // Excel writes one in front of UTF-8 exports
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    @Autowired
    private SparkSession sparkSession;

    /**
     * Reads and fully parses {@code csvFile}, so that malformed content fails here and is
     * attributed to this file. The returned frame is cached; callers unpersist it when done.
     *
     * @throws UnreadableFileException if the file is missing or cannot be parsed
     * @throws SchemaMismatchException if an expected column is absent from the header
     */
    public Dataset<Row> read(Path csvFile, String operation) {
        if (!Files.isRegularFile(csvFile)) {
            log.error("File {} does not exist, check config.json", csvFile);
            throw new UnreadableFileException(operation, csvFile, "file does not exist");
        }

        List<String> header = readHeader(csvFile, operation);
        List<String> missing = Arrays.stream(Column.dataColumnNames())
                .filter(name -> !header.contains(name))
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            log.error("File {} is missing columns {} (header: {})", csvFile, missing, header);
            throw new SchemaMismatchException(operation, csvFile, missing);
        }

        Dataset<Row> frame = sparkSession.read()
                .option("header", "true")
                .option("mode", "FAILFAST")
                .schema(schemaFor(header))
                .csv(csvFile.toAbsolutePath().toString())
                .select(columns(Column.dataColumnNames()))
                .cache();

        try {
            long count = frame.count();
            log.debug("Parsed {} records from {}", count, csvFile);
        } catch (Exception e) {
            frame.unpersist();
            log.error("Could not read file: {} due to {}", csvFile, e.getMessage());
            throw new UnreadableFileException(operation, csvFile, "cannot parse records: " + rootMessage(e), e);
        }
        return frame;
    }

    /**
     * Fails when any record of {@code data} lacks a feature value, since the model cannot
     * predict such a record.
     *
     * @throws UnreadableFileException naming {@code csvFile} and the number of incomplete records
     */
    public void requireFeatures(Dataset<Row> data, Path csvFile, String operation) {
        org.apache.spark.sql.Column anyMissing = Arrays.stream(Column.featureColumnNames())
                .map(name -> functions.col(name).isNull())
                .reduce(org.apache.spark.sql.Column::or)
                .orElseThrow(IllegalStateException::new);
        long incomplete = data.filter(anyMissing).count();
        if (incomplete > 0) {
            log.error("File {} has {} records with missing feature values", csvFile, incomplete);
            throw new UnreadableFileException(operation, csvFile,
                    incomplete + " records with missing values in " + Arrays.toString(Column.featureColumnNames()));
        }
    }

    public static org.apache.spark.sql.Column[] columns(String... names) {
        return Arrays.stream(names).map(functions::col).toArray(org.apache.spark.sql.Column[]::new);
    }

    private List<String> readHeader(Path csvFile, String operation) {
        try (BufferedReader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8)) {
            String line = reader.readLine();
            if (line == null) {
                return List.of();
            }
            if (line.startsWith(BYTE_ORDER_MARK)) {
                line = line.substring(1);
            }
            return Arrays.stream(line.split(",", -1))
                    .map(name -> name.trim().replace("\"", ""))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Could not read header of {}", csvFile, e);
            throw new UnreadableFileException(operation, csvFile, "cannot read header: " + e.getMessage(), e);
        }
    }

    private static StructType schemaFor(List<String> header) {
        StructField[] fields = header.stream()
                .map(name -> DataTypes.createStructField(name, typeOf(name), true))
                .toArray(StructField[]::new);
        return new StructType(fields);
    }

    private static DataType typeOf(String name) {
        Column column = Column.fromName(name);
        return column == null ? DataTypes.StringType : column.getDataType();
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
