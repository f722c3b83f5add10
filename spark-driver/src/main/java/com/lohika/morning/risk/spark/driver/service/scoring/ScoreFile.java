package com.lohika.morning.risk.spark.driver.service.scoring;

import com.lohika.morning.risk.spark.driver.error.RiskPipelineException;
import com.lohika.morning.risk.spark.driver.util.JsonFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalDouble;

/**
 * The {@value #FILE_NAME} text file: a single floating point value and nothing else.
 */
public final class ScoreFile {

    public static final String FILE_NAME = "latestscore.txt";

    private ScoreFile() {
    }

    public static Path write(Path folder, double score) {
        Path file = folder.resolve(FILE_NAME);
        try {
            JsonFiles.writeAtomically(file, Double.toString(score).getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RiskPipelineException("write score", file, e.getMessage(), e);
        }
        return file;
    }

    public static OptionalDouble read(Path folder) {
        Path file = folder.resolve(FILE_NAME);
        if (!Files.isRegularFile(file)) {
            return OptionalDouble.empty();
        }
        try {
            String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8).trim();
            return OptionalDouble.of(Double.parseDouble(text));
        } catch (IOException | NumberFormatException e) {
            throw new RiskPipelineException("read score", file, "not a score: " + e.getMessage(), e);
        }
    }
}
