package com.lohika.morning.risk.spark.driver.service.scoring;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.fail;

import com.lohika.morning.risk.spark.driver.BaseTest;
import com.lohika.morning.risk.spark.driver.error.ModelLoadException;
import com.lohika.morning.risk.spark.driver.error.NoInputDataException;
import com.lohika.morning.risk.spark.driver.error.SchemaMismatchException;
import com.lohika.morning.risk.spark.driver.error.UnreadableFileException;
import com.lohika.morning.risk.spark.driver.service.ingestion.DataMerger;
import com.lohika.morning.risk.spark.driver.service.training.ModelTrainer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.junit.Before;
import org.junit.Test;
import org.springframework.beans.factory.annotation.Autowired;

public class ModelScorerTest extends BaseTest {

    @Autowired
    private ModelScorer modelScorer;

    @Autowired
    private ModelTrainer modelTrainer;

    @Autowired
    private DataMerger dataMerger;

    private Path output;
    private Path models;
    private Path testData;

    @Before
    public void setUp() throws Exception {
        Path input = newFolder("input");
        output = newFolder("output");
        models = newFolder("models");
        testData = newFolder("testdata");
        writeCsv(input.resolve("a.csv"), separableRows("train"));
        dataMerger.merge(input, output, "csv");
        modelTrainer.train(output, models);
    }

    @Test
    public void writesF1OfPositiveClass() throws Exception {
        Path file = writeCsv(testData.resolve("testdata.csv"), separableRows("test"));

        ScoreRecord score = modelScorer.score(file, models, output);

        assertEquals(1.0, score.getValue(), 1e-9);
        assertEquals(file, score.getDatasetFile());
        String written = new String(Files.readAllBytes(output.resolve(ScoreFile.FILE_NAME)), StandardCharsets.UTF_8);
        assertEquals("1.0", written);
        assertEquals(1.0, ScoreFile.read(output).getAsDouble(), 0.0);
    }

    @Test
    public void mispredictedRecordsLowerTheScore() throws Exception {
        Path file = writeCsv(testData.resolve("testdata.csv"),
                "x1,950,980,900,1",
                "x2,20,30,40,1",
                "x3,15,25,30,0",
                "x4,900,920,870,0");

        // tp=1, fn=1, fp=1
        assertEquals(0.5, modelScorer.score(file, models, output).getValue(), 1e-9);
    }

    @Test
    public void emptyTestSetWritesNoScore() throws Exception {
        Path file = writeCsv(testData.resolve("testdata.csv"));
        try {
            modelScorer.score(file, models, output);
            fail("Expected NoInputDataException");
        } catch (NoInputDataException e) {
            assertEquals(file, e.getPath());
        }
        assertFalse(Files.exists(output.resolve(ScoreFile.FILE_NAME)));
    }

    @Test
    public void missingFeatureValueWritesNoScore() throws Exception {
        Path file = writeCsv(testData.resolve("testdata.csv"),
                "x,10,,15,0",
                "y,900,900,900,1",
                "z,20,20,20,0");
        try {
            modelScorer.score(file, models, output);
            fail("Expected UnreadableFileException");
        } catch (UnreadableFileException e) {
            assertEquals(file, e.getPath());
        }
        assertFalse(Files.exists(output.resolve(ScoreFile.FILE_NAME)));
    }

    @Test(expected = ModelLoadException.class)
    public void missingModelFailsToLoad() throws Exception {
        Path file = writeCsv(testData.resolve("testdata.csv"), separableRows("test"));
        modelScorer.score(file, newFolder("empty"), output);
    }

    @Test
    public void missingColumnIsSchemaMismatch() throws Exception {
        Path file = writeLines(testData.resolve("testdata.csv"), "corporation,lastmonth_activity,exited", "x,1,0");
        try {
            modelScorer.score(file, models, output);
            fail("Expected SchemaMismatchException");
        } catch (SchemaMismatchException e) {
            assertEquals(Arrays.asList("lastyear_activity", "number_of_employees"), e.getMissingColumns());
        }
    }
}
