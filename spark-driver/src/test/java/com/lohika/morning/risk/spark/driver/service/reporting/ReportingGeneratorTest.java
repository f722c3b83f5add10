package com.lohika.morning.risk.spark.driver.service.reporting;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.fasterxml.jackson.databind.JsonNode;
import com.lohika.morning.risk.spark.driver.BaseTest;
import com.lohika.morning.risk.spark.driver.error.InsufficientLabelDiversityException;
import com.lohika.morning.risk.spark.driver.service.ingestion.DataMerger;
import com.lohika.morning.risk.spark.driver.service.training.ModelTrainer;
import com.lohika.morning.risk.spark.driver.util.JsonFiles;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.junit.Before;
import org.junit.Test;
import org.springframework.beans.factory.annotation.Autowired;

public class ReportingGeneratorTest extends BaseTest {

    @Autowired
    private ReportingGenerator reportingGenerator;

    @Autowired
    private ModelTrainer modelTrainer;

    @Autowired
    private DataMerger dataMerger;

    private Path models;
    private Path reports;
    private Path testData;

    @Before
    public void setUp() throws Exception {
        Path input = newFolder("input");
        Path output = newFolder("output");
        models = newFolder("models");
        reports = newFolder("reports");
        testData = newFolder("testdata");
        writeCsv(input.resolve("a.csv"), separableRows("train"));
        dataMerger.merge(input, output, "csv");
        modelTrainer.train(output, models);
    }

    @Test
    public void writesConfusionMatrixAndRocFigures() throws Exception {
        Path file = writeCsv(testData.resolve("testdata.csv"),
                "t1,15,22,30,0",
                "t2,60,70,50,0",
                "t3,880,910,940,1",
                "t4,40,30,20,1",
                "t5,930,890,860,1");

        ModelReport report = reportingGenerator.generate(file, models, reports);

        long[][] matrix = report.getConfusionMatrix().toArray();
        assertEquals(2, matrix[0][0]);
        assertEquals(0, matrix[0][1]);
        assertEquals(1, matrix[1][0]);
        assertEquals(2, matrix[1][1]);
        assertTrue(report.getAreaUnderCurve() > 0.5 && report.getAreaUnderCurve() <= 1.0);
        assertEquals(4, report.getFiles().size());

        JsonNode heatmap = JsonFiles.mapper().readTree(reports.resolve(ReportingGenerator.CONFUSION_MATRIX_JSON).toFile());
        assertEquals("heatmap", heatmap.get("data").get(0).get("type").asText());
        assertEquals(2, heatmap.get("data").get(0).get("z").get(1).get(1).asInt());

        JsonNode roc = JsonFiles.mapper().readTree(reports.resolve(ReportingGenerator.ROC_JSON).toFile());
        assertEquals(report.getAreaUnderCurve(), roc.get("layout").get("auc").asDouble(), 1e-12);
        assertEquals(report.getRocCurve().size(), roc.get("data").get(0).get("x").size());

        for (String png : new String[]{ReportingGenerator.CONFUSION_MATRIX_PNG, ReportingGenerator.ROC_PNG}) {
            BufferedImage image = ImageIO.read(reports.resolve(png).toFile());
            assertEquals(ChartRenderer.WIDTH, image.getWidth());
            assertEquals(ChartRenderer.HEIGHT, image.getHeight());
        }
    }

    @Test
    public void singleClassTestSetCannotBeReported() throws Exception {
        Path file = writeCsv(testData.resolve("testdata.csv"),
                "t1,15,22,30,0",
                "t2,60,70,50,0");
        try {
            reportingGenerator.generate(file, models, reports);
            fail("Expected InsufficientLabelDiversityException");
        } catch (InsufficientLabelDiversityException e) {
            assertEquals(file, e.getPath());
        }
        assertFalse(Files.exists(reports.resolve(ReportingGenerator.ROC_PNG)));
    }
}
