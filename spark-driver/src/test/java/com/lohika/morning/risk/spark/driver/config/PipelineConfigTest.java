package com.lohika.morning.risk.spark.driver.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import com.lohika.morning.risk.spark.driver.error.ConfigurationException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class PipelineConfigTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void readsAllKeys() throws Exception {
        Path file = write("{\n"
                + "  \"input_folder_path\": \"sourcedata\",\n"
                + "  \"output_folder_path\": \"ingesteddata\",\n"
                + "  \"test_data_path\": \"testdata\",\n"
                + "  \"output_model_path\": \"models\",\n"
                + "  \"prod_deployment_path\": \"production_deployment\",\n"
                + "  \"input_file_extension\": \"csv\",\n"
                + "  \"url\": \"http://127.0.0.1:8000/\"\n"
                + "}");

        PipelineConfig config = PipelineConfig.load(file);

        assertEquals(Paths.get("sourcedata"), config.inputFolderPath());
        assertEquals(Paths.get("ingesteddata"), config.outputFolderPath());
        assertEquals(Paths.get("models"), config.outputModelPath());
        assertEquals(Paths.get("production_deployment"), config.prodDeploymentPath());
        assertEquals(Paths.get("testdata", "testdata.csv"), config.testDataFile());
        assertEquals("csv", config.inputFileExtension());
        assertEquals("http://127.0.0.1:8000/", config.url());
        assertEquals(file, config.getSource());
    }

    @Test
    public void missingKeyFailsOnlyWhenRequested() throws Exception {
        PipelineConfig config = PipelineConfig.load(write("{\"input_folder_path\": \"sourcedata\", \"url\": \"  \"}"));

        assertEquals(Paths.get("sourcedata"), config.inputFolderPath());
        try {
            config.prodDeploymentPath();
            fail("Expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertEquals(PipelineConfig.PROD_DEPLOYMENT_PATH, e.getKey());
        }
        try {
            config.url();
            fail("Expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertEquals(PipelineConfig.URL, e.getKey());
        }
    }

    @Test
    public void missingFileIsConfigurationError() {
        Path file = temporaryFolder.getRoot().toPath().resolve("absent.json");
        try {
            PipelineConfig.load(file);
            fail("Expected ConfigurationException");
        } catch (ConfigurationException e) {
            assertEquals(file, e.getPath());
            assertNull(e.getKey());
        }
    }

    @Test(expected = ConfigurationException.class)
    public void malformedJsonIsConfigurationError() throws Exception {
        PipelineConfig.load(write("{\"input_folder_path\": "));
    }

    private Path write(String json) throws Exception {
        Path file = temporaryFolder.newFile("config.json").toPath();
        return Files.write(file, json.getBytes(StandardCharsets.UTF_8));
    }
}
