package com.lohika.morning.risk.api.client;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.JsonNode;
import com.lohika.morning.risk.spark.driver.config.PipelineConfig;
import com.lohika.morning.risk.spark.driver.util.JsonFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

public class ApiCallsClientTest {

    private static final String BASE_URL = "http://127.0.0.1:8000/";

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private MockRestServiceServer server;
    private ApiCallsClient client;
    private PipelineConfig config;
    private Path models;

    @Before
    public void setUp() throws Exception {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new ApiCallsClient(restTemplate, BASE_URL);

        models = temporaryFolder.newFolder("models").toPath();
        Map<String, String> values = new HashMap<>();
        values.put(PipelineConfig.INPUT_FOLDER_PATH, "sourcedata");
        values.put(PipelineConfig.OUTPUT_FOLDER_PATH, "ingesteddata");
        values.put(PipelineConfig.OUTPUT_MODEL_PATH, models.toString());
        values.put(PipelineConfig.PROD_DEPLOYMENT_PATH, "production_deployment");
        values.put(PipelineConfig.TEST_DATA_PATH, "testdata");
        values.put(PipelineConfig.INPUT_FILE_EXTENSION, "csv");
        values.put(PipelineConfig.URL, BASE_URL);
        config = PipelineConfig.of(values);
    }

    @Test
    public void storesEveryEndpointResponse() throws Exception {
        server.expect(requestTo(BASE_URL + "prediction?filepath=testdata/testdata.csv"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("[0,1,1]", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "scoring"))
                .andRespond(withSuccess("0.8", MediaType.TEXT_PLAIN));
        server.expect(requestTo(BASE_URL + "summarystats"))
                .andRespond(withSuccess("{\"exited\":{\"mean\":0.5}}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "diagnostics"))
                .andRespond(withSuccess("{\"timings\":{},\"missing_data\":{},\"outdated_packages\":[]}",
                        MediaType.APPLICATION_JSON));

        Path returns = client.run(config);

        server.verify();
        assertEquals(models.resolve(ApiCallsClient.RETURNS_FILE), returns);
        JsonNode stored = JsonFiles.mapper().readTree(returns.toFile());
        assertEquals(3, stored.get("prediction").size());
        assertEquals("0.8", stored.get("F1_score").asText());
        assertEquals(0.5, stored.get("data_summary").get("exited").get("mean").asDouble(), 1e-9);
        assertTrue(stored.get("diagnostics").has("outdated_packages"));
    }

    @Test
    public void failingEndpointWritesNothing() {
        server.expect(requestTo(BASE_URL + "prediction?filepath=testdata/testdata.csv"))
                .andRespond(withServerError());

        try {
            client.run(config);
            fail("expected a server error");
        } catch (HttpServerErrorException expected) {
            assertTrue(Files.notExists(models.resolve(ApiCallsClient.RETURNS_FILE)));
        } catch (IOException e) {
            fail(e.getMessage());
        }
    }
}
