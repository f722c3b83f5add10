package com.lohika.morning.risk.api.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.lohika.morning.risk.spark.driver.config.PipelineConfig;
import com.lohika.morning.risk.spark.driver.util.JsonFiles;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Calls every endpoint of a running risk API and stores the combined responses
 * as {@value #RETURNS_FILE} in the model output folder.
 */
public class ApiCallsClient {

    private static final Logger log = LoggerFactory.getLogger(ApiCallsClient.class);

    public static final String RETURNS_FILE = "apireturns.json";

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public ApiCallsClient(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
    }

    public Map<String, Object> fetch(String testDataFile) {
        Map<String, Object> returns = new LinkedHashMap<>();
        returns.put("prediction", restTemplate.getForObject(
                endpoint("prediction", testDataFile), JsonNode.class));
        returns.put("F1_score", restTemplate.getForObject(endpoint("scoring", null), String.class));
        returns.put("data_summary", restTemplate.getForObject(endpoint("summarystats", null), JsonNode.class));
        returns.put("diagnostics", restTemplate.getForObject(endpoint("diagnostics", null), JsonNode.class));
        return returns;
    }

    public Path run(PipelineConfig config) throws IOException {
        Map<String, Object> returns = fetch(config.testDataFile().toString());
        Path target = config.outputModelPath().resolve(RETURNS_FILE);
        JsonFiles.write(target, returns);
        log.info("Stored API responses in {}", target);
        return target;
    }

    private URI endpoint(String name, String filepath) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl).pathSegment(name);
        if (filepath != null) {
            builder.queryParam("filepath", filepath);
        }
        return builder.build().encode().toUri();
    }
}
