package com.lohika.morning.risk.spark.driver.service.diagnostics;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Looks up latest versions through the Maven Central search API.
 */
@Component
public class MavenCentralVersionCatalog implements VersionCatalog {

    private static final Logger log = LoggerFactory.getLogger(MavenCentralVersionCatalog.class);

    private final RestTemplate restTemplate;
    private final String searchUrl;

    public MavenCentralVersionCatalog(
            @Value("${maven.central.search-url:https://search.maven.org/solrsearch/select}") String searchUrl,
            @Value("${maven.central.timeout-millis:5000}") int timeoutMillis) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMillis);
        requestFactory.setReadTimeout(timeoutMillis);
        this.restTemplate = new RestTemplate(requestFactory);
        this.searchUrl = searchUrl;
    }

    @Override
    public Optional<String> latestVersion(String groupId, String artifactId) {
        JsonNode response = restTemplate.getForObject(
                searchUrl + "?q={query}&rows=1&wt=json",
                JsonNode.class,
                "g:" + groupId + " AND a:" + artifactId);

        JsonNode docs = response == null ? null : response.path("response").path("docs");
        if (docs == null || !docs.isArray() || docs.size() == 0) {
            log.debug("Maven Central does not know {}:{}", groupId, artifactId);
            return Optional.empty();
        }
        String latest = docs.get(0).path("latestVersion").asText("");
        return latest.isEmpty() ? Optional.empty() : Optional.of(latest);
    }
}
