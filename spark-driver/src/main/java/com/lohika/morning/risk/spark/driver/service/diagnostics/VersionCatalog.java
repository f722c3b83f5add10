package com.lohika.morning.risk.spark.driver.service.diagnostics;

import java.util.Optional;

/** Source of the latest released version of an artifact. */
public interface VersionCatalog {

    /**
     * @return the latest release, or empty if the catalog does not know the artifact
     */
    Optional<String> latestVersion(String groupId, String artifactId);
}
