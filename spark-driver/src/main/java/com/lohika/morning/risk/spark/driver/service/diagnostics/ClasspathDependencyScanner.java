package com.lohika.morning.risk.spark.driver.service.diagnostics;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

/**
 * Lists the Maven artifacts on the runtime classpath from the {@code pom.properties} files
 * that Maven packages into every jar.
 */
@Component
public class ClasspathDependencyScanner {

    private static final Logger log = LoggerFactory.getLogger(ClasspathDependencyScanner.class);

    static final String POM_PROPERTIES = "classpath*:META-INF/maven/*/*/pom.properties";

    private final PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();

    public List<InstalledDependency> scan() throws IOException {
        TreeSet<InstalledDependency> dependencies = new TreeSet<>();
        for (Resource resource : resolver.getResources(POM_PROPERTIES)) {
            Properties properties = new Properties();
            try (InputStream in = resource.getInputStream()) {
                properties.load(in);
            }
            String groupId = properties.getProperty("groupId");
            String artifactId = properties.getProperty("artifactId");
            String version = properties.getProperty("version");
            if (groupId == null || artifactId == null || version == null) {
                log.debug("Skipping incomplete {}", resource);
                continue;
            }
            dependencies.add(new InstalledDependency(groupId, artifactId, version));
        }
        log.info("Found {} artifacts on the classpath", dependencies.size());
        return new ArrayList<>(dependencies);
    }
}
