package com.lohika.morning.risk.spark.driver.service.diagnostics;

import java.util.Objects;

/** A Maven artifact found on the runtime classpath. */
public class InstalledDependency implements Comparable<InstalledDependency> {

    private final String groupId;
    private final String artifactId;
    private final String version;

    public InstalledDependency(String groupId, String artifactId, String version) {
        this.groupId = groupId;
        this.artifactId = artifactId;
        this.version = version;
    }

    public String getGroupId() {
        return groupId;
    }

    public String getArtifactId() {
        return artifactId;
    }

    public String getVersion() {
        return version;
    }

    public String getName() {
        return groupId + ":" + artifactId;
    }

    @Override
    public int compareTo(InstalledDependency other) {
        int byName = getName().compareTo(other.getName());
        return byName != 0 ? byName : version.compareTo(other.version);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof InstalledDependency)) {
            return false;
        }
        InstalledDependency that = (InstalledDependency) o;
        return groupId.equals(that.groupId) && artifactId.equals(that.artifactId) && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupId, artifactId, version);
    }

    @Override
    public String toString() {
        return getName() + ":" + version;
    }
}
