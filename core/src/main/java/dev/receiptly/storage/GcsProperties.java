package dev.receiptly.storage;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for keeping receipt images in a Google Cloud Storage bucket. When {@code gcs.enabled}
 * is false the images only live in process memory.
 */
@ConfigurationProperties(prefix = "gcs")
public class GcsProperties {

    private boolean enabled;

    /** Bucket holding the content-addressed receipt images. Required when enabled. */
    private String bucket;

    /** Prepended to every object name, normally ending in a slash. */
    private String objectPrefix = "receipt-images/";

    /** Spring resource location of a service account key; empty means application default credentials. */
    private String credentials;

    private String projectId;

    /** Applied to both connect and read on the storage HTTP transport. */
    private Duration timeout = Duration.ofSeconds(20);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    public String getObjectPrefix() {
        return objectPrefix;
    }

    public void setObjectPrefix(String objectPrefix) {
        this.objectPrefix = objectPrefix;
    }

    public String getCredentials() {
        return credentials;
    }

    public void setCredentials(String credentials) {
        this.credentials = credentials;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    int timeoutMillis() {
        return Math.toIntExact(timeout.toMillis());
    }
}
