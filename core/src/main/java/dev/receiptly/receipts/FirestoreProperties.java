package dev.receiptly.receipts;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "receipts.firestore")
public class FirestoreProperties {

    /**
     * Flag indicating whether receipts are persisted in Firestore. When disabled an in-memory store is used.
     */
    private boolean enabled;

    /**
     * Optional Google Cloud project identifier.
     */
    private String projectId;

    /**
     * Optional Firestore database id; the default database is used when omitted.
     */
    private String databaseId;

    /**
     * Optional host:port of the Firestore emulator.
     */
    private String emulatorHost;

    /**
     * Firestore collection used to persist receipt records.
     */
    private String collection = "receipts";

    /**
     * Upper bound for every Firestore round trip.
     */
    private Duration timeout = Duration.ofSeconds(10);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getDatabaseId() {
        return databaseId;
    }

    public void setDatabaseId(String databaseId) {
        this.databaseId = databaseId;
    }

    public String getEmulatorHost() {
        return emulatorHost;
    }

    public void setEmulatorHost(String emulatorHost) {
        this.emulatorHost = emulatorHost;
    }

    public String getCollection() {
        return collection;
    }

    public void setCollection(String collection) {
        this.collection = collection;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
}
