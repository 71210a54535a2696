package com.example.notemake_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Transcript cache settings.
 */
@ConfigurationProperties(prefix = "notemake.cache")
public class CacheProperties {

    /** {@code jpa} or {@code memory}. */
    private String store = "jpa";
    private Duration ttl = Duration.ofDays(30);
    private int schemaVersion = 1;
    private boolean purgeOnStartup = true;
    private Duration metadataTtl = Duration.ofDays(30);

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(int schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public boolean isPurgeOnStartup() {
        return purgeOnStartup;
    }

    public void setPurgeOnStartup(boolean purgeOnStartup) {
        this.purgeOnStartup = purgeOnStartup;
    }

    public Duration getMetadataTtl() {
        return metadataTtl;
    }

    public void setMetadataTtl(Duration metadataTtl) {
        this.metadataTtl = metadataTtl;
    }
}
