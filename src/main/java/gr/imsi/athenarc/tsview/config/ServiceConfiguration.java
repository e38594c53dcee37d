package gr.imsi.athenarc.tsview.config;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.tsview.cache.ViewCache;
import gr.imsi.athenarc.tsview.manager.QueryOrchestrator;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

/**
 * Settings of a view service instance. Built in code through {@link Builder} or read from
 * {@code application.properties}; keys that are absent keep their defaults.
 */
public class ServiceConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(ServiceConfiguration.class);

    public static final String RESOURCE = "/application.properties";

    public static final String DATA_DIR = "tsview.data.dir";
    public static final String METADATA_DIR = "tsview.metadata.dir";
    public static final String MAX_POINTS = "tsview.max.points";
    public static final String CACHE_TTL_SECONDS = "tsview.cache.ttl.seconds";
    public static final String CACHE_MAX_ENTRIES = "tsview.cache.max.entries";
    public static final String STORE_TIMEOUT_MILLIS = "tsview.store.timeout.millis";
    public static final String LOAD_TIMEOUT_MILLIS = "tsview.load.timeout.millis";

    private Path dataDir;
    private Path metadataDir;
    private int maxPoints;
    private Duration cacheTtl;
    private long cacheMaxEntries;
    private Duration storeTimeout;
    private Duration loadTimeout;

    private ServiceConfiguration() {}

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the configuration bundled on the classpath, falling back to defaults when there is none.
     */
    public static ServiceConfiguration load() {
        Properties properties = new Properties();
        try (InputStream input = ServiceConfiguration.class.getResourceAsStream(RESOURCE)) {
            if (input == null) {
                LOG.warn("No {} on the classpath, using defaults", RESOURCE);
            } else {
                properties.load(input);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
        return fromProperties(properties);
    }

    public static ServiceConfiguration fromProperties(Properties properties) {
        Builder builder = builder();
        String value = properties.getProperty(DATA_DIR);
        if (value != null) {
            builder.dataDir(Paths.get(value.trim()));
        }
        value = properties.getProperty(METADATA_DIR);
        if (value != null) {
            builder.metadataDir(Paths.get(value.trim()));
        }
        value = properties.getProperty(MAX_POINTS);
        if (value != null) {
            builder.maxPoints(Integer.parseInt(value.trim()));
        }
        value = properties.getProperty(CACHE_TTL_SECONDS);
        if (value != null) {
            builder.cacheTtl(Duration.ofSeconds(Long.parseLong(value.trim())));
        }
        value = properties.getProperty(CACHE_MAX_ENTRIES);
        if (value != null) {
            builder.cacheMaxEntries(Long.parseLong(value.trim()));
        }
        value = properties.getProperty(STORE_TIMEOUT_MILLIS);
        if (value != null) {
            builder.storeTimeout(Duration.ofMillis(Long.parseLong(value.trim())));
        }
        value = properties.getProperty(LOAD_TIMEOUT_MILLIS);
        if (value != null) {
            builder.loadTimeout(Duration.ofMillis(Long.parseLong(value.trim())));
        }
        return builder.build();
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path getMetadataDir() {
        return metadataDir;
    }

    public int getMaxPoints() {
        return maxPoints;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public long getCacheMaxEntries() {
        return cacheMaxEntries;
    }

    public Duration getStoreTimeout() {
        return storeTimeout;
    }

    public Duration getLoadTimeout() {
        return loadTimeout;
    }

    @Override
    public String toString() {
        return "ServiceConfiguration{dataDir=" + dataDir + ", metadataDir=" + metadataDir
                + ", maxPoints=" + maxPoints + ", cacheTtl=" + cacheTtl + ", cacheMaxEntries=" + cacheMaxEntries
                + ", storeTimeout=" + storeTimeout + ", loadTimeout=" + loadTimeout + '}';
    }

    public static class Builder {
        private Path dataDir = Paths.get("data");
        private Path metadataDir = Paths.get("metadata");
        private int maxPoints = QueryOrchestrator.Builder.DEFAULT_MAX_POINTS;
        private Duration cacheTtl = ViewCache.DEFAULT_TTL;
        private long cacheMaxEntries = 1_000;
        private Duration storeTimeout = Duration.ofSeconds(2);
        private Duration loadTimeout = Duration.ofSeconds(60);

        public Builder dataDir(Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        public Builder metadataDir(Path metadataDir) {
            this.metadataDir = metadataDir;
            return this;
        }

        public Builder maxPoints(int maxPoints) {
            this.maxPoints = maxPoints;
            return this;
        }

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
            return this;
        }

        public Builder cacheMaxEntries(long cacheMaxEntries) {
            this.cacheMaxEntries = cacheMaxEntries;
            return this;
        }

        public Builder storeTimeout(Duration storeTimeout) {
            this.storeTimeout = storeTimeout;
            return this;
        }

        public Builder loadTimeout(Duration loadTimeout) {
            this.loadTimeout = loadTimeout;
            return this;
        }

        public ServiceConfiguration build() {
            Preconditions.checkArgument(maxPoints > 0, "%s must be positive, got %s", MAX_POINTS, maxPoints);
            Preconditions.checkArgument(!cacheTtl.isNegative() && !cacheTtl.isZero(),
                    "%s must be positive, got %s", CACHE_TTL_SECONDS, cacheTtl);
            Preconditions.checkArgument(cacheMaxEntries > 0, "%s must be positive", CACHE_MAX_ENTRIES);
            Preconditions.checkArgument(!storeTimeout.isNegative() && !storeTimeout.isZero(),
                    "%s must be positive", STORE_TIMEOUT_MILLIS);
            Preconditions.checkArgument(!loadTimeout.isNegative() && !loadTimeout.isZero(),
                    "%s must be positive", LOAD_TIMEOUT_MILLIS);
            ServiceConfiguration configuration = new ServiceConfiguration();
            configuration.dataDir = Preconditions.checkNotNull(dataDir, DATA_DIR);
            configuration.metadataDir = Preconditions.checkNotNull(metadataDir, METADATA_DIR);
            configuration.maxPoints = maxPoints;
            configuration.cacheTtl = cacheTtl;
            configuration.cacheMaxEntries = cacheMaxEntries;
            configuration.storeTimeout = storeTimeout;
            configuration.loadTimeout = loadTimeout;
            return configuration;
        }
    }
}
