package gr.imsi.athenarc.tsview.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ServiceConfigurationTest {

    @Test
    public void testPropertiesOverrideDefaults() {
        Properties properties = new Properties();
        properties.setProperty(ServiceConfiguration.DATA_DIR, "/srv/tsview/data");
        properties.setProperty(ServiceConfiguration.MAX_POINTS, " 500 ");
        properties.setProperty(ServiceConfiguration.CACHE_TTL_SECONDS, "120");
        properties.setProperty(ServiceConfiguration.STORE_TIMEOUT_MILLIS, "250");

        ServiceConfiguration configuration = ServiceConfiguration.fromProperties(properties);

        assertEquals(Paths.get("/srv/tsview/data"), configuration.getDataDir());
        assertEquals(Paths.get("metadata"), configuration.getMetadataDir());
        assertEquals(500, configuration.getMaxPoints());
        assertEquals(Duration.ofMinutes(2), configuration.getCacheTtl());
        assertEquals(Duration.ofMillis(250), configuration.getStoreTimeout());
        assertEquals(Duration.ofSeconds(60), configuration.getLoadTimeout());
        assertEquals(1000, configuration.getCacheMaxEntries());
    }

    @Test
    public void testBundledPropertiesAreLoaded() {
        ServiceConfiguration configuration = ServiceConfiguration.load();
        assertEquals(10_000, configuration.getMaxPoints());
        assertEquals(Duration.ofHours(1), configuration.getCacheTtl());
        assertEquals(Duration.ofSeconds(2), configuration.getStoreTimeout());
    }

    @Test
    public void testInvalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ServiceConfiguration.builder().maxPoints(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> ServiceConfiguration.builder().cacheTtl(Duration.ZERO).build());

        Properties properties = new Properties();
        properties.setProperty(ServiceConfiguration.MAX_POINTS, "many");
        assertThrows(NumberFormatException.class, () -> ServiceConfiguration.fromProperties(properties));
    }
}
