package com.williamcallahan.nutrichat.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Verifies formatter property validation.
 */
class AppPropertiesValidationTest {

    @Test
    void acceptsDefaults() {
        AppProperties appProperties = new AppProperties();

        assertDoesNotThrow(appProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveMaxInputLength() {
        AppProperties appProperties = new AppProperties();
        appProperties.getFormatter().setMaxInputLength(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveCacheSize() {
        AppProperties appProperties = new AppProperties();
        appProperties.getFormatter().setCacheSize(-1);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsZeroCacheTtl() {
        AppProperties appProperties = new AppProperties();
        appProperties.getFormatter().setCacheTtl(Duration.ZERO);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }
}
