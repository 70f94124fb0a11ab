package com.williamcallahan.notesrender.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Verifies app property validation for render limits and cache settings.
 */
class AppPropertiesValidationTest {

    @Test
    void acceptsDefaults() {
        assertDoesNotThrow(new AppProperties()::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveMaxInputLength() {
        AppProperties appProperties = new AppProperties();
        appProperties.getRender().setMaxInputLength(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveMathDepth() {
        AppProperties appProperties = new AppProperties();
        appProperties.getRender().setMaxMathDepth(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNegativeCacheSize() {
        AppProperties appProperties = new AppProperties();
        appProperties.getCache().setMaximumSize(-1);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsZeroCacheExpiry() {
        AppProperties appProperties = new AppProperties();
        appProperties.getCache().setExpireAfterWrite(Duration.ZERO);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }
}
