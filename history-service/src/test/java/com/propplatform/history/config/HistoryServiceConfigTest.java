package com.propplatform.history.config;

import com.propplatform.common.calibration.CalibrationPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.ReactiveTransactionManager;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class HistoryServiceConfigTest {

    @Configuration
    @EnableConfigurationProperties(CalibrationProperties.class)
    static class PropertiesOnly {
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withUserConfiguration(PropertiesOnly.class);

    @Test
    @DisplayName("unbound calibration properties produce the default policy")
    void defaults() {
        runner.run(context -> {
            CalibrationProperties properties = context.getBean(CalibrationProperties.class);
            assertTrue(properties.isEnabled());
            assertEquals(CalibrationPolicy.DEFAULT, properties.toPolicy());
            assertEquals(50, properties.getDefaultHistoryLimit());
        });
    }

    @Test
    @DisplayName("calibration.* keys bind onto the policy")
    void binding() {
        runner.withPropertyValues("calibration.enabled=false",
                                  "calibration.sensitivity=2.0",
                                  "calibration.min-samples=25",
                                  "calibration.max-weight=3.0")
            .run(context -> {
                CalibrationProperties properties = context.getBean(CalibrationProperties.class);
                assertFalse(properties.isEnabled());
                CalibrationPolicy policy = properties.toPolicy();
                assertEquals(2.0, policy.sensitivity());
                assertEquals(25, policy.minSamples());
                assertEquals(3.0, policy.maxWeight());
                assertEquals(0.1, policy.minWeight());
            });
    }

    @Test
    @DisplayName("inverted weight bounds fail when the policy is built")
    void invalidBounds() {
        CalibrationProperties properties = new CalibrationProperties();
        properties.setMinWeight(4.0);
        properties.setMaxWeight(2.0);

        assertThrows(IllegalArgumentException.class, properties::toPolicy);
    }

    @Test
    @DisplayName("a transactional operator is built over the reactive transaction manager")
    void transactionalOperator() {
        assertNotNull(new HistoryServiceConfig().transactionalOperator(mock(ReactiveTransactionManager.class)));
    }
}
