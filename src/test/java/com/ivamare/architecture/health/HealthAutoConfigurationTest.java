package com.ivamare.architecture.health;

import com.ivamare.architecture.ArchitectureAutoConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("HealthAutoConfiguration")
class HealthAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(ArchitectureAutoConfiguration.class, HealthAutoConfiguration.class));

    @Test
    @DisplayName("should create DispatcherHealthIndicator when enabled")
    void shouldCreateHealthIndicatorWhenEnabled() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(DispatcherHealthIndicator.class);
            assertThat(context.getBean(DispatcherHealthIndicator.class).health().getStatus()).isEqualTo(Status.UP);
        });
    }

    @Test
    @DisplayName("should not create DispatcherHealthIndicator when disabled")
    void shouldNotCreateHealthIndicatorWhenDisabled() {
        contextRunner
            .withPropertyValues("architecture.enabled=false")
            .run(context -> assertThat(context).doesNotHaveBean(DispatcherHealthIndicator.class));
    }

    @Test
    @DisplayName("should not create duplicate health indicator if one exists")
    void shouldNotCreateDuplicateHealthIndicator() {
        contextRunner
            .withUserConfiguration(CustomHealthIndicatorConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(DispatcherHealthIndicator.class);
                assertThat(context.getBean(DispatcherHealthIndicator.class))
                    .isSameAs(CustomHealthIndicatorConfig.CUSTOM_INDICATOR);
            });
    }

    @Configuration
    static class CustomHealthIndicatorConfig {

        static final DispatcherHealthIndicator CUSTOM_INDICATOR = mock(DispatcherHealthIndicator.class);

        @Bean
        DispatcherHealthIndicator customIndicator() {
            return CUSTOM_INDICATOR;
        }
    }
}
