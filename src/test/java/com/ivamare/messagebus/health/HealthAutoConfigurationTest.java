package com.ivamare.messagebus.health;

import com.ivamare.messagebus.MessageBusAutoConfiguration;
import com.ivamare.messagebus.broker.DefaultMessageBroker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HealthAutoConfiguration")
class HealthAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(MessageBusAutoConfiguration.class, HealthAutoConfiguration.class));

    @Test
    @DisplayName("should create BrokerHealthIndicator when enabled")
    void shouldCreateBrokerHealthIndicatorWhenEnabled() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(BrokerHealthIndicator.class);
        });
    }

    @Test
    @DisplayName("should not create BrokerHealthIndicator when disabled")
    void shouldNotCreateBrokerHealthIndicatorWhenDisabled() {
        contextRunner
            .withPropertyValues("messagebus.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(BrokerHealthIndicator.class);
            });
    }

    @Test
    @DisplayName("should not create BrokerHealthIndicator without a broker")
    void shouldNotCreateBrokerHealthIndicatorWithoutBroker() {
        new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(HealthAutoConfiguration.class))
            .run(context -> {
                assertThat(context).doesNotHaveBean(BrokerHealthIndicator.class);
            });
    }

    @Test
    @DisplayName("should not create duplicate health indicator if one exists")
    void shouldNotCreateDuplicateHealthIndicator() {
        contextRunner
            .withUserConfiguration(CustomHealthIndicatorConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(BrokerHealthIndicator.class);
                assertThat(context.getBean(BrokerHealthIndicator.class))
                    .isSameAs(CustomHealthIndicatorConfig.CUSTOM_INDICATOR);
            });
    }

    @Configuration
    static class CustomHealthIndicatorConfig {
        static final BrokerHealthIndicator CUSTOM_INDICATOR =
            new BrokerHealthIndicator(new DefaultMessageBroker());

        @Bean
        public BrokerHealthIndicator brokerHealthIndicator() {
            return CUSTOM_INDICATOR;
        }
    }
}
