package com.ivamare.messagebus.health;

import com.ivamare.messagebus.MessageBusAutoConfiguration;
import com.ivamare.messagebus.broker.MessageBroker;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for message bus health indicators.
 */
@AutoConfiguration(after = MessageBusAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnProperty(prefix = "messagebus", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnBean(MessageBroker.class)
    @ConditionalOnMissingBean(BrokerHealthIndicator.class)
    public BrokerHealthIndicator brokerHealthIndicator(MessageBroker messageBroker) {
        return new BrokerHealthIndicator(messageBroker);
    }
}
