package com.ivamare.messagebus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.messagebus.api.MessageBus;
import com.ivamare.messagebus.api.impl.DefaultMessageBus;
import com.ivamare.messagebus.broker.ConcurrentMessageBroker;
import com.ivamare.messagebus.broker.DefaultMessageBroker;
import com.ivamare.messagebus.broker.MessageBroker;
import com.ivamare.messagebus.handler.HandlerRegistry;
import com.ivamare.messagebus.handler.impl.DefaultHandlerRegistry;
import com.ivamare.messagebus.policy.FailureHandler;
import com.ivamare.messagebus.publisher.EventPublisher;
import com.ivamare.messagebus.repository.TrackingRepository;
import com.ivamare.messagebus.support.RuntimeEnvironment;
import com.ivamare.messagebus.uow.EventfulUnitOfWork;
import com.ivamare.messagebus.uow.UnitOfWork;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the message bus.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Runtime environment and failure handler</li>
 *   <li>Handler Registry (discovers {@code @Handler} methods on beans)</li>
 *   <li>Unit of work collecting events from tracking repository beans</li>
 *   <li>Message Bus</li>
 *   <li>Message Broker and Event Publisher</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * messagebus.enabled=false
 * </pre>
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "messagebus", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(MessageBusProperties.class)
public class MessageBusAutoConfiguration {

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper messageBusObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        return mapper;
    }

    // --- Failure Handling ---

    @Bean
    @ConditionalOnMissingBean
    public RuntimeEnvironment runtimeEnvironment(MessageBusProperties properties) {
        return properties.resolveEnvironment();
    }

    @Bean
    @ConditionalOnMissingBean
    public FailureHandler failureHandler(RuntimeEnvironment runtimeEnvironment) {
        return new FailureHandler(runtimeEnvironment);
    }

    // --- Handler Registry ---

    // Static: the registry is a BeanPostProcessor and must not pull this configuration in early.
    @Bean
    @ConditionalOnMissingBean(HandlerRegistry.class)
    public static DefaultHandlerRegistry handlerRegistry() {
        return new DefaultHandlerRegistry();
    }

    // --- Unit of Work ---

    @Bean
    @ConditionalOnMissingBean
    public UnitOfWork unitOfWork(
            MessageBusProperties properties,
            ObjectProvider<TrackingRepository<?, ?>> repositories) {
        EventfulUnitOfWork unitOfWork = new EventfulUnitOfWork();
        unitOfWork.setAutoCommit(properties.getUnitOfWork().isAutoCommit());
        repositories.orderedStream().forEach(unitOfWork::register);
        return unitOfWork;
    }

    // --- Message Bus ---

    @Bean
    @ConditionalOnMissingBean
    public MessageBus messageBus(
            UnitOfWork unitOfWork,
            HandlerRegistry handlerRegistry,
            FailureHandler failureHandler) {
        return new DefaultMessageBus(unitOfWork, handlerRegistry, failureHandler);
    }

    // --- Broker ---

    @Bean
    @ConditionalOnMissingBean
    public MessageBroker messageBroker(MessageBusProperties properties, FailureHandler failureHandler) {
        MessageBusProperties.BrokerProperties broker = properties.getBroker();
        if (broker.getMode() == MessageBusProperties.BrokerMode.CONCURRENT) {
            return new ConcurrentMessageBroker(
                broker.getConcurrency(),
                broker.getShutdownTimeout(),
                failureHandler
            );
        }
        return new DefaultMessageBroker(failureHandler);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventPublisher eventPublisher(MessageBroker messageBroker, ObjectMapper objectMapper) {
        return new EventPublisher(messageBroker, objectMapper);
    }
}
