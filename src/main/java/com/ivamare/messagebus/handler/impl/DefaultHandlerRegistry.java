package com.ivamare.messagebus.handler.impl;

import com.ivamare.messagebus.exception.HandlerNotFoundException;
import com.ivamare.messagebus.exception.InvalidMessageTypeException;
import com.ivamare.messagebus.handler.Handler;
import com.ivamare.messagebus.handler.HandlerRegistry;
import com.ivamare.messagebus.handler.MessageHandler;
import com.ivamare.messagebus.model.Command;
import com.ivamare.messagebus.model.Event;
import com.ivamare.messagebus.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanPostProcessor;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Default implementation of HandlerRegistry.
 *
 * <p>Implements BeanPostProcessor to automatically discover and register
 * handlers from Spring beans with @Handler methods.
 */
public class DefaultHandlerRegistry implements HandlerRegistry, BeanPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultHandlerRegistry.class);

    private final Map<Class<? extends Command>, MessageHandler<Message>> commandHandlers =
        new ConcurrentHashMap<>();
    private final Map<Class<? extends Event>, List<MessageHandler<Message>>> eventHandlers =
        new ConcurrentHashMap<>();

    @Override
    public <M extends Message> void register(Class<M> messageType, MessageHandler<? super M> handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler is required");
        }
        registerUnchecked(messageType, handler);
    }

    @Override
    public Optional<MessageHandler<Message>> getCommandHandler(Class<? extends Command> commandType) {
        return Optional.ofNullable(commandHandlers.get(commandType));
    }

    @Override
    public MessageHandler<Message> getCommandHandlerOrThrow(Class<? extends Command> commandType) {
        return getCommandHandler(commandType)
            .orElseThrow(() -> new HandlerNotFoundException(commandType));
    }

    @Override
    public List<MessageHandler<Message>> getEventHandlers(Class<? extends Event> eventType) {
        List<MessageHandler<Message>> handlers = eventHandlers.get(eventType);
        return handlers == null ? List.of() : List.copyOf(handlers);
    }

    @Override
    public boolean hasHandler(Class<? extends Message> messageType) {
        return commandHandlers.containsKey(messageType)
            || !eventHandlers.getOrDefault(messageType, List.of()).isEmpty();
    }

    @Override
    public Map<Class<? extends Command>, MessageHandler<Message>> commandHandlers() {
        return Map.copyOf(commandHandlers);
    }

    @Override
    public Map<Class<? extends Event>, List<MessageHandler<Message>>> eventHandlers() {
        Map<Class<? extends Event>, List<MessageHandler<Message>>> snapshot = new LinkedHashMap<>();
        eventHandlers.forEach((type, handlers) -> snapshot.put(type, List.copyOf(handlers)));
        return snapshot;
    }

    @Override
    public void merge(HandlerRegistry other) {
        other.commandHandlers().forEach(this::registerUnchecked);
        other.eventHandlers().forEach((type, handlers) ->
            handlers.forEach(handler -> registerUnchecked(type, handler)));
    }

    @Override
    public void clear() {
        commandHandlers.clear();
        eventHandlers.clear();
    }

    @Override
    public List<Class<? extends Message>> registerBean(Object bean) {
        List<Class<? extends Message>> registered = new ArrayList<>();

        for (Method method : bean.getClass().getMethods()) {
            if (!method.isAnnotationPresent(Handler.class)) {
                continue;
            }

            Class<? extends Message> messageType = validateHandlerMethod(method);
            registerUnchecked(messageType, message -> invoke(bean, method, message));
            registered.add(messageType);

            log.info("Discovered handler {}.{}() for {}",
                bean.getClass().getSimpleName(), method.getName(), messageType.getSimpleName());
        }

        return registered;
    }

    /**
     * BeanPostProcessor callback - scans beans for @Handler methods.
     */
    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        boolean hasHandlers = Arrays.stream(bean.getClass().getMethods())
            .anyMatch(m -> m.isAnnotationPresent(Handler.class));

        if (hasHandlers) {
            registerBean(bean);
        }

        return bean;
    }

    @SuppressWarnings("unchecked")
    private void registerUnchecked(Class<?> messageType, MessageHandler<?> handler) {
        if (messageType == null) {
            throw new IllegalArgumentException("messageType is required");
        }
        MessageHandler<Message> typed = (MessageHandler<Message>) handler;

        if (Command.class.isAssignableFrom(messageType)) {
            MessageHandler<Message> previous =
                commandHandlers.put((Class<? extends Command>) messageType, typed);
            if (previous != null) {
                log.debug("Replaced handler for {}", messageType.getSimpleName());
            } else {
                log.debug("Registered handler for {}", messageType.getSimpleName());
            }
        } else if (Event.class.isAssignableFrom(messageType)) {
            eventHandlers
                .computeIfAbsent((Class<? extends Event>) messageType, type -> new CopyOnWriteArrayList<>())
                .add(typed);
            log.debug("Subscribed handler to {}", messageType.getSimpleName());
        } else {
            throw new InvalidMessageTypeException(
                messageType.getName() + " is not a 'Command' or an 'Event'",
                Message.class, messageType);
        }
    }

    @SuppressWarnings("unchecked")
    private Class<? extends Message> validateHandlerMethod(Method method) {
        Class<?>[] params = method.getParameterTypes();
        if (params.length != 1 ||
            !(Command.class.isAssignableFrom(params[0]) || Event.class.isAssignableFrom(params[0]))) {

            throw new IllegalArgumentException(
                "Handler method " + method.getName() + " must have signature: " +
                "void methodName(SomeCommand command) or void methodName(SomeEvent event)"
            );
        }
        return (Class<? extends Message>) params[0];
    }

    private static void invoke(Object bean, Method method, Message message) throws Exception {
        try {
            method.invoke(bean, message);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
