package com.ivamare.messagebus.api.impl;

import com.ivamare.messagebus.api.MessageBus;
import com.ivamare.messagebus.exception.InvalidMessageTypeException;
import com.ivamare.messagebus.handler.HandlerRegistry;
import com.ivamare.messagebus.handler.MessageHandler;
import com.ivamare.messagebus.handler.impl.DefaultHandlerRegistry;
import com.ivamare.messagebus.model.Command;
import com.ivamare.messagebus.model.Event;
import com.ivamare.messagebus.model.Message;
import com.ivamare.messagebus.model.MessageQueue;
import com.ivamare.messagebus.policy.ErrorPolicy;
import com.ivamare.messagebus.policy.FailureHandler;
import com.ivamare.messagebus.uow.EventCollector;
import com.ivamare.messagebus.uow.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Default implementation of MessageBus.
 *
 * <p>The dispatch loop pops the earliest message off the working queue, routes
 * it, and after every single handler invocation moves the events collected by
 * the unit of work onto the same queue. The loop ends when the queue is empty.
 */
public class DefaultMessageBus implements MessageBus {

    private static final Logger log = LoggerFactory.getLogger(DefaultMessageBus.class);

    private final UnitOfWork unitOfWork;
    private final HandlerRegistry handlerRegistry;
    private final FailureHandler failureHandler;
    private final MessageQueue<Message> queue = MessageQueue.ofMessages();

    /**
     * Creates a bus with an empty handler registry.
     *
     * @param unitOfWork The unit of work events are collected from
     */
    public DefaultMessageBus(UnitOfWork unitOfWork) {
        this(unitOfWork, new DefaultHandlerRegistry(), new FailureHandler());
    }

    /**
     * Creates a new DefaultMessageBus.
     *
     * @param unitOfWork The unit of work events are collected from
     * @param handlerRegistry Command and event handlers, possibly pre-populated
     * @param failureHandler Logs failures and applies the error policies
     */
    public DefaultMessageBus(
            UnitOfWork unitOfWork,
            HandlerRegistry handlerRegistry,
            FailureHandler failureHandler) {
        this.unitOfWork = Objects.requireNonNull(unitOfWork, "unitOfWork is required");
        this.handlerRegistry = Objects.requireNonNull(handlerRegistry, "handlerRegistry is required");
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler is required");
    }

    @Override
    public void handle(Message message) {
        handle(message, null);
    }

    @Override
    public void handle(Message message, Runnable callback) {
        if (!(message instanceof Command) && !(message instanceof Event)) {
            throw new InvalidMessageTypeException(
                "expected a 'Command' or an 'Event', got "
                    + (message == null ? "null" : message.getClass().getName()) + " instead",
                Message.class, message == null ? null : message.getClass());
        }

        queue.append(message);
        while (!queue.isEmpty()) {
            handleMessage(queue.popLeft());
        }

        if (callback != null) {
            callback.run();
        }
    }

    @Override
    public <M extends Message> void subscribe(Class<M> messageType, MessageHandler<? super M> handler) {
        handlerRegistry.register(messageType, handler);
    }

    @Override
    public UnitOfWork getUnitOfWork() {
        return unitOfWork;
    }

    @Override
    public MessageQueue<Message> getQueue() {
        return queue;
    }

    public HandlerRegistry getHandlerRegistry() {
        return handlerRegistry;
    }

    private void handleMessage(Message message) {
        if (message instanceof Command command) {
            handleCommand(command);
        } else if (message instanceof Event event) {
            handleEvent(event);
        } else {
            throw new InvalidMessageTypeException(
                message + " was not a 'Command' or an 'Event'", Message.class, message.getClass());
        }
    }

    private void handleCommand(Command command) {
        log.debug("Handling command {}", command);
        try {
            MessageHandler<Message> handler = handlerRegistry.getCommandHandlerOrThrow(command.getClass());
            handler.handle(command);
        } catch (Exception e) {
            collectEvents();
            discardQueue(command);
            failureHandler.handle(command, e, ErrorPolicy.RAISE);
            throw FailureHandler.propagate(command, e);
        }
        collectEvents();
    }

    private void handleEvent(Event event) {
        for (MessageHandler<Message> handler : handlerRegistry.getEventHandlers(event.getClass())) {
            log.debug("Handling event {} with handler {}", event, handler);
            try {
                handler.handle(event);
            } catch (Exception e) {
                failureHandler.handle(event, e, ErrorPolicy.IGNORE);
            }
            try {
                collectEvents();
            } catch (RuntimeException e) {
                failureHandler.handle(event, e, ErrorPolicy.IGNORE);
            }
        }
    }

    private void collectEvents() {
        if (unitOfWork instanceof EventCollector collector) {
            List<Event> events = new ArrayList<>();
            collector.collectEvents().forEachRemaining(events::add);
            if (!events.isEmpty()) {
                log.debug("Collected {} event(s)", events.size());
                queue.extend(events);
            }
        }
    }

    // A failed command leaves nothing behind for the next handle() call.
    private void discardQueue(Command failed) {
        if (!queue.isEmpty()) {
            log.warn("Discarding {} queued message(s) after {} failed", queue.size(), failed);
            queue.clear();
        }
    }
}
