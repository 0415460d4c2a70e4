package com.ivamare.messagebus.model;

import com.ivamare.messagebus.exception.InvalidMessageTypeException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A queue of messages kept in ascending order of creation instant.
 *
 * <p>Every mutation re-sorts the whole queue, not just the new elements. The
 * sort is stable, so messages created at the same instant keep the order in
 * which they were inserted.
 *
 * <p>Each entry point checks its elements against the element type given at
 * construction; an {@link #extend} with any offending element leaves the queue
 * untouched.
 *
 * <p>Iterating a queue consumes it: {@link #iterator()} pops from the front.
 * Not thread-safe.
 *
 * @param <T> The message type held by this queue
 */
public class MessageQueue<T extends Message> implements Iterable<T> {

    private final Class<T> elementType;
    private Deque<T> items = new ArrayDeque<>();

    /**
     * Creates an empty queue.
     *
     * @param elementType Type every element must be an instance of
     */
    public MessageQueue(Class<T> elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType is required");
    }

    /**
     * Creates a queue holding the given messages, sorted.
     *
     * @param elementType Type every element must be an instance of
     * @param messages Initial messages
     * @throws InvalidMessageTypeException if any element is null or not an elementType
     */
    public MessageQueue(Class<T> elementType, Iterable<?> messages) {
        this(elementType);
        extend(messages);
    }

    /**
     * Creates an empty queue accepting any message.
     */
    public static MessageQueue<Message> ofMessages() {
        return new MessageQueue<>(Message.class);
    }

    /**
     * Creates an empty queue accepting events only.
     */
    public static MessageQueue<Event> ofEvents() {
        return new MessageQueue<>(Event.class);
    }

    public Class<T> elementType() {
        return elementType;
    }

    /**
     * Appends a message and re-sorts the queue.
     *
     * @param message The message to append
     * @throws InvalidMessageTypeException if message is null or not an elementType
     */
    public void append(Object message) {
        T checked = check(message);
        items.addLast(checked);
        sort();
    }

    /**
     * Appends every message and re-sorts the queue. All elements are checked
     * before the queue is touched.
     *
     * @param messages The messages to append
     * @throws InvalidMessageTypeException naming the first offending element, or
     *         when {@code messages} is null
     */
    public void extend(Iterable<?> messages) {
        if (messages == null) {
            throw new InvalidMessageTypeException(Iterable.class, (Object) null);
        }
        List<T> checked = new ArrayList<>();
        for (Object message : messages) {
            checked.add(check(message));
        }
        items.addAll(checked);
        sort();
    }

    /**
     * Removes and returns the earliest message.
     *
     * @return The earliest message
     * @throws NoSuchElementException if the queue is empty
     */
    public T popLeft() {
        T message = items.pollFirst();
        if (message == null) {
            throw new NoSuchElementException("MessageQueue is empty");
        }
        return message;
    }

    /**
     * Returns the earliest message without removing it.
     *
     * @return The earliest message, or null if empty
     */
    public T peek() {
        return items.peekFirst();
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public void clear() {
        items.clear();
    }

    /**
     * Drains the queue into a list, earliest first.
     */
    public List<T> drain() {
        List<T> drained = new ArrayList<>(items);
        items.clear();
        return drained;
    }

    /**
     * Returns a snapshot of the queued messages without consuming them.
     */
    public List<T> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    /**
     * Returns an iterator that pops each message it yields. The iterator stays
     * live: messages appended while iterating are picked up in order.
     */
    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return !items.isEmpty();
            }

            @Override
            public T next() {
                return popLeft();
            }
        };
    }

    @Override
    public String toString() {
        return items.toString();
    }

    private T check(Object message) {
        if (!elementType.isInstance(message)) {
            throw new InvalidMessageTypeException(elementType, message);
        }
        return elementType.cast(message);
    }

    private void sort() {
        List<T> sorted = new ArrayList<>(items);
        sorted.sort(null);
        items = new ArrayDeque<>(sorted);
    }
}
