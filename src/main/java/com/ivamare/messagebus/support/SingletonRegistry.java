package com.ivamare.messagebus.support;

import com.ivamare.messagebus.exception.MessageBusException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Registry of shared instances keyed by concrete type.
 *
 * <p>Only classes marked {@link Singleton} are cached; for any other class
 * {@code getOrCreate} builds a fresh instance every time. The registry has no
 * teardown of its own: tests that touch {@link #global()} must call
 * {@link #clear()} or {@link #discard(Class)} between cases.
 */
public class SingletonRegistry {

    private static final Logger log = LoggerFactory.getLogger(SingletonRegistry.class);

    private static final SingletonRegistry GLOBAL = new SingletonRegistry();

    private final Map<Class<?>, Object> instances = new HashMap<>();

    /**
     * @return The process-wide registry
     */
    public static SingletonRegistry global() {
        return GLOBAL;
    }

    public static boolean isSingleton(Class<?> type) {
        return type.isAnnotationPresent(Singleton.class);
    }

    /**
     * Get the cached instance of a type, creating it with its no-argument
     * constructor on first use.
     *
     * @param type The concrete type
     * @return The shared instance, or a new one if the type is not a singleton
     * @throws MessageBusException if the type cannot be instantiated
     */
    public <T> T getOrCreate(Class<T> type) {
        return getOrCreate(type, () -> instantiate(type));
    }

    /**
     * Get the cached instance of a type, creating it with a factory on first use.
     *
     * @param type The concrete type
     * @param factory Creates the instance
     * @return The shared instance, or a new one if the type is not a singleton
     */
    public synchronized <T> T getOrCreate(Class<T> type, Supplier<? extends T> factory) {
        Objects.requireNonNull(type, "type is required");
        Object existing = instances.get(type);
        if (existing != null) {
            return type.cast(existing);
        }

        T instance = Objects.requireNonNull(factory.get(), "factory returned null");
        if (isSingleton(type)) {
            instances.put(type, instance);
            log.debug("Registered singleton {}", type.getName());
        }
        return instance;
    }

    public synchronized boolean contains(Class<?> type) {
        return instances.containsKey(type);
    }

    /**
     * Forget the instance of one type; the next lookup creates a new one.
     */
    public synchronized void discard(Class<?> type) {
        if (instances.remove(type) != null) {
            log.debug("Discarded singleton {}", type.getName());
        }
    }

    /**
     * Forget the instance registered under an object's class.
     */
    public void discard(Object instance) {
        discard(instance.getClass());
    }

    /**
     * Forget every instance.
     */
    public synchronized void clear() {
        instances.clear();
    }

    private static <T> T instantiate(Class<T> type) {
        try {
            return type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new MessageBusException("Cannot instantiate " + type.getName(), e);
        }
    }
}
