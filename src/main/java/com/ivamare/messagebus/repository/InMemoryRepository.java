package com.ivamare.messagebus.repository;

import com.ivamare.messagebus.uow.Session;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Map-backed repository keyed by a key extractor.
 *
 * <p>Records whether commit, rollback and close were called, which makes it
 * suitable as a stand-in for a real store in tests. It is also a
 * {@link Session}, so a {@link com.ivamare.messagebus.uow.SessionedUnitOfWork}
 * can drive it.
 *
 * @param <T> The domain object type
 * @param <K> The key type
 */
public class InMemoryRepository<T, K> implements Repository<T, K>, Session {

    private final Function<? super T, ? extends K> keyExtractor;
    private final Map<K, T> objects = new LinkedHashMap<>();

    private boolean committed;
    private boolean rolledBack;
    private boolean closed;

    public InMemoryRepository(Function<? super T, ? extends K> keyExtractor) {
        this.keyExtractor = Objects.requireNonNull(keyExtractor, "keyExtractor is required");
    }

    @Override
    public void add(T obj) {
        Objects.requireNonNull(obj, "obj is required");
        objects.put(keyExtractor.apply(obj), obj);
    }

    @Override
    public Optional<T> get(K key) {
        return Optional.ofNullable(objects.get(key));
    }

    @Override
    public List<T> list() {
        return new ArrayList<>(objects.values());
    }

    @Override
    public void remove(T obj) {
        Objects.requireNonNull(obj, "obj is required");
        objects.remove(keyExtractor.apply(obj));
    }

    public boolean contains(T obj) {
        return obj != null && objects.containsKey(keyExtractor.apply(obj));
    }

    public int size() {
        return objects.size();
    }

    @Override
    public void commit() {
        committed = true;
    }

    @Override
    public void rollback() {
        rolledBack = true;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isCommitted() {
        return committed;
    }

    public boolean isRolledBack() {
        return rolledBack;
    }

    public boolean isClosed() {
        return closed;
    }
}
