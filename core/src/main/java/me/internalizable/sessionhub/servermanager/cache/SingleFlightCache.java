package me.internalizable.sessionhub.servermanager.cache;

import me.internalizable.sessionhub.servermanager.event.EventChannel;
import me.internalizable.sessionhub.servermanager.event.Subscription;
import me.internalizable.sessionhub.servermanager.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Keyed cache of lazily created asynchronous values.
 *
 * <p>The cache stores the future itself rather than its result, so every
 * caller asking for an equivalent key before the loader finished observes
 * the same future and the loader runs once per key. Keys are compared after
 * normalization, which lets superficially different spellings of the same
 * key (a URL with and without trailing slash) share a slot. A {@code null}
 * key is a slot of its own.</p>
 *
 * <p>A failed future stays cached: later lookups see the same failure until
 * the key is {@linkplain #invalidate invalidated}.</p>
 *
 * <p>The cache owns the values it created. {@link #clear()} closes every
 * value that implements {@link AutoCloseable}.</p>
 *
 * @param <K> key type
 * @param <V> value type
 */
public class SingleFlightCache<K, V> implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SingleFlightCache.class);

    private final String label;
    private final Function<? super K, CompletableFuture<V>> loader;
    private final Function<? super K, ?> normalizer;

    // Guarded by itself
    private final Map<Slot, Entry<K, V>> slots = new LinkedHashMap<>();

    private final EventChannel<K> onInvalidate;

    /**
     * Create a cache.
     *
     * @param label name used in log output
     * @param loader creates the value for a key; called at most once per key
     * @param normalizer maps a non-null key to its identity
     */
    public SingleFlightCache(
            @Nonnull String label,
            @Nonnull Function<? super K, CompletableFuture<V>> loader,
            @Nonnull Function<? super K, ?> normalizer) {
        this.label = Objects.requireNonNull(label, "label");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.onInvalidate = new EventChannel<>(label + ".invalidate");
    }

    /**
     * Create a cache that compares keys by {@link Object#equals}.
     *
     * @param label name used in log output
     * @param loader creates the value for a key
     * @param <K> key type
     * @param <V> value type
     * @return the cache
     */
    @Nonnull
    public static <K, V> SingleFlightCache<K, V> identity(
            @Nonnull String label,
            @Nonnull Function<? super K, CompletableFuture<V>> loader) {
        return new SingleFlightCache<>(label, loader, Function.identity());
    }

    /**
     * Get the value for a key, creating it on first use.
     *
     * @param key the key, may be null
     * @return the cached future
     */
    @Nonnull
    public CompletableFuture<V> get(@Nullable K key) {
        return getOrCreate(key).future();
    }

    /**
     * Get the value for a key and tell whether this call created the slot.
     * Of several concurrent callers for one key exactly one sees
     * {@link Lookup#created()} as true.
     *
     * @param key the key, may be null
     * @return the cached future and whether the loader ran for this call
     */
    @Nonnull
    public Lookup<V> getOrCreate(@Nullable K key) {
        Slot slot = slotOf(key);
        synchronized (slots) {
            Entry<K, V> entry = slots.get(slot);
            if (entry != null) {
                return new Lookup<>(entry.future(), false);
            }
            LOGGER.debug("{}: caching key {}", label, slot.identity());
            entry = new Entry<>(key, load(key));
            slots.put(slot, entry);
            return new Lookup<>(entry.future(), true);
        }
    }

    /**
     * Check if a key has a slot, pending or settled.
     *
     * @param key the key
     * @return true if cached
     */
    public boolean has(@Nullable K key) {
        Slot slot = slotOf(key);
        synchronized (slots) {
            return slots.containsKey(slot);
        }
    }

    /**
     * Get the cached future for a key without creating one.
     *
     * @param key the key
     * @return the cached future, or null if none
     */
    @Nullable
    public CompletableFuture<V> peek(@Nullable K key) {
        Slot slot = slotOf(key);
        synchronized (slots) {
            Entry<K, V> entry = slots.get(slot);
            return entry != null ? entry.future() : null;
        }
    }

    /**
     * Drop the slot for a key so the next {@link #get} runs the loader again.
     * The dropped value is not closed; the caller now owns it.
     *
     * @param key the key
     * @return the removed future, or null if the key was not cached
     */
    @Nullable
    public CompletableFuture<V> invalidate(@Nullable K key) {
        Slot slot = slotOf(key);
        Entry<K, V> removed;
        synchronized (slots) {
            removed = slots.remove(slot);
        }
        if (removed == null) {
            return null;
        }

        LOGGER.debug("{}: invalidated key {}", label, slot.identity());
        onInvalidate.fireSync(key);
        return removed.future();
    }

    /**
     * Drop the slot for a key only if it still holds the given future.
     *
     * @param key the key
     * @param expected the future the caller observed
     * @return true if the slot was removed
     */
    public boolean invalidate(@Nullable K key, @Nonnull CompletableFuture<V> expected) {
        Objects.requireNonNull(expected, "expected");
        Slot slot = slotOf(key);
        synchronized (slots) {
            Entry<K, V> entry = slots.get(slot);
            if (entry == null || entry.future() != expected) {
                return false;
            }
            slots.remove(slot);
        }

        LOGGER.debug("{}: invalidated key {}", label, slot.identity());
        onInvalidate.fireSync(key);
        return true;
    }

    /**
     * Listen for invalidated keys.
     *
     * @param listener receives the key passed to {@link #invalidate}
     * @return subscription
     */
    @Nonnull
    public Subscription onInvalidate(@Nonnull Consumer<? super K> listener) {
        return onInvalidate.subscribe(listener);
    }

    /**
     * Get the values of every slot that completed successfully, in insertion order.
     *
     * @return snapshot of ready values
     */
    @Nonnull
    public List<V> readyValues() {
        List<V> ready = new ArrayList<>();
        for (Entry<K, V> entry : snapshot()) {
            CompletableFuture<V> future = entry.future();
            if (future.isDone() && !future.isCompletedExceptionally()) {
                V value = future.join();
                if (value != null) {
                    ready.add(value);
                }
            }
        }
        return ready;
    }

    /**
     * Get the keys of every slot, pending or settled, in insertion order.
     *
     * @return snapshot of keys as originally passed to {@link #get}
     */
    @Nonnull
    public List<K> keys() {
        List<K> keys = new ArrayList<>();
        for (Entry<K, V> entry : snapshot()) {
            keys.add(entry.key());
        }
        return keys;
    }

    /**
     * Get the number of slots.
     *
     * @return slot count
     */
    public int size() {
        synchronized (slots) {
            return slots.size();
        }
    }

    /**
     * Empty the cache and close every value it created.
     *
     * <p>Slots are detached immediately, so lookups made while clearing start
     * fresh. Each value is closed once its future settled. Failed futures and
     * close errors are logged and never fail the returned future.</p>
     *
     * @return future completing when every value has been handled
     */
    @Nonnull
    public CompletableFuture<Void> clear() {
        List<Entry<K, V>> detached;
        synchronized (slots) {
            detached = new ArrayList<>(slots.values());
            slots.clear();
        }

        if (detached.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        LOGGER.debug("{}: clearing {} entries", label, detached.size());

        CompletableFuture<?>[] disposing = detached.stream()
                .map(entry -> entry.future().handle((value, error) -> {
                    if (error != null) {
                        LOGGER.debug("{}: skipping failed entry {}: {}",
                                label, entry.key(), Futures.unwrap(error).getMessage());
                    } else {
                        closeQuietly(entry.key(), value);
                    }
                    return null;
                }))
                .toArray(CompletableFuture[]::new);

        return CompletableFuture.allOf(disposing);
    }

    /**
     * Same as {@link #close()}, returning a future for the disposal.
     *
     * @return future completing when all values were closed
     */
    @Nonnull
    public CompletableFuture<Void> dispose() {
        onInvalidate.clear();
        return clear();
    }

    /**
     * Clear the cache, release invalidation listeners and wait for disposal.
     */
    @Override
    public void close() {
        dispose().join();
    }

    private CompletableFuture<V> load(K key) {
        try {
            CompletableFuture<V> future = loader.apply(key);
            return future != null
                    ? future
                    : CompletableFuture.failedFuture(new IllegalStateException(label + ": loader returned null"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void closeQuietly(K key, V value) {
        if (!(value instanceof AutoCloseable)) {
            return;
        }
        try {
            ((AutoCloseable) value).close();
        } catch (Exception e) {
            LOGGER.warn("{}: failed to dispose entry {}", label, key, e);
        }
    }

    private List<Entry<K, V>> snapshot() {
        synchronized (slots) {
            return Collections.unmodifiableList(new ArrayList<>(slots.values()));
        }
    }

    private Slot slotOf(K key) {
        return new Slot(key == null ? null : normalizer.apply(key));
    }

    /**
     * Normalized key; a null identity is the dedicated null-key slot.
     */
    private record Slot(Object identity) {
    }

    private record Entry<K, V>(K key, CompletableFuture<V> future) {
    }

    /**
     * Result of {@link #getOrCreate}.
     *
     * @param future the cached future
     * @param created true if the slot was created by the call
     * @param <V> value type
     */
    public record Lookup<V>(@Nonnull CompletableFuture<V> future, boolean created) {
    }
}
