package com.talent.sourcing.cache;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Collapses concurrent loads of the same key into one call. The first caller runs the
 * loader; callers arriving while it runs wait for and share its result or its exception.
 */
public class InFlightRequests<K, V> {

    private final ConcurrentMap<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong coalesced = new AtomicLong();

    public V run(K key, Supplier<V> loader) {
        return run(key, loader, () -> {});
    }

    /**
     * @param onCoalesced invoked when this caller joins a call already in flight
     */
    public V run(K key, Supplier<V> loader, Runnable onCoalesced) {
        CompletableFuture<V> mine = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            coalesced.incrementAndGet();
            onCoalesced.run();
            return await(existing);
        }
        try {
            V value = loader.get();
            mine.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    public long coalescedCount() {
        return coalesced.get();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    private V await(CompletableFuture<V> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }
}
