package com.example.trackscribe.service;

import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per track id, so a track is never fetched or transcribed by two threads at once.
 * An entry lives only while some thread holds or waits for it.
 */
@Component
public class TrackLocks {
    private final ConcurrentHashMap<UUID, Entry> locks = new ConcurrentHashMap<>();

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        int users;
    }

    public <T> T withLock(UUID trackId, Supplier<T> work) {
        Entry entry = locks.compute(trackId, (id, existing) -> {
            Entry e = existing == null ? new Entry() : existing;
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return work.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(trackId, (id, e) -> --e.users == 0 ? null : e);
        }
    }

    int size() {
        return locks.size();
    }
}
