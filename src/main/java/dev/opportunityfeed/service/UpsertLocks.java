package dev.opportunityfeed.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Keyed mutual exclusion for the dedup-then-write path. Keys are taken in sorted order so two
 * writers needing overlapping keys cannot deadlock.
 */
@Component
public class UpsertLocks {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLocks(List<String> keys, Supplier<T> action) {
        List<String> ordered = keys.stream().distinct().sorted().toList();
        List<ReentrantLock> acquired = ordered.stream()
                .map(key -> locks.computeIfAbsent(key, k -> new ReentrantLock()))
                .toList();

        int locked = 0;
        try {
            for (ReentrantLock lock : acquired) {
                lock.lock();
                locked++;
            }
            return action.get();
        } finally {
            for (int i = locked - 1; i >= 0; i--) {
                acquired.get(i).unlock();
            }
        }
    }

    int size() {
        return locks.size();
    }
}
