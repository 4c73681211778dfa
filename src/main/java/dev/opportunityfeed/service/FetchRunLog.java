package dev.opportunityfeed.service;

import dev.opportunityfeed.config.IngestionConfig;
import dev.opportunityfeed.model.FetchRunStats;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * In-memory ring of the most recent runs, newest first. Not persisted.
 */
@Component
public class FetchRunLog {

    private final int capacity;
    private final Deque<FetchRunStats> runs = new ArrayDeque<>();

    @Autowired
    public FetchRunLog(IngestionConfig config) {
        this(config.getRunLogCapacity());
    }

    public FetchRunLog(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    public synchronized void append(FetchRunStats stats) {
        runs.addFirst(stats);
        while (runs.size() > capacity) {
            runs.removeLast();
        }
    }

    public synchronized List<FetchRunStats> recent(int limit) {
        List<FetchRunStats> result = new ArrayList<>();
        Iterator<FetchRunStats> iterator = runs.iterator();
        while (iterator.hasNext() && result.size() < limit) {
            result.add(iterator.next());
        }
        return result;
    }

    public synchronized int size() {
        return runs.size();
    }
}
