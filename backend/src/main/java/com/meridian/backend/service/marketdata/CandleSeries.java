package com.meridian.backend.service.marketdata;

import com.meridian.backend.model.Candle;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded, time-ordered candle buffer for one symbol and timeframe. Writers are
 * serialized by the write lock; readers take consistent snapshots.
 */
class CandleSeries {

    private final int capacity;
    private final Deque<Candle> candles = new ArrayDeque<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile Instant lastRefreshedAt;
    private volatile Instant lastAccessedAt;

    CandleSeries(int capacity, Instant now) {
        this.capacity = capacity;
        this.lastAccessedAt = now;
    }

    /**
     * Upserts by open time. Returns the number of candles dropped from the head.
     */
    int merge(Collection<Candle> incoming, Instant now) {
        lock.writeLock().lock();
        try {
            for (Candle candle : incoming) {
                upsert(candle);
            }
            int dropped = 0;
            while (candles.size() > capacity) {
                candles.pollFirst();
                dropped++;
            }
            lastRefreshedAt = now;
            return dropped;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void upsert(Candle candle) {
        Candle last = candles.peekLast();
        if (last == null || candle.getOpenTime().isAfter(last.getOpenTime())) {
            candles.addLast(candle);
            return;
        }
        if (candle.getOpenTime().equals(last.getOpenTime())) {
            candles.pollLast();
            candles.addLast(candle);
            return;
        }
        // out of order: rebuild with the candle in its slot
        List<Candle> rebuilt = new ArrayList<>(candles.size() + 1);
        boolean placed = false;
        for (Candle existing : candles) {
            if (!placed && !existing.getOpenTime().isBefore(candle.getOpenTime())) {
                rebuilt.add(candle);
                placed = true;
                if (existing.getOpenTime().equals(candle.getOpenTime())) {
                    continue;
                }
            }
            rebuilt.add(existing);
        }
        if (!placed) {
            rebuilt.add(candle);
        }
        candles.clear();
        candles.addAll(rebuilt);
    }

    List<Candle> tail(int length) {
        lock.readLock().lock();
        try {
            List<Candle> all = new ArrayList<>(candles);
            return List.copyOf(all.subList(Math.max(0, all.size() - length), all.size()));
        } finally {
            lock.readLock().unlock();
        }
    }

    int size() {
        lock.readLock().lock();
        try {
            return candles.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    Candle last() {
        lock.readLock().lock();
        try {
            return candles.peekLast();
        } finally {
            lock.readLock().unlock();
        }
    }

    void touch(Instant now) {
        lastAccessedAt = now;
    }

    Instant getLastRefreshedAt() {
        return lastRefreshedAt;
    }

    Instant getLastAccessedAt() {
        return lastAccessedAt;
    }
}
