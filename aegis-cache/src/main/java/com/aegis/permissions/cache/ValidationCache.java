/*
 * Copyright (c) 2025 Aegis Permission Validator
 * Licensed under the Apache License, Version 2.0
 */
package com.aegis.permissions.cache;

import com.aegis.permissions.api.exception.CacheImportException;
import com.aegis.permissions.api.model.CacheStats;
import com.aegis.permissions.api.model.PermissionsConfig;
import com.aegis.permissions.api.model.ValidationResult;
import com.aegis.permissions.infra.metrics.Counter;
import com.aegis.permissions.infra.metrics.Gauge;
import com.aegis.permissions.infra.metrics.MetricsRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Content-addressed cache of validation results.
 *
 * <p>Entries are keyed by {@link ConfigurationHasher configuration hash} and bounded by entry
 * count, estimated memory and time-to-live. Eviction is least-recently-used. An expired entry is
 * removed when it is looked up and counts as a miss.
 *
 * <p>Thread-safe: all state is guarded by a single lock.
 */
public final class ValidationCache {

    private static final Logger logger = Logger.getLogger(ValidationCache.class.getName());

    public static final String FORMAT_VERSION = "1.0.0";
    private static final int STATS_WINDOW = 100;

    private final CacheConfig config;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final ConfigurationHasher hasher;

    private final ReentrantLock lock = new ReentrantLock();
    // access-ordered: iteration starts at the least recently used entry
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final Deque<Double> retrievalTimes = new ArrayDeque<>(STATS_WINDOW);
    private final Deque<Double> validationTimes = new ArrayDeque<>(STATS_WINDOW);
    private long memoryUsedBytes;
    private long hits;
    private long misses;
    private long evictions;

    private final Counter hitCounter;
    private final Counter missCounter;
    private final Counter evictionCounter;
    private final Gauge entryGauge;

    public ValidationCache(CacheConfig config) {
        this(config, MetricsRegistry.noop());
    }

    public ValidationCache(CacheConfig config, MetricsRegistry metrics) {
        this(config, metrics, Clock.systemUTC());
    }

    ValidationCache(CacheConfig config, MetricsRegistry metrics, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.mapper = new ObjectMapper();
        this.hasher = new ConfigurationHasher(mapper);
        this.hitCounter = metrics.counter("aegis.cache.hits");
        this.missCounter = metrics.counter("aegis.cache.misses");
        this.evictionCounter = metrics.counter("aegis.cache.evictions");
        this.entryGauge = metrics.gauge("aegis.cache.entries");

        logger.info(String.format("ValidationCache initialized: %s", config));
    }

    public String generateHash(PermissionsConfig configuration) {
        return hasher.hash(configuration);
    }

    public Optional<ValidationResult> get(String hash) {
        long start = System.nanoTime();
        lock.lock();
        try {
            CacheEntry entry = entries.get(hash);
            long now = clock.millis();
            if (entry == null || entry.isExpired(now, config.getTtl().toMillis())) {
                if (entry != null) {
                    remove(hash);
                    if (logger.isLoggable(Level.FINE)) {
                        logger.fine("Expired cache entry: " + hash);
                    }
                }
                misses++;
                missCounter.increment();
                return Optional.empty();
            }

            entries.put(hash, entry.accessed(now));
            hits++;
            hitCounter.increment();
            record(retrievalTimes, (System.nanoTime() - start) / 1_000_000.0);
            return Optional.of(entry.result());
        } finally {
            lock.unlock();
        }
    }

    public void put(String hash, ValidationResult result) {
        put(hash, result, null);
    }

    /**
     * Stores a result.
     *
     * @param validationTimeMs time the validation took, recorded for statistics when non-null
     */
    public void put(String hash, ValidationResult result, Double validationTimeMs) {
        long size = estimateSize(result);
        if (size > config.getMaxMemoryBytes()) {
            logger.warning(String.format("Result for %s is larger than the cache (%d bytes), not cached", hash, size));
            return;
        }
        long now = clock.millis();
        lock.lock();
        try {
            insert(new CacheEntry(result, hash, now, 0, now, size));
            if (validationTimeMs != null) {
                record(validationTimes, validationTimeMs);
            }
        } finally {
            lock.unlock();
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Cached result: hash=%s, size=%d bytes", hash, size));
        }
    }

    public boolean invalidate(String hash) {
        lock.lock();
        try {
            return remove(hash) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry whose hash matches.
     *
     * @return the number of entries removed
     */
    public int invalidate(Predicate<String> hashFilter) {
        lock.lock();
        try {
            List<String> matching = new ArrayList<>();
            for (String hash : entries.keySet()) {
                if (hashFilter.test(hash)) {
                    matching.add(hash);
                }
            }
            matching.forEach(this::remove);
            return matching.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            int size = entries.size();
            entries.clear();
            memoryUsedBytes = 0;
            entryGauge.set(0);
            logger.info("Cache cleared: " + size + " entries removed");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Validates and caches configurations that are not cached yet.
     *
     * @return the number of configurations validated
     */
    public int warmUp(List<PermissionsConfig> configurations, Function<PermissionsConfig, ValidationResult> validator) {
        int warmed = 0;
        for (PermissionsConfig configuration : configurations) {
            String hash = generateHash(configuration);
            if (contains(hash)) {
                continue;
            }
            long start = System.nanoTime();
            ValidationResult result = validator.apply(configuration);
            put(hash, result, (System.nanoTime() - start) / 1_000_000.0);
            warmed++;
        }
        logger.info(String.format("Cache warm-up: %d of %d configurations validated", warmed, configurations.size()));
        return warmed;
    }

    public boolean contains(String hash) {
        lock.lock();
        try {
            CacheEntry entry = entries.get(hash);
            return entry != null && !entry.isExpired(clock.millis(), config.getTtl().toMillis());
        } finally {
            lock.unlock();
        }
    }

    public CacheStats getStats() {
        lock.lock();
        try {
            long lookups = hits + misses;
            return new CacheStats(
                    entries.size(),
                    hits,
                    misses,
                    lookups > 0 ? (double) hits / lookups : 0.0,
                    memoryUsedBytes,
                    evictions,
                    average(retrievalTimes),
                    average(validationTimes));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Serializes all live entries as versioned JSON.
     */
    public String export() {
        lock.lock();
        List<CacheEntry> live;
        try {
            long now = clock.millis();
            long ttlMillis = config.getTtl().toMillis();
            live = new ArrayList<>(entries.size());
            for (CacheEntry entry : entries.values()) {
                if (!entry.isExpired(now, ttlMillis)) {
                    live.add(entry);
                }
            }
        } finally {
            lock.unlock();
        }
        try {
            return mapper.writeValueAsString(new CacheSnapshot(FORMAT_VERSION, clock.millis(), live));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to export cache: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Loads entries produced by {@link #export()}. Expired entries are skipped.
     *
     * @return the number of entries imported
     * @throws CacheImportException if the data is malformed or has another format version
     */
    public int importEntries(String json) {
        CacheSnapshot snapshot;
        try {
            snapshot = mapper.readValue(json, CacheSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new CacheImportException("Malformed cache export: " + e.getOriginalMessage(), e);
        }
        if (!FORMAT_VERSION.equals(snapshot.version())) {
            throw new CacheImportException(String.format(
                    "Unsupported cache export version %s, expected %s", snapshot.version(), FORMAT_VERSION));
        }

        int imported = 0;
        lock.lock();
        try {
            long now = clock.millis();
            long ttlMillis = config.getTtl().toMillis();
            for (CacheEntry entry : snapshot.entries()) {
                if (entry.isExpired(now, ttlMillis) || entry.estimatedSizeBytes() > config.getMaxMemoryBytes()) {
                    continue;
                }
                insert(entry);
                imported++;
            }
        } finally {
            lock.unlock();
        }
        logger.info(String.format("Imported %d of %d cache entries", imported, snapshot.entries().size()));
        return imported;
    }

    // ---- internals, callers hold the lock --------------------------------------------------

    private void insert(CacheEntry entry) {
        remove(entry.configHash());
        Iterator<Map.Entry<String, CacheEntry>> eldest = entries.entrySet().iterator();
        while (eldest.hasNext()
                && (entries.size() >= config.getMaxEntries()
                || memoryUsedBytes + entry.estimatedSizeBytes() > config.getMaxMemoryBytes())) {
            CacheEntry evicted = eldest.next().getValue();
            eldest.remove();
            memoryUsedBytes -= evicted.estimatedSizeBytes();
            evictions++;
            evictionCounter.increment();
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Evicted LRU entry: " + evicted.configHash());
            }
        }
        entries.put(entry.configHash(), entry);
        memoryUsedBytes += entry.estimatedSizeBytes();
        entryGauge.set(entries.size());
    }

    private CacheEntry remove(String hash) {
        CacheEntry removed = entries.remove(hash);
        if (removed != null) {
            memoryUsedBytes -= removed.estimatedSizeBytes();
            entryGauge.set(entries.size());
        }
        return removed;
    }

    private long estimateSize(ValidationResult result) {
        try {
            return (long) mapper.writeValueAsString(result).length() * 2;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize validation result: " + e.getOriginalMessage(), e);
        }
    }

    private static void record(Deque<Double> window, double sample) {
        if (window.size() == STATS_WINDOW) {
            window.removeFirst();
        }
        window.addLast(sample);
    }

    private static double average(Deque<Double> window) {
        return window.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    record CacheSnapshot(String version, long exportedAt, List<CacheEntry> entries) {
        CacheSnapshot {
            entries = entries == null ? List.of() : entries;
        }
    }
}
