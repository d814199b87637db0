package com.lumen.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.lumen.config.LumenProperties;
import com.lumen.model.CacheEntry;
import com.lumen.model.GenerationResult;
import com.lumen.model.dto.CacheStatistics;
import com.lumen.model.telemetry.TelemetryData;
import com.lumen.model.telemetry.TelemetryEventType;
import com.lumen.service.scoring.ScoringStrategy;
import com.lumen.service.telemetry.ResourceUsageProvider;
import com.lumen.service.telemetry.TelemetryRecorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.regex.Pattern;

/**
 * Key-addressed, TTL-bounded store of model responses backed by Caffeine.
 * <p>
 * Each entry expires after its own TTL, measured on the injected {@link Clock}. Capacity
 * is enforced here rather than by Caffeine's size policy: storing into a full cache evicts
 * the oldest inserted entry. Lookups hand out copies, so callers cannot stretch a TTL.
 */
@Slf4j
@Service
public class ResponseCacheStore {

    private static final String SOURCE = "cache-store";

    private final CacheKeyGenerator keyGenerator;
    private final ScoringStrategy scoringStrategy;
    private final TelemetryRecorder telemetry;
    private final ResourceUsageProvider resourceUsageProvider;
    private final LumenProperties.CacheConfig config;
    private final Clock clock;
    private final Cache<String, CacheEntry> cache;

    // Keys in insertion order, oldest first; guarded by itself
    private final LinkedHashSet<String> insertionOrder = new LinkedHashSet<>();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder capacityEvictions = new LongAdder();

    public ResponseCacheStore(
            CacheKeyGenerator keyGenerator,
            ScoringStrategy scoringStrategy,
            TelemetryRecorder telemetry,
            ResourceUsageProvider resourceUsageProvider,
            LumenProperties properties,
            Clock clock) {
        this.keyGenerator = keyGenerator;
        this.scoringStrategy = scoringStrategy;
        this.telemetry = telemetry;
        this.resourceUsageProvider = resourceUsageProvider;
        this.config = properties.getCache();
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .expireAfter(new EntryTtlExpiry())
                .ticker(clockTicker(clock))
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    /**
     * Look up a cached response. A miss is an empty result, never an error.
     */
    public Optional<CacheEntry> lookup(String prompt, String model, Map<String, Object> options) {
        if (!config.isEnabled()) {
            return Optional.empty();
        }

        String key = keyGenerator.generateKey(prompt, model, options);
        CacheEntry entry = cache.getIfPresent(key);

        if (entry != null && entry.isExpired(clock.instant())) {
            cache.invalidate(key);
            entry = null;
        }

        if (entry == null) {
            misses.increment();
            log.debug("Cache MISS: model={}, key={}", model, key);
            recordLookup(TelemetryEventType.CACHE_MISS, key, model);
            return Optional.empty();
        }

        hits.increment();
        log.info("Cache HIT: model={}, key={}", model, key);
        recordLookup(TelemetryEventType.CACHE_HIT, key, model);
        return Optional.of(entry.toBuilder().build());
    }

    /**
     * Store a completed generation under the key of (prompt, model, options).
     *
     * @param ttl entry TTL; the configured default when null
     */
    public CacheEntry store(String prompt, String model, Map<String, Object> options,
                            GenerationResult result, Duration ttl) {
        Duration effectiveTtl = ttl != null ? ttl : config.getDefaultTtl();
        if (effectiveTtl.isNegative() || effectiveTtl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + effectiveTtl);
        }

        String key = keyGenerator.generateKey(prompt, model, options);
        CacheEntry entry = CacheEntry.builder()
                .key(key)
                .content(result.getContent())
                .model(model)
                .prompt(prompt)
                .createdAt(clock.instant())
                .ttl(effectiveTtl)
                .tokenUsage(result.getTokenUsage())
                .confidenceScore(scoringStrategy.responseConfidence(
                        result.getContent(), result.getTokenUsage(), result.getDurationMs()))
                .processingTimeMs(result.getDurationMs())
                .build();

        if (config.isEnabled()) {
            synchronized (insertionOrder) {
                insertionOrder.remove(key);
                makeRoom();
                insertionOrder.add(key);
                cache.put(key, entry);
            }
            log.debug("Cached response: model={}, key={}, ttl={}", model, key, effectiveTtl);
        }
        return entry.toBuilder().build();
    }

    // Caller holds the insertionOrder lock
    private void makeRoom() {
        Iterator<String> oldest = insertionOrder.iterator();
        while (oldest.hasNext()) {
            if (!cache.asMap().containsKey(oldest.next())) {
                oldest.remove();
            }
        }

        oldest = insertionOrder.iterator();
        while (insertionOrder.size() >= config.getMaxSize() && oldest.hasNext()) {
            String evicted = oldest.next();
            oldest.remove();
            cache.invalidate(evicted);
            capacityEvictions.increment();
            log.debug("Evicted oldest cache entry: key={}", evicted);
        }
    }

    /**
     * Remove entries whose key, model or prompt matches a glob pattern ({@code *}, {@code ?}).
     *
     * @return number of removed entries
     */
    public int invalidate(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("Invalidation pattern must not be empty");
        }
        Pattern regex = globToRegex(pattern);

        List<String> matched = new ArrayList<>();
        cache.asMap().forEach((key, entry) -> {
            if (regex.matcher(key).matches()
                    || (entry.getModel() != null && regex.matcher(entry.getModel()).matches())
                    || (entry.getPrompt() != null && regex.matcher(entry.getPrompt()).matches())) {
                matched.add(key);
            }
        });
        synchronized (insertionOrder) {
            cache.invalidateAll(matched);
            matched.forEach(insertionOrder::remove);
        }

        log.info("Invalidated {} cache entries matching '{}'", matched.size(), pattern);
        return matched.size();
    }

    public void clear() {
        long size = cache.estimatedSize();
        synchronized (insertionOrder) {
            cache.invalidateAll();
            insertionOrder.clear();
        }
        cache.cleanUp();
        log.info("Cache cleared ({} entries)", size);
    }

    public CacheStatistics stats() {
        cache.cleanUp();
        long hitCount = hits.sum();
        long missCount = misses.sum();
        return CacheStatistics.builder()
                .size(cache.estimatedSize())
                .maxSize(config.getMaxSize())
                .hits(hitCount)
                .misses(missCount)
                .hitRate(hitRate(hitCount, missCount))
                .evictions(capacityEvictions.sum() + cache.stats().evictionCount())
                .defaultTtlMs(config.getDefaultTtl().toMillis())
                .build();
    }

    private void recordLookup(TelemetryEventType type, String key, String model) {
        telemetry.record(type, SOURCE, TelemetryData.builder()
                .operation("cache_lookup")
                .parameters(Map.of("key", key, "model", model))
                .resourceUsage(resourceUsageProvider.current().toBuilder()
                        .cacheHitRate(hitRate(hits.sum(), misses.sum()))
                        .build())
                .build());
    }

    private static double hitRate(long hitCount, long missCount) {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*':
                    regex.append(".*");
                    break;
                case '?':
                    regex.append('.');
                    break;
                default:
                    regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static Ticker clockTicker(Clock clock) {
        return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
    }

    /**
     * Per-entry TTL; reads do not extend it.
     */
    private static class EntryTtlExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return entry.getTtl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return entry.getTtl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
