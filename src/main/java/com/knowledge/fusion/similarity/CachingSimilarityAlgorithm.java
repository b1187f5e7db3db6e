package com.knowledge.fusion.similarity;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Caffeine-backed memoizing decorator for a {@link SimilarityAlgorithm}.
 * Keys are unordered pairs, so {@code (a, b)} and {@code (b, a)} share one entry;
 * this relies on the wrapped algorithm being symmetric.
 */
public class CachingSimilarityAlgorithm implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(CachingSimilarityAlgorithm.class);

    private final SimilarityAlgorithm delegate;
    private final Cache<PairKey, Double> cache;
    private final boolean enabled;

    public CachingSimilarityAlgorithm(SimilarityAlgorithm delegate, CacheConfig config) {
        this.delegate = delegate;
        this.enabled = config.enabled();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CachingSimilarityAlgorithm initialized: delegate={}, maxSize={}, ttl={}s, enabled={}",
                delegate.getName(), config.maxSize(), config.ttlSeconds(), enabled);
    }

    @Override
    public double compute(String s1, String s2) {
        if (!enabled || s1 == null || s2 == null) {
            return delegate.compute(s1, s2);
        }
        return cache.get(PairKey.of(s1, s2), key -> delegate.compute(key.first(), key.second()));
    }

    @Override
    public String getName() {
        return "Cached(" + delegate.getName() + ")";
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    record PairKey(String first, String second) {
        static PairKey of(String a, String b) {
            return a.compareTo(b) <= 0 ? new PairKey(a, b) : new PairKey(b, a);
        }
    }
}
