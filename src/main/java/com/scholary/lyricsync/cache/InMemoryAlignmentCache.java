package com.scholary.lyricsync.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.scholary.lyricsync.align.AlignmentResult;
import com.scholary.lyricsync.config.AlignmentProperties;
import com.scholary.lyricsync.config.AlignmentProperties.CacheProperties;
import java.time.Duration;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Caffeine-backed {@link AlignmentCache}.
 *
 * <p>Bounded by {@code alignment.cache.max-size} and expiring {@code ttl-hours} after a result is
 * written. Concurrent requests for the same record align it once; the others wait for that result.
 */
@Component
public class InMemoryAlignmentCache implements AlignmentCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryAlignmentCache.class);

  private final Cache<String, AlignmentResult> results;

  public InMemoryAlignmentCache(AlignmentProperties properties) {
    CacheProperties cache = properties.cache();
    this.results =
        Caffeine.newBuilder()
            .maximumSize(cache.maxSize())
            .expireAfterWrite(Duration.ofHours(cache.ttlHours()))
            .recordStats()
            .build();

    LOGGER.info(
        "Initialized alignment cache: maxSize={}, ttlHours={}", cache.maxSize(), cache.ttlHours());
  }

  @Override
  public AlignmentResult get(String cacheKey, Function<String, AlignmentResult> alignment) {
    return results.get(cacheKey, alignment);
  }

  @Override
  public AlignmentCacheStats stats() {
    CacheStats stats = results.stats();
    return new AlignmentCacheStats(
        results.estimatedSize(), stats.hitCount(), stats.missCount(), stats.evictionCount());
  }
}
