package com.scholary.lyricsync.cache;

import com.scholary.lyricsync.align.AlignmentResult;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.function.Function;

/**
 * Cache for alignment results.
 *
 * <p>Alignment is deterministic, so a result can be reused whenever the same transcript record
 * comes back, for example when a batch is re-run after adding new songs. Keys are a digest of the
 * serialized record.
 */
public interface AlignmentCache {

  /**
   * Return the cached result for a record, aligning it on a miss.
   *
   * <p>Failures thrown by {@code alignment} propagate unchanged and nothing is cached.
   *
   * @param cacheKey digest of the transcript record
   * @param alignment computes the result for the key on a miss
   * @return the cached or freshly computed result
   */
  AlignmentResult get(String cacheKey, Function<String, AlignmentResult> alignment);

  /** Current size and hit/miss counters. */
  AlignmentCacheStats stats();

  /**
   * Generate a cache key for a serialized transcript record.
   *
   * @param serializedDocument the record's JSON bytes
   * @return a hex SHA-256 digest
   */
  static String generateKey(byte[] serializedDocument) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(serializedDocument));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }
}
