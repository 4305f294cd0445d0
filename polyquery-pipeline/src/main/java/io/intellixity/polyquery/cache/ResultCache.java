package io.intellixity.polyquery.cache;

import io.intellixity.polyquery.row.Row;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Synchronized LRU cache of final query results, keyed by the SHA-256 of the exact request text.\n
 *
 * - LRU eviction: access-order LinkedHashMap bounded by {@code maxEntries}\n
 * - TTL: expire-after-write; an entry older than the TTL is removed by the lookup that finds it\n
 * - an empty result is a valid cached value\n
 */
public final class ResultCache {
  public static final Duration DEFAULT_TTL = Duration.ofHours(1);
  public static final int DEFAULT_MAX_ENTRIES = 1000;

  private final int maxEntries;
  private final long ttlMillis;
  private final LongSupplier nowMillis;

  private final LinkedHashMap<String, Entry> map = new LinkedHashMap<>(16, 0.75f, true);

  private record Entry(List<Row> rows, long writtenAt) {}

  public ResultCache() {
    this(DEFAULT_MAX_ENTRIES, DEFAULT_TTL);
  }

  public ResultCache(int maxEntries, Duration ttl) {
    this(maxEntries, ttl, System::currentTimeMillis);
  }

  public ResultCache(int maxEntries, Duration ttl, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isNegative()) throw new IllegalArgumentException("ttl must be >= 0");
    this.maxEntries = maxEntries;
    this.ttlMillis = ttl.toMillis();
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  public synchronized Optional<List<Row>> lookup(String requestText) {
    String key = key(requestText);
    Entry e = map.get(key);
    if (e == null) return Optional.empty();
    if (nowMillis.getAsLong() - e.writtenAt > ttlMillis) {
      map.remove(key);
      return Optional.empty();
    }
    return Optional.of(e.rows);
  }

  /** Inserts or replaces the entry for {@code requestText}, resetting its age. */
  public synchronized void store(String requestText, List<Row> rows) {
    Objects.requireNonNull(rows, "rows");
    map.put(key(requestText), new Entry(List.copyOf(rows), nowMillis.getAsLong()));
    evictIfNeeded();
  }

  public synchronized boolean invalidate(String requestText) {
    return map.remove(key(requestText)) != null;
  }

  public synchronized void clear() {
    map.clear();
  }

  /** Number of held entries, including expired ones not yet looked up. */
  public synchronized int size() {
    return map.size();
  }

  /** Hex SHA-256 of the UTF-8 request text; no normalization. */
  public static String key(String requestText) {
    Objects.requireNonNull(requestText, "requestText");
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(md.digest(requestText.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private void evictIfNeeded() {
    while (map.size() > maxEntries) {
      Iterator<Map.Entry<String, Entry>> it = map.entrySet().iterator();
      if (!it.hasNext()) return;
      it.next();
      it.remove();
    }
  }
}
