package io.vulnscan.cache;

import java.time.Instant;

/**
 * An immutable cached value with its write time.
 */
public record CacheEntry<K, V>(K key, V value, Instant writtenAt) {
}
