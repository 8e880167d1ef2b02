package io.vulnscan.index;

import java.util.Map;

/**
 * One stored vector with its insertion-order id and opaque metadata.
 */
public record VectorRecord(int id, float[] vector, Map<String, Object> metadata) {
}
