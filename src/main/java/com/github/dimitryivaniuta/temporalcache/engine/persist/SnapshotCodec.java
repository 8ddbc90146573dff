package com.github.dimitryivaniuta.temporalcache.engine.persist;

import java.util.List;
import java.util.Map;

/**
 * Turns the full contents of one memo store into an opaque blob and back.
 * Entry order (least to most recently used) must survive the round trip.
 */
public interface SnapshotCodec<K, V> {

    byte[] encode(List<Map.Entry<K, V>> entries);

    List<Map.Entry<K, V>> decode(byte[] blob);
}
