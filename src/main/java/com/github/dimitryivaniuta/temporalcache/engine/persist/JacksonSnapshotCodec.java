package com.github.dimitryivaniuta.temporalcache.engine.persist;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.dimitryivaniuta.temporalcache.engine.CacheKey;

import java.io.IOException;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON snapshot:
 *
 *   {"version":1,"entries":[{"key":{...},"value":...}, ...]}
 *
 * Entries are written least recently used first.
 */
public final class JacksonSnapshotCodec<K, V> implements SnapshotCodec<K, V> {

    static final int FORMAT_VERSION = 1;

    private final ObjectMapper mapper;
    private final JavaType keyType;
    private final JavaType valueType;

    public JacksonSnapshotCodec(ObjectMapper mapper, JavaType keyType, JavaType valueType) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.keyType = Objects.requireNonNull(keyType, "keyType must not be null");
        this.valueType = Objects.requireNonNull(valueType, "valueType must not be null");
    }

    public static <V> JacksonSnapshotCodec<CacheKey, V> forCacheKeys(ObjectMapper mapper, JavaType valueType) {
        return new JacksonSnapshotCodec<>(mapper, mapper.constructType(CacheKey.class), valueType);
    }

    @Override
    public byte[] encode(List<Map.Entry<K, V>> entries) {
        ObjectNode root = mapper.createObjectNode();
        root.put("version", FORMAT_VERSION);
        ArrayNode items = root.putArray("entries");
        try {
            for (Map.Entry<K, V> e : entries) {
                ObjectNode item = items.addObject();
                item.set("key", mapper.valueToTree(e.getKey()));
                item.set("value", mapper.valueToTree(e.getValue()));
            }
            return mapper.writeValueAsBytes(root);
        } catch (IOException | IllegalArgumentException ex) {
            throw new SnapshotPersistenceException("Cannot encode snapshot", ex);
        }
    }

    @Override
    public List<Map.Entry<K, V>> decode(byte[] blob) {
        try {
            JsonNode root = mapper.readTree(blob);
            if (root == null || !root.isObject()) {
                throw new SnapshotPersistenceException("Snapshot is not a JSON object");
            }
            int version = root.path("version").asInt(-1);
            if (version != FORMAT_VERSION) {
                throw new SnapshotPersistenceException("Unsupported snapshot version " + version);
            }
            List<Map.Entry<K, V>> out = new ArrayList<>();
            for (JsonNode item : root.path("entries")) {
                K key = mapper.convertValue(item.get("key"), keyType);
                if (key == null) {
                    throw new SnapshotPersistenceException("Snapshot entry without key");
                }
                V value = mapper.convertValue(item.get("value"), valueType);
                out.add(new AbstractMap.SimpleImmutableEntry<>(key, value));
            }
            return out;
        } catch (IOException | IllegalArgumentException ex) {
            throw new SnapshotPersistenceException("Cannot decode snapshot", ex);
        }
    }
}
