package org.muma.mini.kv.common;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * field -> value 映射，field 唯一
 */
public final class HashValue implements RedisValue {

    private final Map<String, String> fields;

    public HashValue() {
        this.fields = new HashMap<>();
    }

    public HashValue(Map<String, String> fields) {
        this.fields = new HashMap<>(fields);
    }

    @Override
    public RedisDataType type() {
        return RedisDataType.HASH;
    }

    @Override
    public HashValue copy() {
        return new HashValue(fields);
    }

    /**
     * @return 1 表示新字段，0 表示覆盖已有字段
     */
    public int put(String field, String value) {
        return fields.put(field, value) == null ? 1 : 0;
    }

    public String get(String field) {
        return fields.get(field);
    }

    public int remove(String field) {
        return fields.remove(field) != null ? 1 : 0;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public List<String> fieldNames() {
        return new ArrayList<>(fields.keySet());
    }

    public List<String> values() {
        return new ArrayList<>(fields.values());
    }

    public Map<String, String> toMap() {
        return new LinkedHashMap<>(fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HashValue other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "HashValue" + fields;
    }
}
