package org.muma.mini.kv.protocol;

import java.util.Collection;

// 数组 (*)，elements 为 null 表示 *-1
public record RedisArray(RedisMessage[] elements) implements RedisMessage {

    public static final RedisArray EMPTY = new RedisArray(new RedisMessage[0]);

    public static RedisArray ofStrings(Collection<String> values) {
        RedisMessage[] elements = new RedisMessage[values.size()];
        int i = 0;
        for (String value : values) {
            elements[i++] = new BulkString(value);
        }
        return new RedisArray(elements);
    }

    public static RedisArray of(RedisMessage... elements) {
        return new RedisArray(elements);
    }

    public int size() {
        return elements == null ? 0 : elements.length;
    }

    /**
     * 第 index 个参数的字符串形式，非 BulkString 返回 null
     */
    public String argAt(int index) {
        RedisMessage m = elements[index];
        if (m instanceof BulkString b) return b.asString();
        if (m instanceof SimpleString s) return s.content();
        return null;
    }
}
