package org.muma.mini.kv.common;

/**
 * Keyspace 中存储的值 (Tagged Union)
 * <p>
 * 每个 Key 同一时刻只对应一种变体。集合类变体是可变的，
 * 所以 Keyspace 对外只交出 {@link #copy()} 后的副本。
 */
public sealed interface RedisValue permits StringValue, IntegerValue, ListValue, SetValue, HashValue {

    RedisDataType type();

    /**
     * 深拷贝。不可变变体直接返回自身
     */
    RedisValue copy();
}
