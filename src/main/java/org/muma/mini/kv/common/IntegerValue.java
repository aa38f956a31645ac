package org.muma.mini.kv.common;

public record IntegerValue(long value) implements RedisValue {

    @Override
    public RedisDataType type() {
        return RedisDataType.INTEGER;
    }

    @Override
    public RedisValue copy() {
        return this;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
