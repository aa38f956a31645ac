package org.muma.mini.kv.common;

import java.util.Objects;

public record StringValue(String value) implements RedisValue {

    public StringValue {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public RedisDataType type() {
        return RedisDataType.STRING;
    }

    @Override
    public RedisValue copy() {
        return this;
    }
}
