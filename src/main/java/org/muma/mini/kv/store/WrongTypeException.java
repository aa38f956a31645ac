package org.muma.mini.kv.store;

import org.muma.mini.kv.common.RedisDataType;

/**
 * 对错误类型的 Key 执行了命令 (比如对 List 执行 HGET)
 */
public class WrongTypeException extends RuntimeException {

    public static final String MESSAGE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    private final String key;
    private final RedisDataType actual;

    public WrongTypeException(String key, RedisDataType actual) {
        super(MESSAGE);
        this.key = key;
        this.actual = actual;
    }

    public String getKey() {
        return key;
    }

    public RedisDataType getActual() {
        return actual;
    }
}
