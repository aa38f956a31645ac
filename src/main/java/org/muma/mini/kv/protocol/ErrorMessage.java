package org.muma.mini.kv.protocol;

// -ERR ...
public record ErrorMessage(String content) implements RedisMessage {
}
