package org.muma.mini.kv.protocol;

/**
 * RESP2 消息类型。命令层只构造这些对象，不关心编码
 */
public sealed interface RedisMessage permits
        SimpleString, ErrorMessage, RedisInteger, BulkString, RedisArray {
}
