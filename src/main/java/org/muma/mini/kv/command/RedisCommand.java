package org.muma.mini.kv.command;

import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;
import org.muma.mini.kv.store.Keyspace;

import java.time.Duration;

public interface RedisCommand {

    /**
     * 执行命令。返回 null 表示不需要直接回复 (如 SUBSCRIBE，确认消息走订阅队列)
     */
    RedisMessage execute(Database db, RedisArray args, RedisContext context);

    /**
     * 辅助工具：快速构建参数错误
     */
    default ErrorMessage errorArgs(String cmd) {
        return new ErrorMessage("ERR wrong number of arguments for '" + cmd + "' command");
    }

    /**
     * 辅助工具：快速构建数值错误
     */
    default ErrorMessage errorInt() {
        return new ErrorMessage("ERR value is not an integer or out of range");
    }

    default ErrorMessage errorSyntax() {
        return new ErrorMessage("ERR syntax error");
    }

    default ErrorMessage errorExpire(String cmd) {
        return new ErrorMessage("ERR invalid expire time in '" + cmd + "' command");
    }

    /**
     * 客户端给出的过期时间转成 Duration，超出 {@link Keyspace#MAX_TTL} 时返回 null
     */
    default Duration toTtl(long amount, boolean seconds) {
        Duration ttl = seconds ? Duration.ofSeconds(amount) : Duration.ofMillis(amount);
        return ttl.compareTo(Keyspace.MAX_TTL) > 0 ? null : ttl;
    }

    /**
     * 解析整数参数，格式错误返回 null
     */
    default Long parseLong(String s) {
        if (s == null) return null;
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
