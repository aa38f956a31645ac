package org.muma.mini.kv.command.impl.string;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.StringValue;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

import java.time.Duration;
import java.util.Locale;

/**
 * SET key value [EX seconds | PX milliseconds] [NX | XX]
 * <p>
 * 覆盖写入会清除原有的过期时间
 */
public class SetCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() < 3) return errorArgs("set");

        String key = args.argAt(1);
        String value = args.argAt(2);

        // --- 1. 参数解析阶段 ---
        boolean nx = false; // Not Exist
        boolean xx = false; // Already Exist
        Duration ttl = null;

        for (int i = 3; i < args.size(); i++) {
            String opt = args.argAt(i).toUpperCase(Locale.ROOT);
            switch (opt) {
                case "NX" -> {
                    if (xx) return errorSyntax();
                    nx = true;
                }
                case "XX" -> {
                    if (nx) return errorSyntax();
                    xx = true;
                }
                case "EX", "PX" -> {
                    if (ttl != null || i + 1 >= args.size()) return errorSyntax();
                    Long amount = parseLong(args.argAt(++i));
                    if (amount == null) return errorInt();
                    if (amount <= 0) return errorExpire("set");
                    ttl = toTtl(amount, opt.equals("EX"));
                    if (ttl == null) return errorExpire("set");
                }
                default -> {
                    return errorSyntax();
                }
            }
        }

        // --- 2. 检查 + 写入，在同一个写锁内完成 ---
        final boolean onlyIfAbsent = nx;
        final boolean onlyIfPresent = xx;
        final Duration expireIn = ttl;
        boolean written = db.write(ks -> {
            boolean exists = ks.exists(key);
            if ((onlyIfAbsent && exists) || (onlyIfPresent && !exists)) {
                return false;
            }
            if (expireIn != null) {
                ks.setWithExpiry(key, new StringValue(value), expireIn);
            } else {
                ks.set(key, new StringValue(value));
            }
            return true;
        });

        return written ? SimpleString.OK : BulkString.NULL;
    }
}
