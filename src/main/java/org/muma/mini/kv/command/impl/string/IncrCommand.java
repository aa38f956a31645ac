package org.muma.mini.kv.command.impl.string;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.IntegerValue;
import org.muma.mini.kv.common.RedisValue;
import org.muma.mini.kv.common.StringValue;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;
import org.muma.mini.kv.store.WrongTypeException;

/**
 * INCR / DECR / INCRBY / DECRBY
 * <p>
 * 不存在的 Key 视为 0；能解析为整数的字符串会被转换成 Integer 类型；保留原有的过期时间
 */
public class IncrCommand implements RedisCommand {

    private final String name;
    private final int sign;
    private final boolean hasDelta;

    /**
     * @param sign     1 为加，-1 为减
     * @param hasDelta 是否带 increment 参数 (INCRBY / DECRBY)
     */
    public IncrCommand(String name, int sign, boolean hasDelta) {
        this.name = name;
        this.sign = sign;
        this.hasDelta = hasDelta;
    }

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() != (hasDelta ? 3 : 2)) return errorArgs(name);

        String key = args.argAt(1);
        long delta = 1;
        if (hasDelta) {
            Long parsed = parseLong(args.argAt(2));
            if (parsed == null) return errorInt();
            if (sign < 0 && parsed == Long.MIN_VALUE) {
                throw new IllegalArgumentException("decrement would overflow");
            }
            delta = parsed;
        }
        long signedDelta = sign * delta;

        long result = db.write(ks -> {
            long current = currentValue(key, ks.get(key));
            long next;
            try {
                next = Math.addExact(current, signedDelta);
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("increment or decrement would overflow");
            }
            ks.update(key, new IntegerValue(next));
            return next;
        });
        return new RedisInteger(result);
    }

    private long currentValue(String key, RedisValue value) {
        if (value == null) return 0;
        if (value instanceof IntegerValue i) return i.value();
        if (value instanceof StringValue s) {
            Long parsed = parseLong(s.value());
            if (parsed == null) {
                throw new IllegalArgumentException("value is not an integer or out of range");
            }
            return parsed;
        }
        throw new WrongTypeException(key, value.type());
    }
}
