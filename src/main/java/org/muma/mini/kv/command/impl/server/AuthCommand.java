package org.muma.mini.kv.command.impl.server;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * AUTH password
 */
public class AuthCommand implements RedisCommand {

    private static final Logger log = LoggerFactory.getLogger(AuthCommand.class);

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("auth");

        String expected = context.getConfig().getRequirePass();
        if (!context.getConfig().isAuthRequired()) {
            return new ErrorMessage("ERR Client sent AUTH, but no password is set");
        }

        // 固定时间比较
        boolean matched = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                args.argAt(1).getBytes(StandardCharsets.UTF_8));
        if (!matched) {
            log.warn("Authentication failed");
            return new ErrorMessage("ERR invalid password");
        }
        context.setAuthenticated(true);
        return SimpleString.OK;
    }
}
