package org.muma.mini.kv.command.impl.server;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

/**
 * VERIFYINTEGRITY / VERIFY: 重新计算磁盘快照的校验和
 */
public class VerifyIntegrityCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() != 1) return errorArgs("verifyintegrity");
        if (context.getSnapshotManager().verifyIntegrity()) {
            return new SimpleString("OK snapshot checksum verified");
        }
        return new ErrorMessage("ERR snapshot integrity check failed");
    }
}
