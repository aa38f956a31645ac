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

import java.io.IOException;

/**
 * RECOVERFROMBACKUP / RECOVER: 用 .bak 替换当前数据，并回写主快照
 */
public class RecoverFromBackupCommand implements RedisCommand {

    private static final Logger log = LoggerFactory.getLogger(RecoverFromBackupCommand.class);

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() != 1) return errorArgs("recoverfrombackup");
        try {
            int keys = context.getSnapshotManager().recoverFromBackup();
            return new SimpleString("OK recovered " + keys + " keys from backup");
        } catch (IOException e) {
            log.error("Recovery from backup failed", e);
            return new ErrorMessage("ERR recovery from backup failed: " + e.getMessage());
        }
    }
}
