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
 * SAVE: 同步写快照
 */
public class SaveCommand implements RedisCommand {

    private static final Logger log = LoggerFactory.getLogger(SaveCommand.class);

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() != 1) return errorArgs("save");
        try {
            context.getSnapshotManager().save();
            return SimpleString.OK;
        } catch (IOException e) {
            log.error("SAVE failed", e);
            return new ErrorMessage("ERR snapshot save failed: " + e.getMessage());
        }
    }
}
