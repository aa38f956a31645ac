package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.HashValue;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

public class HValsCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("hvals");

        HashValue hash = db.write(ks -> ks.getAs(args.argAt(1), HashValue.class));
        if (hash == null) {
            return RedisArray.EMPTY;
        }
        return RedisArray.ofStrings(hash.values());
    }
}
