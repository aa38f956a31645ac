package org.muma.mini.kv.command.impl.set;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.common.SetValue;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

public class SMembersCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("smembers");

        SetValue set = db.write(ks -> ks.getAs(args.argAt(1), SetValue.class));
        if (set == null) {
            return RedisArray.EMPTY;
        }
        return RedisArray.ofStrings(set.members());
    }
}
