package org.muma.mini.kv.command.impl.key;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.pubsub.GlobPattern;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

import java.util.List;
import java.util.stream.Collectors;

/**
 * KEYS pattern (glob)
 */
public class KeysCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() != 2) return errorArgs("keys");

        GlobPattern pattern = GlobPattern.compile(args.argAt(1));
        List<String> keys = db.read(view -> view.keys());
        List<String> matched = keys.stream()
                .filter(pattern::matches)
                .sorted()
                .collect(Collectors.toList());
        return RedisArray.ofStrings(matched);
    }
}
