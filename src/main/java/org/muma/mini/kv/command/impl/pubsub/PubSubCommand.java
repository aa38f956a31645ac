package org.muma.mini.kv.command.impl.pubsub;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisInteger;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.pubsub.PubSubRegistry;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;

import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * PUBSUB CHANNELS [pattern] | NUMSUB [channel ...] | NUMPAT
 */
public class PubSubCommand implements RedisCommand {

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() < 2) return errorArgs("pubsub");

        PubSubRegistry registry = context.getPubSub();
        String sub = args.argAt(1).toUpperCase(Locale.ROOT);
        switch (sub) {
            case "CHANNELS" -> {
                if (args.size() > 3) return errorArgs("pubsub|channels");
                List<String> channels = registry.activeChannels(args.size() == 3 ? args.argAt(2) : null);
                Collections.sort(channels);
                return RedisArray.ofStrings(channels);
            }
            case "NUMSUB" -> {
                // [channel1, count1, channel2, count2 ...]
                RedisMessage[] result = new RedisMessage[(args.size() - 2) * 2];
                int j = 0;
                for (int i = 2; i < args.size(); i++) {
                    String channel = args.argAt(i);
                    result[j++] = new BulkString(channel);
                    result[j++] = new RedisInteger(registry.numSub(channel));
                }
                return new RedisArray(result);
            }
            case "NUMPAT" -> {
                if (args.size() != 2) return errorArgs("pubsub|numpat");
                return new RedisInteger(registry.numPat());
            }
            default -> {
                return new ErrorMessage("ERR unknown subcommand '" + args.argAt(1) + "'. Try PUBSUB CHANNELS|NUMSUB|NUMPAT");
            }
        }
    }
}
