package org.muma.mini.kv.command;

import org.muma.mini.kv.command.impl.hash.*;
import org.muma.mini.kv.command.impl.key.*;
import org.muma.mini.kv.command.impl.list.*;
import org.muma.mini.kv.command.impl.pubsub.*;
import org.muma.mini.kv.command.impl.server.*;
import org.muma.mini.kv.command.impl.set.*;
import org.muma.mini.kv.command.impl.string.*;
import org.muma.mini.kv.memory.MaxMemoryExceededException;
import org.muma.mini.kv.protocol.ErrorMessage;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.store.Database;
import org.muma.mini.kv.store.WrongTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令注册表与分发
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    public static final String OOM_MESSAGE = "OOM command not allowed when used memory > 'maxmemory'";

    private final Map<String, RedisCommand> commandMap = new HashMap<>();
    private final Database db;

    public CommandDispatcher(Database db) {
        this.db = db;
        this.initCommandRegistry();
    }

    /**
     * 初始化命令注册表，按数据结构分类注册
     */
    private void initCommandRegistry() {
        registerGenericCommands();
        registerStringCommands();
        registerListCommands();
        registerSetCommands();
        registerHashCommands();
        registerServerCommands();
        registerPubSubCommands();

        log.info("CommandDispatcher initialized. Total commands registered: {}", commandMap.size());
    }

    private void registerGenericCommands() {
        commandMap.put("DEL", new DelCommand());
        commandMap.put("EXISTS", new ExistsCommand());
        commandMap.put("EXPIRE", new ExpireCommand());
        commandMap.put("TTL", new TtlCommand(false));
        commandMap.put("PTTL", new TtlCommand(true));
        commandMap.put("PERSIST", new PersistCommand());
        commandMap.put("TYPE", new TypeCommand());
        commandMap.put("KEYS", new KeysCommand());
    }

    private void registerStringCommands() {
        commandMap.put("GET", new GetCommand());
        commandMap.put("SET", new SetCommand());
        commandMap.put("SETEX", new SetExCommand());
        commandMap.put("INCR", new IncrCommand("incr", 1, false));
        commandMap.put("DECR", new IncrCommand("decr", -1, false));
        commandMap.put("INCRBY", new IncrCommand("incrby", 1, true));
        commandMap.put("DECRBY", new IncrCommand("decrby", -1, true));
    }

    private void registerListCommands() {
        commandMap.put("LPUSH", new LPushCommand());
        commandMap.put("RPUSH", new RPushCommand());
        commandMap.put("LPOP", new LPopCommand());
        commandMap.put("RPOP", new RPopCommand());
        commandMap.put("LLEN", new LLenCommand());
        commandMap.put("LRANGE", new LRangeCommand());
    }

    private void registerSetCommands() {
        commandMap.put("SADD", new SAddCommand());
        commandMap.put("SREM", new SRemCommand());
        commandMap.put("SMEMBERS", new SMembersCommand());
        commandMap.put("SCARD", new SCardCommand());
        commandMap.put("SISMEMBER", new SIsMemberCommand());
    }

    private void registerHashCommands() {
        commandMap.put("HSET", new HSetCommand());
        commandMap.put("HGET", new HGetCommand());
        commandMap.put("HDEL", new HDelCommand());
        commandMap.put("HGETALL", new HGetAllCommand());
        commandMap.put("HKEYS", new HKeysCommand());
        commandMap.put("HVALS", new HValsCommand());
        commandMap.put("HLEN", new HLenCommand());
    }

    private void registerServerCommands() {
        commandMap.put("PING", new PingCommand());
        commandMap.put("ECHO", new EchoCommand());
        commandMap.put("AUTH", new AuthCommand());
        commandMap.put("DBSIZE", new DbSizeCommand());
        commandMap.put("FLUSHALL", new FlushAllCommand());
        commandMap.put("INFO", new InfoCommand());
        commandMap.put("MEMORY", new MemoryCommand());
        commandMap.put("SAVE", new SaveCommand());
        commandMap.put("BGSAVE", new BgSaveCommand());
        commandMap.put("LASTSAVE", new LastSaveCommand());

        RedisCommand verify = new VerifyIntegrityCommand();
        commandMap.put("VERIFYINTEGRITY", verify);
        commandMap.put("VERIFY", verify);
        RedisCommand recover = new RecoverFromBackupCommand();
        commandMap.put("RECOVERFROMBACKUP", recover);
        commandMap.put("RECOVER", recover);
    }

    private void registerPubSubCommands() {
        commandMap.put("PUBLISH", new PublishCommand());
        commandMap.put("SUBSCRIBE", new SubscribeCommand());
        commandMap.put("UNSUBSCRIBE", new UnsubscribeCommand());
        commandMap.put("PSUBSCRIBE", new PSubscribeCommand());
        commandMap.put("PUNSUBSCRIBE", new PUnsubscribeCommand());
        commandMap.put("PUBSUB", new PubSubCommand());
    }

    public boolean isRegistered(String commandName) {
        return commandMap.containsKey(commandName.toUpperCase(Locale.ROOT));
    }

    /**
     * 核心分发逻辑
     */
    public RedisMessage dispatch(String commandName, RedisArray args, RedisContext context) {
        // 1. 查找命令
        String cmdUpper = commandName.toUpperCase(Locale.ROOT);
        RedisCommand command = commandMap.get(cmdUpper);

        if (command == null) {
            log.warn("Command not found: {}", commandName);
            return new ErrorMessage("ERR unknown command '" + commandName + "'");
        }

        // 2. 执行并监控耗时
        long startTime = System.nanoTime();
        try {
            RedisMessage response = command.execute(db, args, context);

            // 记录慢日志 (比如超过 10ms)
            long duration = (System.nanoTime() - startTime) / 1000_000; // ms
            if (duration > 10) {
                log.warn("Slow command detected: {} cost {}ms", cmdUpper, duration);
            } else if (log.isDebugEnabled()) {
                log.debug("Command executed: {} cost {}ms", cmdUpper, duration);
            }

            return response;

        } catch (WrongTypeException e) {
            log.debug("Wrong type for key '{}' in {}: {}", e.getKey(), cmdUpper, e.getActual());
            return new ErrorMessage(WrongTypeException.MESSAGE);

        } catch (MaxMemoryExceededException e) {
            log.warn("Write rejected by maxmemory: {} (used {} / max {})", cmdUpper, e.getUsedMemory(), e.getMaxMemory());
            return new ErrorMessage(OOM_MESSAGE);

        } catch (IllegalArgumentException | IllegalStateException e) {
            // 预期内的业务错误 (如参数错误)
            log.warn("Command execution failed (Client Error): {} - {}", cmdUpper, e.getMessage());
            return new ErrorMessage("ERR " + e.getMessage());

        } catch (Exception e) {
            // 意料之外的系统错误 (如 NPE)
            log.error("Internal Server Error processing command: {}", cmdUpper, e);
            return new ErrorMessage("ERR internal server error");
        }
    }
}
