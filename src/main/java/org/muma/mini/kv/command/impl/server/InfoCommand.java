package org.muma.mini.kv.command.impl.server;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RedisArray;
import org.muma.mini.kv.protocol.RedisMessage;
import org.muma.mini.kv.server.RedisContext;
import org.muma.mini.kv.server.ServerStats;
import org.muma.mini.kv.snapshot.SnapshotManager;
import org.muma.mini.kv.store.Database;

import java.util.Locale;
import java.util.Map;

/**
 * INFO [section]
 * section: server | clients | memory | persistence | stats | keyspace，缺省返回全部
 */
public class InfoCommand implements RedisCommand {

    private static final String VERSION = "1.0.0";

    @Override
    public RedisMessage execute(Database db, RedisArray args, RedisContext context) {
        if (args.size() > 2) return errorArgs("info");
        String section = args.size() == 2 ? args.argAt(1).toLowerCase(Locale.ROOT) : "all";
        boolean all = section.equals("all") || section.equals("everything") || section.equals("default");

        // 一次读锁内取齐数据
        InfoSnapshot data = db.read(view -> new InfoSnapshot(
                view.memoryInfo(), view.size(), view.expiresCount(), view.dirty()));

        StringBuilder sb = new StringBuilder();
        if (all || section.equals("server")) appendServer(sb, context);
        if (all || section.equals("clients")) appendClients(sb, context);
        if (all || section.equals("memory")) appendMemory(sb, data.memory());
        if (all || section.equals("persistence")) appendPersistence(sb, context.getSnapshotManager(), data.dirty());
        if (all || section.equals("stats")) appendStats(sb, context.getStats(), data.memory());
        if (all || section.equals("keyspace")) appendKeyspace(sb, data.keys(), data.expires());
        return new BulkString(sb.toString());
    }

    private void appendServer(StringBuilder sb, RedisContext context) {
        ServerStats stats = context.getStats();
        long uptime = stats == null ? 0 : stats.getUptimeSeconds();
        sb.append("# Server\r\n")
                .append("redis_version:").append(VERSION).append("\r\n")
                .append("redis_mode:standalone\r\n")
                .append("os:").append(System.getProperty("os.name")).append("\r\n")
                .append("process_id:").append(ProcessHandle.current().pid()).append("\r\n")
                .append("tcp_port:").append(context.getConfig().getPort()).append("\r\n")
                .append("uptime_in_seconds:").append(uptime).append("\r\n")
                .append("uptime_in_days:").append(uptime / (3600 * 24)).append("\r\n")
                .append("executable:mini-kv-java\r\n\r\n");
    }

    private void appendClients(StringBuilder sb, RedisContext context) {
        ServerStats stats = context.getStats();
        sb.append("# Clients\r\n")
                .append("connected_clients:").append(stats == null ? 0 : stats.getConnectedClients()).append("\r\n")
                .append("pubsub_subscribers:").append(context.getPubSub().subscriberCount()).append("\r\n")
                .append("pubsub_patterns:").append(context.getPubSub().numPat()).append("\r\n\r\n");
    }

    private void appendMemory(StringBuilder sb, Map<String, String> memory) {
        sb.append("# Memory\r\n");
        memory.forEach((k, v) -> sb.append(k).append(':').append(v).append("\r\n"));
        sb.append("\r\n");
    }

    private void appendPersistence(StringBuilder sb, SnapshotManager snapshots, long dirty) {
        sb.append("# Persistence\r\n")
                .append("loading:0\r\n")
                .append("rdb_changes_since_last_save:").append(dirty).append("\r\n");
        if (snapshots != null) {
            sb.append("rdb_bgsave_in_progress:").append(snapshots.isBgsaveInProgress() ? 1 : 0).append("\r\n")
                    .append("rdb_last_save_time:").append(snapshots.getLastSaveTime()).append("\r\n")
                    .append("rdb_filename:").append(snapshots.getPath()).append("\r\n");
        }
        sb.append("\r\n");
    }

    private void appendStats(StringBuilder sb, ServerStats stats, Map<String, String> memory) {
        sb.append("# Stats\r\n");
        if (stats != null) {
            sb.append("total_connections_received:").append(stats.getTotalConnections()).append("\r\n")
                    .append("total_commands_processed:").append(stats.getTotalCommands()).append("\r\n");
        }
        sb.append("evicted_keys:").append(memory.getOrDefault("evicted_keys", "0")).append("\r\n\r\n");
    }

    private void appendKeyspace(StringBuilder sb, int keys, int expires) {
        sb.append("# Keyspace\r\n");
        if (keys > 0) {
            sb.append("db0:keys=").append(keys).append(",expires=").append(expires).append("\r\n");
        }
    }

    private record InfoSnapshot(Map<String, String> memory, int keys, int expires, long dirty) {
    }
}
