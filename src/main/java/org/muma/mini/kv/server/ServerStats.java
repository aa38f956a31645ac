package org.muma.mini.kv.server;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * INFO 使用的运行时统计
 */
public class ServerStats {

    private final long startTimeMillis = System.currentTimeMillis();
    private final AtomicInteger connectedClients = new AtomicInteger();
    private final AtomicLong totalConnections = new AtomicLong();
    private final AtomicLong totalCommands = new AtomicLong();

    public int clientConnected() {
        totalConnections.incrementAndGet();
        return connectedClients.incrementAndGet();
    }

    public int clientDisconnected() {
        return connectedClients.decrementAndGet();
    }

    public void commandProcessed() {
        totalCommands.incrementAndGet();
    }

    public int getConnectedClients() {
        return connectedClients.get();
    }

    public long getTotalConnections() {
        return totalConnections.get();
    }

    public long getTotalCommands() {
        return totalCommands.get();
    }

    public long getUptimeSeconds() {
        return (System.currentTimeMillis() - startTimeMillis) / 1000;
    }
}
