package org.muma.mini.kv.store;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 共享的键空间句柄，显式传给每个组件 (不是全局单例)。
 * <p>
 * 所有可能修改数据的操作 (包括 GET 触发的惰性删除) 都走写锁；
 * 只读视图 (KEYS / DBSIZE / 快照拷贝 / 内存统计) 走读锁。
 */
public class Database {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Keyspace keyspace;

    public Database() {
        this(new Keyspace());
    }

    public Database(Keyspace keyspace) {
        this.keyspace = keyspace;
    }

    public <T> T write(Function<Keyspace, T> action) {
        lock.writeLock().lock();
        try {
            return action.apply(keyspace);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void execute(Consumer<Keyspace> action) {
        lock.writeLock().lock();
        try {
            action.accept(keyspace);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public <T> T read(Function<KeyspaceView, T> action) {
        lock.readLock().lock();
        try {
            return action.apply(keyspace);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void restore(KeyspaceImage image) {
        execute(ks -> ks.restore(image));
    }
}
