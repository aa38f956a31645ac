package org.muma.mini.kv.store;

import java.util.List;
import java.util.Map;

/**
 * Keyspace 的只读视图，在读锁下使用，不会触发惰性删除
 */
public interface KeyspaceView {

    /**
     * 所有未过期的 Key (顺序不保证)
     */
    List<String> keys();

    int size();

    int expiresCount();

    /**
     * 自上次成功保存以来的修改次数
     */
    long dirty();

    /**
     * 拷贝出未过期的数据与过期时间
     */
    KeyspaceImage capture();

    long usedMemory();

    Map<String, String> memoryInfo();
}
