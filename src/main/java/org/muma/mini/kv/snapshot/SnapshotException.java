package org.muma.mini.kv.snapshot;

import java.io.IOException;

/**
 * 快照文件无法被解析或校验失败
 */
public class SnapshotException extends IOException {

    public SnapshotException(String message) {
        super(message);
    }

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
