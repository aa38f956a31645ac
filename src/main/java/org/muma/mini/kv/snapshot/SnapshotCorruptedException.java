package org.muma.mini.kv.snapshot;

/**
 * 校验和不匹配、文件截断或内容格式错误
 */
public class SnapshotCorruptedException extends SnapshotException {

    public SnapshotCorruptedException(String message) {
        super(message);
    }

    public SnapshotCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
