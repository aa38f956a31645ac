package org.muma.mini.kv.snapshot;

public class SnapshotVersionException extends SnapshotException {

    private final int version;

    public SnapshotVersionException(int version, int supported) {
        super("Unsupported snapshot version " + version + " (max supported: " + supported + ")");
        this.version = version;
    }

    public int getVersion() {
        return version;
    }
}
