package org.muma.mini.kv.memory;

/**
 * noeviction 策略下内存超出预算，写入被拒绝
 */
public class MaxMemoryExceededException extends RuntimeException {

    private final long usedMemory;
    private final long maxMemory;

    public MaxMemoryExceededException(long usedMemory, long maxMemory) {
        super("OOM command not allowed when used memory > 'maxmemory'. Current: "
                + usedMemory + " bytes, Max: " + maxMemory + " bytes");
        this.usedMemory = usedMemory;
        this.maxMemory = maxMemory;
    }

    public long getUsedMemory() {
        return usedMemory;
    }

    public long getMaxMemory() {
        return maxMemory;
    }
}
