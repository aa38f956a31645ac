package org.muma.mini.kv.common;

/**
 * Value 的类型标签，与 TYPE 命令以及快照文件中的 "type" 字段一一对应
 */
public enum RedisDataType {
    STRING("string"),
    INTEGER("integer"),
    LIST("list"),
    SET("set"),
    HASH("hash");

    private final String typeName;

    RedisDataType(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    public static RedisDataType fromTypeName(String name) {
        for (RedisDataType type : values()) {
            if (type.typeName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown value type: " + name);
    }
}
