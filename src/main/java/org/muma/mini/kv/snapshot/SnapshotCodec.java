package org.muma.mini.kv.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.muma.mini.kv.common.HashValue;
import org.muma.mini.kv.common.IntegerValue;
import org.muma.mini.kv.common.ListValue;
import org.muma.mini.kv.common.RedisDataType;
import org.muma.mini.kv.common.RedisValue;
import org.muma.mini.kv.common.SetValue;
import org.muma.mini.kv.common.StringValue;
import org.muma.mini.kv.store.KeyspaceImage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.zip.CRC32;

/**
 * 快照 JSON 编解码
 * <pre>
 * {"version":1,
 *  "data":{"key":{"type":"string","value":"v"}},
 *  "expires":{"key":1700000000},
 *  "checksum":"1a2b3c4d"}
 * </pre>
 * checksum 为去掉 checksum 字段后紧凑 JSON 的 CRC32 (8 位小写十六进制)。
 * expires 中为 epoch 秒。
 */
public class SnapshotCodec {

    public static final int CURRENT_VERSION = 1;

    static final String FIELD_VERSION = "version";
    static final String FIELD_DATA = "data";
    static final String FIELD_EXPIRES = "expires";
    static final String FIELD_CHECKSUM = "checksum";
    static final String FIELD_TYPE = "type";
    static final String FIELD_VALUE = "value";

    private final ObjectMapper mapper;

    public SnapshotCodec() {
        this(new ObjectMapper());
    }

    public SnapshotCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] encode(KeyspaceImage image) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        root.put(FIELD_VERSION, CURRENT_VERSION);

        ObjectNode data = root.putObject(FIELD_DATA);
        // 排序后输出，相同数据得到相同文件
        for (Map.Entry<String, RedisValue> entry : new TreeMap<>(image.data()).entrySet()) {
            data.set(entry.getKey(), encodeValue(entry.getValue()));
        }

        ObjectNode expires = root.putObject(FIELD_EXPIRES);
        for (Map.Entry<String, Long> entry : new TreeMap<>(image.expiresAtMillis()).entrySet()) {
            if (!image.data().containsKey(entry.getKey())) continue;
            expires.put(entry.getKey(), toEpochSeconds(entry.getValue()));
        }

        root.put(FIELD_CHECKSUM, checksum(mapper.writeValueAsBytes(root)));
        return mapper.writeValueAsBytes(root);
    }

    /**
     * @throws SnapshotVersionException  版本高于当前支持的版本
     * @throws SnapshotCorruptedException JSON 无法解析、结构错误或校验和不匹配
     */
    public KeyspaceImage decode(byte[] bytes) throws SnapshotException {
        ObjectNode root = parse(bytes);

        int version = root.path(FIELD_VERSION).asInt(0);
        if (version > CURRENT_VERSION) {
            throw new SnapshotVersionException(version, CURRENT_VERSION);
        }

        JsonNode checksumNode = root.remove(FIELD_CHECKSUM);
        if (checksumNode != null) {
            String expected = checksumNode.asText();
            String actual = checksumOf(root);
            if (!expected.equalsIgnoreCase(actual)) {
                throw new SnapshotCorruptedException("Checksum mismatch: expected " + expected + ", actual " + actual);
            }
        }

        Map<String, RedisValue> data = new HashMap<>();
        JsonNode dataNode = root.path(FIELD_DATA);
        if (!dataNode.isMissingNode() && !dataNode.isObject()) {
            throw new SnapshotCorruptedException("'data' must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = dataNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            data.put(field.getKey(), decodeValue(field.getKey(), field.getValue()));
        }

        Map<String, Long> expires = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> expiryFields = root.path(FIELD_EXPIRES).fields();
        while (expiryFields.hasNext()) {
            Map.Entry<String, JsonNode> field = expiryFields.next();
            if (!field.getValue().canConvertToLong()) {
                throw new SnapshotCorruptedException("Invalid expiry for key '" + field.getKey() + "'");
            }
            // 只保留 data 中存在的 Key 的过期时间
            if (data.containsKey(field.getKey())) {
                expires.put(field.getKey(), field.getValue().asLong() * 1000);
            }
        }
        return new KeyspaceImage(data, expires);
    }

    /**
     * 只校验，不构造数据。没有 checksum 字段时返回 false
     */
    public boolean verify(byte[] bytes) {
        try {
            ObjectNode root = parse(bytes);
            JsonNode checksumNode = root.remove(FIELD_CHECKSUM);
            return checksumNode != null && checksumNode.asText().equalsIgnoreCase(checksumOf(root));
        } catch (SnapshotException e) {
            return false;
        }
    }

    private ObjectNode parse(byte[] bytes) throws SnapshotCorruptedException {
        JsonNode node;
        try {
            node = mapper.readTree(bytes);
        } catch (IOException e) {
            throw new SnapshotCorruptedException("Malformed snapshot JSON: " + e.getMessage(), e);
        }
        if (!(node instanceof ObjectNode root)) {
            throw new SnapshotCorruptedException("Snapshot root must be a JSON object");
        }
        return root;
    }

    private String checksumOf(ObjectNode payload) throws SnapshotCorruptedException {
        try {
            return checksum(mapper.writeValueAsBytes(payload));
        } catch (JsonProcessingException e) {
            throw new SnapshotCorruptedException("Cannot serialize payload for checksum", e);
        }
    }

    static String checksum(byte[] payload) {
        CRC32 crc = new CRC32();
        crc.update(payload);
        return String.format("%08x", crc.getValue());
    }

    /**
     * 毫秒向上取整为秒，保证落盘后不会提前过期
     */
    static long toEpochSeconds(long epochMillis) {
        return Math.floorDiv(epochMillis + 999, 1000);
    }

    private JsonNode encodeValue(RedisValue value) {
        ObjectNode node = mapper.createObjectNode();
        node.put(FIELD_TYPE, value.type().typeName());
        switch (value.type()) {
            case STRING -> node.put(FIELD_VALUE, ((StringValue) value).value());
            case INTEGER -> node.put(FIELD_VALUE, ((IntegerValue) value).value());
            case LIST -> {
                ArrayNode array = node.putArray(FIELD_VALUE);
                ((ListValue) value).items().forEach(array::add);
            }
            case SET -> {
                ArrayNode array = node.putArray(FIELD_VALUE);
                List<String> members = ((SetValue) value).members();
                members.sort(null);
                members.forEach(array::add);
            }
            case HASH -> {
                ObjectNode fields = node.putObject(FIELD_VALUE);
                new TreeMap<>(((HashValue) value).toMap()).forEach(fields::put);
            }
        }
        return node;
    }

    private RedisValue decodeValue(String key, JsonNode node) throws SnapshotCorruptedException {
        JsonNode value = node.path(FIELD_VALUE);
        RedisDataType type;
        try {
            type = RedisDataType.fromTypeName(node.path(FIELD_TYPE).asText());
        } catch (IllegalArgumentException e) {
            throw new SnapshotCorruptedException("Unknown value type for key '" + key + "'", e);
        }

        switch (type) {
            case STRING -> {
                if (!value.isTextual()) throw invalid(key, type);
                return new StringValue(value.asText());
            }
            case INTEGER -> {
                if (!value.canConvertToLong()) throw invalid(key, type);
                return new IntegerValue(value.asLong());
            }
            case LIST -> {
                return new ListValue(textArray(key, type, value));
            }
            case SET -> {
                return new SetValue(textArray(key, type, value));
            }
            case HASH -> {
                if (!value.isObject()) throw invalid(key, type);
                HashValue hash = new HashValue();
                Iterator<Map.Entry<String, JsonNode>> it = value.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    if (!e.getValue().isTextual()) throw invalid(key, type);
                    hash.put(e.getKey(), e.getValue().asText());
                }
                return hash;
            }
            default -> throw invalid(key, type);
        }
    }

    private List<String> textArray(String key, RedisDataType type, JsonNode value) throws SnapshotCorruptedException {
        if (!value.isArray()) throw invalid(key, type);
        List<String> items = new ArrayList<>(value.size());
        for (JsonNode item : value) {
            if (!item.isTextual()) throw invalid(key, type);
            items.add(item.asText());
        }
        return items;
    }

    private SnapshotCorruptedException invalid(String key, RedisDataType type) {
        return new SnapshotCorruptedException("Invalid " + type.typeName() + " value for key '" + key + "'");
    }
}
