package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.ReplayingDecoder;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 请求解码器，输出 {@link RedisArray} (每个元素都是 BulkString)
 * <ul>
 *     <li>以 '*' 开头: RESP 数组 (redis-cli 等标准客户端)</li>
 *     <li>其他: 行文本命令，例如 {@code SET key "hello world"}，支持单双引号</li>
 * </ul>
 * 数据不够时 ReplayingDecoder 会抛出 Signal 并回滚读指针，下次从头重新解析。
 * 引号不配对时输出 {@link ErrorMessage}，由 handler 回写给客户端。
 */
public class CommandDecoder extends ReplayingDecoder<Void> {

    private static final byte ASTERISK_BYTE = '*';
    private static final byte DOLLAR_BYTE = '$';
    private static final byte CR = '\r';
    private static final byte LF = '\n';

    // 单个 bulk string 上限 512MB
    private static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    // 单个命令最多 1M 个参数
    private static final int MAX_ARRAY_LENGTH = 1024 * 1024;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        byte first = in.getByte(in.readerIndex());
        if (first == ASTERISK_BYTE) {
            in.skipBytes(1);
            out.add(decodeArray(in));
            return;
        }

        String line = readLine(in);
        if (line.isBlank()) return;

        List<String> tokens = InlineTokenizer.tokenize(line);
        if (tokens == null) {
            out.add(new ErrorMessage("ERR Protocol error: unbalanced quotes in request"));
            return;
        }
        out.add(RedisArray.ofStrings(tokens));
    }

    // *<count>\r\n$<len>\r\n<data>\r\n...
    private RedisArray decodeArray(ByteBuf in) {
        long length = readLong(in);
        if (length < -1 || length > MAX_ARRAY_LENGTH) {
            throw new DecoderException("Protocol error: invalid multibulk length " + length);
        }
        if (length <= 0) {
            return RedisArray.EMPTY;
        }

        int count = (int) length;
        RedisMessage[] elements = new RedisMessage[count];
        for (int i = 0; i < count; i++) {
            byte type = in.readByte();
            if (type != DOLLAR_BYTE) {
                throw new DecoderException("Protocol error: expected '$', got '" + (char) type + "'");
            }
            elements[i] = decodeBulkString(in);
        }
        return new RedisArray(elements);
    }

    private BulkString decodeBulkString(ByteBuf in) {
        long length = readLong(in);
        if (length == -1) {
            return BulkString.NULL;
        }
        if (length < 0 || length > MAX_BULK_LENGTH) {
            throw new DecoderException("Protocol error: invalid bulk length " + length);
        }

        byte[] content = new byte[(int) length];
        in.readBytes(content);

        byte b1 = in.readByte();
        byte b2 = in.readByte();
        if (b1 != CR || b2 != LF) {
            throw new DecoderException("Protocol error: expected CRLF after bulk string");
        }
        return new BulkString(content);
    }

    // 读到 \n 为止，去掉末尾的 \r
    private String readLine(ByteBuf in) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        while (true) {
            byte b = in.readByte();
            if (b == LF) break;
            bytes.write(b);
        }
        byte[] raw = bytes.toByteArray();
        int len = raw.length;
        if (len > 0 && raw[len - 1] == CR) len--;
        return new String(raw, 0, len, StandardCharsets.UTF_8);
    }

    private long readLong(ByteBuf in) {
        String s = readLine(in);
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new DecoderException("Protocol error: invalid length '" + s + "'", e);
        }
    }

    /**
     * 行文本命令分词
     */
    static final class InlineTokenizer {

        private InlineTokenizer() {
        }

        /**
         * @return 引号不配对时返回 null
         */
        static List<String> tokenize(String line) {
            List<String> tokens = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            boolean inToken = false;
            int i = 0;
            int n = line.length();

            while (i < n) {
                char c = line.charAt(i);
                if (c == '"') {
                    int end = readDoubleQuoted(line, i + 1, current);
                    if (end < 0) return null;
                    inToken = true;
                    i = end + 1;
                } else if (c == '\'') {
                    int end = line.indexOf('\'', i + 1);
                    if (end < 0) return null;
                    current.append(line, i + 1, end);
                    inToken = true;
                    i = end + 1;
                } else if (Character.isWhitespace(c)) {
                    if (inToken) {
                        tokens.add(current.toString());
                        current.setLength(0);
                        inToken = false;
                    }
                    i++;
                } else {
                    current.append(c);
                    inToken = true;
                    i++;
                }
            }
            if (inToken) {
                tokens.add(current.toString());
            }
            return tokens;
        }

        // 返回右引号位置，没有右引号返回 -1
        private static int readDoubleQuoted(String line, int start, StringBuilder out) {
            int i = start;
            while (i < line.length()) {
                char c = line.charAt(i);
                if (c == '"') return i;
                if (c == '\\' && i + 1 < line.length()) {
                    char next = line.charAt(++i);
                    switch (next) {
                        case 'n' -> out.append('\n');
                        case 'r' -> out.append('\r');
                        case 't' -> out.append('\t');
                        case 'x' -> {
                            int hex = hexValue(line, i + 1);
                            if (hex < 0) {
                                out.append(next);
                            } else {
                                out.append((char) hex);
                                i += 2;
                            }
                        }
                        default -> out.append(next);
                    }
                } else {
                    out.append(c);
                }
                i++;
            }
            return -1;
        }

        // \xHH: 两位十六进制，不合法返回 -1
        private static int hexValue(String line, int start) {
            if (start + 2 > line.length()) return -1;
            int high = Character.digit(line.charAt(start), 16);
            int low = Character.digit(line.charAt(start + 1), 16);
            if (high < 0 || low < 0) return -1;
            return high * 16 + low;
        }
    }
}
