package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import java.nio.charset.StandardCharsets;

/**
 * RESP2 编码，数组递归编码
 */
public class RespEncoder extends MessageToByteEncoder<RedisMessage> {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NULL_LENGTH = "-1".getBytes(StandardCharsets.UTF_8);

    @Override
    protected void encode(ChannelHandlerContext ctx, RedisMessage msg, ByteBuf out) {
        write(msg, out);
    }

    public static void write(RedisMessage msg, ByteBuf out) {
        if (msg instanceof SimpleString s) {
            out.writeByte('+');
            writeLine(out, s.content());
        } else if (msg instanceof ErrorMessage e) {
            out.writeByte('-');
            writeLine(out, e.content());
        } else if (msg instanceof RedisInteger i) {
            out.writeByte(':');
            writeLine(out, String.valueOf(i.value()));
        } else if (msg instanceof BulkString b) {
            out.writeByte('$');
            if (b.content() == null) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeLine(out, String.valueOf(b.content().length));
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            out.writeByte('*');
            if (a.elements() == null) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeLine(out, String.valueOf(a.elements().length));
                for (RedisMessage element : a.elements()) {
                    write(element, out);
                }
            }
        }
    }

    // 简单字符串与错误中不能出现换行
    private static void writeLine(ByteBuf out, String content) {
        String safe = content.replace('\r', ' ').replace('\n', ' ');
        out.writeBytes(safe.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
    }
}
