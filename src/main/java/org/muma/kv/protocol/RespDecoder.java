package org.muma.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.ReplayingDecoder;

import java.util.List;

/**
 * RESP decoder.
 * When the buffer runs dry mid-message ReplayingDecoder rewinds and retries once more bytes arrive,
 * so the parsing below can be written as if the whole frame were present.
 */
public class RespDecoder extends ReplayingDecoder<Void> {

    private static final byte PLUS_BYTE = '+';
    private static final byte MINUS_BYTE = '-';
    private static final byte COLON_BYTE = ':';
    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';

    private static final byte CR = '\r';
    private static final byte LF = '\n';

    // proto-max-bulk-len
    private static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    private static final int MAX_ARRAY_LENGTH = 1024 * 1024;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        out.add(readNextObject(in));
    }

    private RedisMessage readNextObject(ByteBuf in) {
        byte type = in.readByte();
        return switch (type) {
            case PLUS_BYTE -> new SimpleString(readLine(in));
            case MINUS_BYTE -> new ErrorMessage(readLine(in));
            case COLON_BYTE -> new RedisInteger(readLong(in));
            case DOLLAR_BYTE -> decodeBulkString(in);
            case ASTERISK_BYTE -> decodeArray(in);
            default -> throw new DecoderException("Protocol error: unknown RESP type byte '" + (char) type + "'");
        };
    }

    // $<length>\r\n<data>\r\n
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
        readCRLF(in);
        return new BulkString(content);
    }

    // *<count>\r\n<element1>...<elementN>
    private RedisArray decodeArray(ByteBuf in) {
        long count = readLong(in);
        if (count == -1) {
            return new RedisArray(null);
        }
        if (count < 0 || count > MAX_ARRAY_LENGTH) {
            throw new DecoderException("Protocol error: invalid multibulk length " + count);
        }

        RedisMessage[] elements = new RedisMessage[(int) count];
        for (int i = 0; i < count; i++) {
            elements[i] = readNextObject(in);
        }
        return new RedisArray(elements);
    }

    private String readLine(ByteBuf in) {
        StringBuilder sb = new StringBuilder();
        while (true) {
            byte b = in.readByte();
            if (b == CR) {
                byte next = in.readByte();
                if (next == LF) {
                    break;
                }
                sb.append((char) b);
                sb.append((char) next);
            } else {
                sb.append((char) b);
            }
        }
        return sb.toString();
    }

    private long readLong(ByteBuf in) {
        String s = readLine(in);
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new DecoderException("Protocol error: expected integer but got '" + s + "'");
        }
    }

    private void readCRLF(ByteBuf in) {
        byte b1 = in.readByte();
        byte b2 = in.readByte();
        if (b1 != CR || b2 != LF) {
            throw new DecoderException("Protocol error: expected CRLF");
        }
    }
}
