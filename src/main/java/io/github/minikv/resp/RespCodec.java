package io.github.minikv.resp;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Ascii;
import com.google.common.primitives.UnsignedLong;
import com.google.common.primitives.UnsignedLongs;

/**
 * RESP协议解码器，分两步使用：
 * <ol>
 * <li>{@link #check(ByteBuf)}只扫描不分配内容，判断读位置开始是否已经有一个完整的帧；</li>
 * <li>确认完整以后，从同一个位置调用{@link #parse(ByteBuf)}生成帧。</li>
 * </ol>
 * 两个方法共用同一个扫描过程，所以消费的字节数一定相同。
 * 数据不足时读位置保持不变，调用方可以在读到更多数据后重试。
 */
public final class RespCodec {
    public static final int MAX_BULK_LENGTH   = 512 * 1024 * 1024;
    public static final int MAX_NESTING_DEPTH = 32;

    private static final long       U64_MAX_DIV_10 = UnsignedLongs.divide(-1L, 10);
    private static final long       U64_MAX_MOD_10 = UnsignedLongs.remainder(-1L, 10);
    private static final Incomplete INCOMPLETE     = new Incomplete();

    private RespCodec() {
    }

    /**
     * 检查读位置开始是否有一个完整的帧。
     *
     * @param buf 接收缓冲区，读位置在帧的开头
     * @return true 帧完整，读位置移动到帧之后；false 数据不足，读位置不变
     * @throws RespProtocolException 数据格式错误
     */
    public static boolean check(ByteBuf buf) throws RespProtocolException {
        int start = buf.getReaderIndex();
        try {
            scan(buf, false, 0);
            return true;
        } catch (Incomplete e) {
            buf.readerIndex(start);
            return false;
        }
    }

    /**
     * 解析读位置开始的帧。
     *
     * @param buf 接收缓冲区，读位置在帧的开头
     * @return 解析出的帧，读位置移动到帧之后；数据不足返回null，读位置不变
     * @throws RespProtocolException 数据格式错误
     */
    public static RespData parse(ByteBuf buf) throws RespProtocolException {
        int start = buf.getReaderIndex();
        try {
            return scan(buf, true, 0);
        } catch (Incomplete e) {
            buf.readerIndex(start);
            return null;
        }
    }

    private static RespData scan(ByteBuf buf, boolean materialize, int depth)
            throws Incomplete, RespProtocolException {
        if (!buf.isReadable()) {
            throw INCOMPLETE;
        }

        byte type = buf.readByte();
        switch (type) {
            case RespSimpleString.firstChar: {
                String s = readUtf8Line(buf, materialize);
                return materialize ? RespSimpleString.withUTF8(s) : null;
            }
            case RespError.firstChar: {
                String s = readUtf8Line(buf, materialize);
                return materialize ? RespError.withUTF8(s) : null;
            }
            case RespInteger.firstChar: {
                long n = readUnsigned(buf);
                return materialize ? RespInteger.with(UnsignedLong.fromLongBits(n)) : null;
            }
            case RespBulkString.firstChar:
                return scanBulkString(buf, materialize);
            case RespArray.firstChar:
                return scanArray(buf, materialize, depth);
            default:
                throw new RespProtocolException("unknown frame type byte 0x" + Integer.toHexString(type & 0xff));
        }
    }

    private static RespData scanBulkString(ByteBuf buf, boolean materialize)
            throws Incomplete, RespProtocolException {
        int len = readLength(buf, true, MAX_BULK_LENGTH);
        if (len == -1) {
            return materialize ? RespBulkString.nullBulkString() : null;
        }
        if (buf.readableBytes() < len + 2) {
            throw INCOMPLETE;
        }

        int start = buf.getReaderIndex();
        if (buf.getByte(start + len) != '\r' || buf.getByte(start + len + 1) != '\n') {
            throw new RespProtocolException("bulk string is not terminated by \\r\\n after " + len + " bytes");
        }
        byte[] content = materialize ? buf.getBytes(start, start + len) : null;
        buf.skipBytes(len + 2);
        return materialize ? RespBulkString.wrap(content) : null;
    }

    private static RespData scanArray(ByteBuf buf, boolean materialize, int depth)
            throws Incomplete, RespProtocolException {
        if (depth >= MAX_NESTING_DEPTH) {
            throw new RespProtocolException("arrays nested deeper than " + MAX_NESTING_DEPTH);
        }
        int count = readLength(buf, false, Integer.MAX_VALUE);

        List<RespData> datas = materialize ? new ArrayList<>(Math.min(count, 64)) : null;
        for (int i = 0; i < count; i++) {
            RespData data = scan(buf, materialize, depth + 1);
            if (materialize) {
                datas.add(data);
            }
        }
        return materialize ? RespArray.wrap(datas) : null;
    }

    private static String readUtf8Line(ByteBuf buf, boolean materialize) throws Incomplete, RespProtocolException {
        int start = buf.getReaderIndex();
        int end = lineEnd(buf);
        if (!buf.isUtf8(start, end)) {
            throw new RespProtocolException("line is not valid UTF-8");
        }
        String s = materialize ? new String(buf.getBytes(start, end), StandardCharsets.UTF_8) : null;
        buf.skipBytes(end + 2 - start);
        return s;
    }

    /**
     * 读一行十进制数作为长度，"-1"只在allowNull时合法。
     */
    private static int readLength(ByteBuf buf, boolean allowNull, int max) throws Incomplete, RespProtocolException {
        int start = buf.getReaderIndex();
        int end = lineEnd(buf);
        if (allowNull && end - start == 2 && buf.getByte(start) == '-' && buf.getByte(start + 1) == '1') {
            buf.skipBytes(4);
            return -1;
        }
        long len = readUnsigned(buf);
        if (UnsignedLongs.compare(len, max) > 0) {
            throw new RespProtocolException("length " + UnsignedLongs.toString(len) + " exceeds " + max);
        }
        return (int) len;
    }

    private static long readUnsigned(ByteBuf buf) throws Incomplete, RespProtocolException {
        int start = buf.getReaderIndex();
        int end = lineEnd(buf);
        if (start == end) {
            throw new RespProtocolException("empty decimal line");
        }

        long n = 0;
        for (int i = start; i < end; i++) {
            int digit = buf.getByte(i) - '0';
            if (digit < 0 || digit > 9) {
                throw new RespProtocolException("invalid decimal '" + lineText(buf, start, end) + "'");
            }
            int cmp = UnsignedLongs.compare(n, U64_MAX_DIV_10);
            if (cmp > 0 || (cmp == 0 && digit > U64_MAX_MOD_10)) {
                throw new RespProtocolException("decimal '" + lineText(buf, start, end) + "' overflows 64 bits");
            }
            n = n * 10 + digit;
        }
        buf.skipBytes(end + 2 - start);
        return n;
    }

    private static int lineEnd(ByteBuf buf) throws Incomplete {
        int end = buf.indexOfCRLF(buf.getReaderIndex());
        if (end == -1) {
            throw INCOMPLETE;
        }
        return end;
    }

    private static String lineText(ByteBuf buf, int start, int end) {
        return Ascii.truncate(new String(buf.getBytes(start, end), StandardCharsets.US_ASCII), 32, "...");
    }

    // 数据不足，不是错误。只在本类内部传递，不需要堆栈
    private static final class Incomplete extends Exception {
        private static final long serialVersionUID = 1L;

        Incomplete() {
            super(null, null, false, false);
        }
    }
}
