package io.github.minikv.resp;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.util.Arrays;

import com.google.common.base.Preconditions;
import com.google.common.base.Utf8;
import lombok.Getter;

/**
 * 连接的接收缓冲区，同时作为{@link RespCodec}扫描帧时使用的游标。
 * 读写位置是独立的，不用考虑flip和rewind：数据追加在writerIndex之后，
 * 一个帧被完整消费以后，用{@link #discardReadBytes()}丢弃头部已读数据。
 */
public class ByteBuf {
    // 底层字节数组
    private byte[] buf;
    // 当前读位置
    @Getter
    private int    readerIndex;
    // 当前写位置
    @Getter
    private int    writerIndex;

    private ByteBuf(int i) {
        buf = new byte[i];
        readerIndex = 0;
        writerIndex = 0;
    }

    public static ByteBuf allocate(int i) {
        Preconditions.checkArgument(i > 0, "capacity must be positive: %s", i);
        return new ByteBuf(i);
    }

    public static ByteBuf wrap(byte[] bytes) {
        return allocate(Math.max(bytes.length, 1)).writeBytes(bytes);
    }

    /**
     * @return 当前还可以写入的大小
     */
    public int writableBytes() {
        return buf.length - writerIndex;
    }

    /**
     * 向buf写入数据
     * @param bytes 数据源
     * @return 本对象
     */
    public ByteBuf writeBytes(byte[] bytes) {
        ensureWritable(bytes.length);
        System.arraycopy(bytes, 0, buf, writerIndex, bytes.length);
        writerIndex += bytes.length;
        return this;
    }

    /**
     * 从channel读一次数据追加到尾部，至少预留minWritable字节的空间。
     * @param channel 数据源
     * @param minWritable 本次读取前保证的可写空间
     * @return channel返回的读取字节数，-1表示channel已经到达末尾
     * @throws IOException 读取失败
     */
    public int writeBytes(ReadableByteChannel channel, int minWritable) throws IOException {
        ensureWritable(minWritable);
        ByteBuffer bb = ByteBuffer.wrap(buf, writerIndex, writableBytes());
        int n = channel.read(bb);
        if (n > 0) {
            writerIndex += n;
        }
        return n;
    }

    /**
     * 是否有数据未消费，可读取
     * @return true 有，false 没有
     */
    public boolean isReadable() {
        return readerIndex < writerIndex;
    }

    /**
     * 读一个字节
     * @return 字节
     * @throws IllegalStateException 没有可读数据
     */
    public byte readByte() {
        Preconditions.checkState(readerIndex < writerIndex);
        return buf[readerIndex++];
    }

    /**
     * 查询多少数据可读
     * @return 可读取数据的大小
     */
    public int readableBytes() {
        return writerIndex - readerIndex;
    }

    /**
     * 跳过n个可读字节
     * @param n 字节数
     * @return 本对象
     */
    public ByteBuf skipBytes(int n) {
        if (n < 0 || n > readableBytes()) {
            throw new IndexOutOfBoundsException("skip " + n + ", readable " + readableBytes());
        }
        readerIndex += n;
        return this;
    }

    public ByteBuf readerIndex(int index) {
        Preconditions.checkPositionIndex(index, writerIndex);
        readerIndex = index;
        return this;
    }

    /**
     * 使用绝对索引读取字节
     * @param index 索引
     * @return 字节值
     * @throws IndexOutOfBoundsException 索引越界
     */
    public byte getByte(int index) {
        Preconditions.checkElementIndex(index, writerIndex);
        return buf[index];
    }

    /**
     * 复制[from, to)之间的数据
     */
    public byte[] getBytes(int from, int to) {
        Preconditions.checkPositionIndexes(from, to, writerIndex);
        return Arrays.copyOfRange(buf, from, to);
    }

    /**
     * 从fromIndex开始查找第一个"\r\n"
     * @return "\r"的索引，没有找到返回-1
     */
    public int indexOfCRLF(int fromIndex) {
        for (int i = fromIndex; i + 1 < writerIndex; i++) {
            if (buf[i] == '\r' && buf[i + 1] == '\n') {
                return i;
            }
        }
        return -1;
    }

    /**
     * [from, to)之间的数据是否是合法的UTF-8编码，不分配内存
     */
    public boolean isUtf8(int from, int to) {
        Preconditions.checkPositionIndexes(from, to, writerIndex);
        return Utf8.isWellFormed(buf, from, to - from);
    }

    /**
     * 丢弃已经读过的数据，未读数据移动到数组头部
     * @return 本对象
     */
    public ByteBuf discardReadBytes() {
        if (readerIndex == 0) {
            return this;
        }
        int readable = readableBytes();
        System.arraycopy(buf, readerIndex, buf, 0, readable);
        writerIndex = readable;
        readerIndex = 0;
        return this;
    }

    private void ensureWritable(int remaining) {
        if (writableBytes() < remaining) {
            capacity(buf.length * 2 + remaining);
        }
    }

    private void capacity(int i) {
        Preconditions.checkState(i > buf.length);
        buf = Arrays.copyOf(buf, i);
    }

}
