package io.github.minikv.resp;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ByteChannel;
import java.util.Optional;

import com.google.common.base.Preconditions;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;

/**
 * 一个客户连接：独占一个channel和一个接收缓冲区，按顺序读写RESP帧。
 * 同一时刻只能被一个线程使用，内部不加锁。
 */
public class Connection implements Closeable {
    static final int READ_SIZE = 4096;

    private final ByteChannel channel;
    @Getter(AccessLevel.PACKAGE)
    private final ByteBuf     buffer;

    public Connection(@NonNull ByteChannel channel) {
        this(channel, READ_SIZE);
    }

    Connection(@NonNull ByteChannel channel, int initialCapacity) {
        this.channel = channel;
        this.buffer = ByteBuf.allocate(initialCapacity);
    }

    /**
     * 读下一个帧，数据不足时阻塞读取channel。
     *
     * @return 帧；对端在帧边界上正常关闭时返回empty
     * @throws RespProtocolException 数据格式错误，不会重试
     * @throws PeerDisconnectedException 对端在帧传输到一半时关闭
     * @throws IOException channel读取失败
     */
    public Optional<RespData> readFrame() throws IOException {
        for (; ; ) {
            RespData frame = parseFrame();
            if (frame != null) {
                return Optional.of(frame);
            }

            // 已读数据只在读channel之前丢弃
            buffer.discardReadBytes();
            if (buffer.writeBytes(channel, READ_SIZE) == -1) {
                if (buffer.isReadable()) {
                    throw new PeerDisconnectedException(buffer.readableBytes());
                }
                return Optional.empty();
            }
        }
    }

    private RespData parseFrame() throws RespProtocolException {
        int start = buffer.getReaderIndex();
        if (!RespCodec.check(buffer)) {
            return null;
        }

        int end = buffer.getReaderIndex();
        buffer.readerIndex(start);
        RespData frame = RespCodec.parse(buffer);
        Preconditions.checkState(frame != null && buffer.getReaderIndex() == end,
                "check and parse disagree on frame boundary");
        return frame;
    }

    /**
     * 编码并写出一个帧，写完所有字节才返回。
     *
     * @throws IllegalArgumentException 数组帧不能编码
     * @throws IOException channel写失败
     */
    public void writeFrame(@NonNull RespData frame) throws IOException {
        Preconditions.checkArgument(!(frame instanceof RespArray), "array frames cannot be written");
        ByteBuffer bb = frame.toByteBuffer();
        while (bb.hasRemaining()) {
            channel.write(bb);
        }
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
