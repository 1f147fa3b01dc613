package io.github.minikv.resp;

import java.nio.charset.StandardCharsets;

import com.google.common.primitives.UnsignedLong;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * 无符号64位整数帧，不能表示负数。
 */
@EqualsAndHashCode
@ToString
public class RespInteger implements RespData {
    public static final char firstChar = ':';
    @Getter
    private final UnsignedLong n;

    /**
     * @param i 非负整数
     * @throws IllegalArgumentException i为负数
     */
    public static RespInteger with(long i) {
        return new RespInteger(UnsignedLong.valueOf(i));
    }

    public static RespInteger with(@NonNull UnsignedLong n) {
        return new RespInteger(n);
    }

    private RespInteger(UnsignedLong n) {
        this.n = n;
    }

    @Override
    public byte[] toBytes() {
        return (firstChar + n.toString() + "\r\n").getBytes(StandardCharsets.US_ASCII);
    }
}
