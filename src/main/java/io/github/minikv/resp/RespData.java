package io.github.minikv.resp;

import java.nio.ByteBuffer;

/**
 * 一个完整的RESP帧。帧构造以后不可变。
 */
public interface RespData {

    byte[] toBytes();

    default ByteBuffer toByteBuffer() {
        return ByteBuffer.wrap(toBytes());
    }
}
