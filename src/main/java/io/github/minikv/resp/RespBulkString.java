package io.github.minikv.resp;

import java.nio.charset.StandardCharsets;

import com.google.common.primitives.Bytes;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 定长二进制安全字符串。content为null时是null bulk string（"$-1\r\n"）。
 */
@EqualsAndHashCode
@ToString
public class RespBulkString implements RespData {
    public static final char firstChar = '$';

    private static final RespBulkString NULL = new RespBulkString(null);
    private static final byte[]         CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    private final byte[] content;

    public static RespBulkString with(byte[] content) {
        return new RespBulkString(content.clone());
    }

    public static RespBulkString withUTF8(String content) {
        return new RespBulkString(content.getBytes(StandardCharsets.UTF_8));
    }

    public static RespBulkString nullBulkString() {
        return NULL;
    }

    static RespBulkString wrap(byte[] content) {
        return new RespBulkString(content);
    }

    private RespBulkString(byte[] content) {
        this.content = content;
    }

    public boolean isNull() {
        return content == null;
    }

    public int getLength() {
        return content == null ? -1 : content.length;
    }

    /**
     * @return 内容的拷贝，null bulk string返回null
     */
    public byte[] getContent() {
        return content == null ? null : content.clone();
    }

    @Override
    public byte[] toBytes() {
        byte[] header = (firstChar + String.valueOf(getLength()) + "\r\n").getBytes(StandardCharsets.US_ASCII);
        if (content == null) {
            return header;
        }
        return Bytes.concat(header, content, CRLF);
    }
}
