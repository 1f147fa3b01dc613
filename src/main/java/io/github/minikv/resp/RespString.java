package io.github.minikv.resp;

import java.nio.charset.StandardCharsets;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * 单行字符串类型的帧：simple string和error。
 */
@EqualsAndHashCode
@ToString
abstract class RespString implements RespData {
    @Getter
    private final String content;

    RespString(@NonNull String content) {
        Preconditions.checkArgument(!content.contains("\r\n"), "resp single line string cannot contain \\r\\n");
        this.content = content;
    }

    abstract char getFirstChar();

    @Override
    public byte[] toBytes() {
        return (getFirstChar() + content + "\r\n").getBytes(StandardCharsets.UTF_8);
    }
}
