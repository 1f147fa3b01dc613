package io.github.minikv.resp;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RespError extends RespString {
    public static final char firstChar = '-';

    public static RespError withUTF8(String msg) {
        return new RespError(msg);
    }

    private RespError(String content) {
        super(content);
    }

    @Override
    char getFirstChar() {
        return firstChar;
    }
}
