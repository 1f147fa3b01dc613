package io.github.minikv.resp;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RespSimpleString extends RespString {
    public static final char firstChar = '+';

    public static RespSimpleString withUTF8(String content) {
        return new RespSimpleString(content);
    }

    private RespSimpleString(String content) {
        super(content);
    }

    @Override
    char getFirstChar() {
        return firstChar;
    }
}
