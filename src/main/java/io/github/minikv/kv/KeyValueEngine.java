package io.github.minikv.kv;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

import com.google.common.base.CharMatcher;
import com.google.common.base.Utf8;
import io.github.minikv.resp.RespArray;
import io.github.minikv.resp.RespBulkString;
import io.github.minikv.resp.RespData;
import io.github.minikv.resp.RespError;
import io.github.minikv.resp.RespSimpleString;
import lombok.NonNull;

/**
 * 把GET/SET请求映射成{@link Store}操作，再把结果映射成响应帧。
 * 请求是由bulk string组成的数组，命令名不区分大小写。
 * 响应总是标量帧，不会返回数组。
 */
public class KeyValueEngine {
    private static final String SET_CMD = "SET";
    private static final String GET_CMD = "GET";

    private static final RespSimpleString OK              = RespSimpleString.withUTF8("OK");
    private static final RespError        INVALID_REQUEST = RespError.withUTF8("ERR invalid request");
    private static final RespError        INVALID_KEY     = RespError.withUTF8("ERR key is not valid UTF-8");
    private static final CharMatcher      LINE_BREAKS     = CharMatcher.anyOf("\r\n");

    private final Store store;

    public KeyValueEngine(@NonNull Store store) {
        this.store = store;
    }

    public RespData execute(@NonNull RespData request) {
        if (!(request instanceof RespArray)) {
            return INVALID_REQUEST;
        }
        RespArray array = (RespArray) request;
        if (array.size() == 0) {
            return INVALID_REQUEST;
        }
        for (RespData arg : array.getDatas()) {
            if (!(arg instanceof RespBulkString) || ((RespBulkString) arg).isNull()) {
                return INVALID_REQUEST;
            }
        }

        String name = new String(arg(array, 0), StandardCharsets.UTF_8);
        switch (name.toUpperCase(Locale.ROOT)) {
            case SET_CMD:
                if (array.size() != 3) {
                    return wrongArity(name);
                }
                return set(arg(array, 1), arg(array, 2));
            case GET_CMD:
                if (array.size() != 2) {
                    return wrongArity(name);
                }
                return get(arg(array, 1));
            default:
                return RespError.withUTF8("ERR unknown command '" + LINE_BREAKS.replaceFrom(name, ' ') + "'");
        }
    }

    private RespData set(byte[] key, byte[] value) {
        if (!Utf8.isWellFormed(key)) {
            return INVALID_KEY;
        }
        store.insert(new String(key, StandardCharsets.UTF_8), value);
        return OK;
    }

    private RespData get(byte[] key) {
        if (!Utf8.isWellFormed(key)) {
            return INVALID_KEY;
        }
        Optional<byte[]> value = store.get(new String(key, StandardCharsets.UTF_8));
        return value.map(RespBulkString::with).orElse(RespBulkString.nullBulkString());
    }

    private static byte[] arg(RespArray array, int i) {
        return ((RespBulkString) array.get(i)).getContent();
    }

    private static RespError wrongArity(String name) {
        return RespError.withUTF8("ERR wrong number of arguments for '"
                + LINE_BREAKS.replaceFrom(name.toLowerCase(Locale.ROOT), ' ') + "' command");
    }
}
