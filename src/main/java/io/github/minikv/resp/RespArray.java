package io.github.minikv.resp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;

/**
 * 数组帧，只用于解码请求。响应总是标量，所以数组不支持编码。
 */
@EqualsAndHashCode
@ToString
public class RespArray implements RespData {
    public static final char firstChar = '*';

    private final List<RespData> datas;

    public static RespArray empty() {
        return new RespArray(Collections.emptyList());
    }

    public static RespArray with(@NonNull List<? extends RespData> datas) {
        return new RespArray(Collections.unmodifiableList(new ArrayList<>(datas)));
    }

    public static RespArray with(RespData... datas) {
        return with(List.of(datas));
    }

    static RespArray wrap(List<RespData> datas) {
        return new RespArray(Collections.unmodifiableList(datas));
    }

    private RespArray(List<RespData> datas) {
        this.datas = datas;
    }

    public int size() {
        return datas.size();
    }

    public RespData get(int i) {
        return datas.get(i);
    }

    public List<RespData> getDatas() {
        return datas;
    }

    /**
     * @throws UnsupportedOperationException 数组不能编码
     */
    @Override
    public byte[] toBytes() {
        throw new UnsupportedOperationException("array frames are decode-only");
    }
}
