package io.github.minikv.resp;

import java.io.IOException;

/**
 * 收到的数据永远不可能组成合法的RESP帧，连接应该被关闭。
 */
public class RespProtocolException extends IOException {
    private static final long serialVersionUID = -3712953020135488721L;

    public RespProtocolException(String message) {
        super("protocol error; " + message);
    }
}
