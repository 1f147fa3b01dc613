package io.github.minikv.resp;

import java.io.IOException;

/**
 * 对端在一个帧传输到一半时关闭了连接。与正常的流结束区分开。
 */
public class PeerDisconnectedException extends IOException {
    private static final long serialVersionUID = 5471193862080734135L;

    public PeerDisconnectedException(int pending) {
        super("connection reset by peer, " + pending + " bytes of an incomplete frame pending");
    }
}
