package io.github.minikv.kv;

import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.util.Optional;

import io.github.minikv.resp.Connection;
import io.github.minikv.resp.PeerDisconnectedException;
import io.github.minikv.resp.RespData;
import io.github.minikv.resp.RespError;
import io.github.minikv.resp.RespProtocolException;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 处理一个客户连接：按到达顺序读请求、执行、写响应，直到连接结束或出错。
 * 出错只关闭本连接，不影响其他连接和存储。
 */
class ClientHandler implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ClientHandler.class);

    private final Connection     connection;
    private final String         peer;
    private final KeyValueEngine engine;

    ClientHandler(@NonNull Connection connection, String peer, @NonNull KeyValueEngine engine) {
        this.connection = connection;
        this.peer = peer;
        this.engine = engine;
    }

    @Override
    public void run() {
        logger.debug("client {} connected.", peer);
        try {
            Optional<RespData> request = connection.readFrame();
            while (request.isPresent()) {
                connection.writeFrame(engine.execute(request.get()));
                request = connection.readFrame();
            }
            logger.debug("client {} closed connection.", peer);
        } catch (RespProtocolException e) {
            logger.warn("client {} sent malformed data, closing: {}", peer, e.getMessage());
            reply(RespError.withUTF8("ERR " + e.getMessage()));
        } catch (PeerDisconnectedException e) {
            logger.warn("client {} disconnected abruptly: {}", peer, e.getMessage());
        } catch (ClosedChannelException e) {
            logger.debug("client {} channel closed.", peer);
        } catch (IOException e) {
            logger.error("client {} connection failed.", peer, e);
        } catch (RuntimeException e) {
            logger.error("client {} handler failed.", peer, e);
        } finally {
            close();
        }
    }

    private void reply(RespData data) {
        try {
            connection.writeFrame(data);
        } catch (IOException e) {
            logger.debug("client {} error reply not delivered.", peer, e);
        }
    }

    void close() {
        try {
            connection.close();
        } catch (IOException e) {
            logger.error("client {} close failed.", peer, e);
        }
    }
}
