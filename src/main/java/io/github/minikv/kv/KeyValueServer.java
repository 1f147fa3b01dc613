package io.github.minikv.kv;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import io.github.minikv.resp.Connection;
import lombok.Builder;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 使用阻塞的ServerSocketChannel监听指定端口，每个连接交给线程池中的一个{@link ClientHandler}处理。
 * 所有连接共享同一个{@link KeyValueEngine}和它背后的存储。
 */
public class KeyValueServer implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(KeyValueServer.class);

    enum Status {
        init,
        started,
        stopped
    }

    private volatile Status status = Status.init;

    // 服务地址，端口为0时由系统分配
    private final    InetSocketAddress   socketAddress;
    private final    KeyValueEngine      engine;
    // 连接处理线程池
    private final    ExecutorService     executorService;
    private volatile ServerSocketChannel ssc;
    private          Thread              acceptorThread;

    @Builder
    public KeyValueServer(@NonNull InetSocketAddress socketAddress,
                          @NonNull KeyValueEngine keyValueEngine,
                          @NonNull ExecutorService executorService) {
        this.socketAddress = socketAddress;
        this.engine = keyValueEngine;
        this.executorService = executorService;
    }

    /**
     * 启动服务
     *
     * @throws IOException 绑定端口失败
     */
    public synchronized void start() throws IOException {
        if (status != Status.init) {
            throw new IllegalStateException("kv server is " + status);
        }

        ssc = ServerSocketChannel.open();
        ssc.setOption(StandardSocketOptions.SO_REUSEADDR, true);
        ssc.bind(socketAddress);
        ssc.configureBlocking(true);

        status = Status.started;
        acceptorThread = new Thread(this, "kv-acceptor");
        acceptorThread.start();
        logger.info("kv server started at {}.", getLocalAddress());
    }

    /**
     * @return 实际绑定的地址
     */
    public InetSocketAddress getLocalAddress() throws IOException {
        if (ssc == null) {
            throw new IllegalStateException("kv server is not started");
        }
        return (InetSocketAddress) ssc.getLocalAddress();
    }

    /**
     * 关闭服务，正在处理的连接会被中断
     *
     * @throws IOException 关闭异常
     */
    public synchronized void shutdown() throws IOException {
        if (status != Status.started) {
            return;
        }
        status = Status.stopped;
        ssc.close();
        // 排队中还没开始执行的连接不会再被处理，直接关闭
        for (Runnable pending : executorService.shutdownNow()) {
            if (pending instanceof ClientHandler) {
                ((ClientHandler) pending).close();
            }
        }
        logger.info("kv server stopped.");
    }

    @Override
    public void run() {
        while (status == Status.started) {
            SocketChannel channel;
            try {
                channel = ssc.accept();
            } catch (ClosedChannelException e) {
                if (status != Status.stopped) {
                    logger.error("kv server channel closed unexpectedly.", e);
                }
                return;
            } catch (IOException e) {
                logger.error("kv server accept failed.", e);
                continue;
            }

            String peer = String.valueOf(channel.socket().getRemoteSocketAddress());
            try {
                executorService.execute(new ClientHandler(new Connection(channel), peer, engine));
            } catch (RejectedExecutionException e) {
                logger.warn("kv server rejected client {}.", peer);
                try {
                    channel.close();
                } catch (IOException ex) {
                    logger.error("close rejected client {} failed.", peer, ex);
                }
            }
        }
    }
}
