package io.github.minikv;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import io.github.minikv.kv.KeyValueEngine;
import io.github.minikv.kv.KeyValueServer;
import io.github.minikv.kv.ShardedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Application {
    private static final Logger logger = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) throws Exception {
        ServerConf conf = ServerConf.from(System.getProperties());
        logger.info("starting with {}", conf);

        ShardedStore store = ShardedStore.create(conf.getShards());
        KeyValueEngine engine = new KeyValueEngine(store);
        ExecutorService executorService = Executors.newFixedThreadPool(conf.getThreads());

        KeyValueServer server = KeyValueServer.builder()
                .socketAddress(conf.getKv())
                .keyValueEngine(engine)
                .executorService(executorService)
                .build();
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("服务进程退出.");
            try {
                server.shutdown();
            } catch (IOException e) {
                logger.error("kv server shutdown failed.", e);
            }
        }));
    }
}
