package io.github.minikv;

import java.net.InetSocketAddress;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfTest {

    @Test
    void defaults() {
        ServerConf conf = ServerConf.from(new Properties());
        assertEquals(new InetSocketAddress("127.0.0.1", 6379), conf.getKv());
        assertEquals(5, conf.getShards());
        assertEquals(200, conf.getThreads());
    }

    @Test
    void fromProperties() {
        Properties props = new Properties();
        props.setProperty(ServerConf.KV_PROPERTY, "0.0.0.0:7000");
        props.setProperty(ServerConf.SHARDS_PROPERTY, "16");
        props.setProperty(ServerConf.THREADS_PROPERTY, " 8 ");

        ServerConf conf = ServerConf.from(props);
        assertEquals(new InetSocketAddress("0.0.0.0", 7000), conf.getKv());
        assertEquals(16, conf.getShards());
        assertEquals(8, conf.getThreads());
    }

    @Test
    void invalidProperties() {
        Properties props = new Properties();
        props.setProperty(ServerConf.SHARDS_PROPERTY, "0");
        assertThrows(IllegalArgumentException.class, () -> ServerConf.from(props));

        props.setProperty(ServerConf.SHARDS_PROPERTY, "many");
        assertThrows(IllegalArgumentException.class, () -> ServerConf.from(props));

        props.remove(ServerConf.SHARDS_PROPERTY);
        props.setProperty(ServerConf.THREADS_PROPERTY, "-1");
        assertThrows(IllegalArgumentException.class, () -> ServerConf.from(props));
    }

    @Test
    void getInetSocketAddress() {
        assertEquals(new InetSocketAddress("localhost", 6379), ServerConf.getInetSocketAddress("localhost:6379"));
        assertEquals(0, ServerConf.getInetSocketAddress("127.0.0.1:0").getPort());
        assertThrows(IllegalArgumentException.class, () -> ServerConf.getInetSocketAddress("localhost"));
        assertThrows(IllegalArgumentException.class, () -> ServerConf.getInetSocketAddress(":6379"));
        assertThrows(IllegalArgumentException.class, () -> ServerConf.getInetSocketAddress("localhost:"));
        assertThrows(IllegalArgumentException.class, () -> ServerConf.getInetSocketAddress("localhost:65536"));
        assertThrows(IllegalArgumentException.class, () -> ServerConf.getInetSocketAddress("localhost:port"));
    }
}
