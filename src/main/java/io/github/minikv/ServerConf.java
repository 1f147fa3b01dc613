package io.github.minikv;

import java.net.InetSocketAddress;
import java.util.Properties;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 服务启动配置，来自jvm系统属性：
 * <ul>
 * <li>kv: 监听地址，host:port</li>
 * <li>shards: 存储分片数量</li>
 * <li>threads: 连接处理线程数</li>
 * </ul>
 */
@Builder
@ToString
public class ServerConf {
    static final String KV_PROPERTY      = "kv";
    static final String SHARDS_PROPERTY  = "shards";
    static final String THREADS_PROPERTY = "threads";

    @Builder.Default
    @Getter
    private InetSocketAddress kv = new InetSocketAddress("127.0.0.1", 6379);

    @Builder.Default
    @Getter
    private int shards = 5;

    @Builder.Default
    @Getter
    private int threads = 200;

    public static ServerConf from(Properties props) {
        ServerConfBuilder builder = ServerConf.builder();

        String prop = props.getProperty(KV_PROPERTY);
        if (prop != null) {
            builder.kv(getInetSocketAddress(prop));
        }
        prop = props.getProperty(SHARDS_PROPERTY);
        if (prop != null) {
            builder.shards(positive(SHARDS_PROPERTY, prop));
        }
        prop = props.getProperty(THREADS_PROPERTY);
        if (prop != null) {
            builder.threads(positive(THREADS_PROPERTY, prop));
        }
        return builder.build();
    }

    public static InetSocketAddress getInetSocketAddress(String prop) {
        int i = prop.lastIndexOf(':');
        Preconditions.checkArgument(i > 0 && i < prop.length() - 1, "address must be host:port, got '%s'", prop);
        int port = parseInt(KV_PROPERTY, prop.substring(i + 1));
        Preconditions.checkArgument(port >= 0 && port <= 65535, "port out of range: %s", port);
        return new InetSocketAddress(prop.substring(0, i), port);
    }

    private static int positive(String name, String value) {
        int n = parseInt(name, value);
        Preconditions.checkArgument(n > 0, "%s must be positive, got %s", name, n);
        return n;
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: '" + value + "'", e);
        }
    }
}
