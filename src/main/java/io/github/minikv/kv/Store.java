package io.github.minikv.kv;

import java.util.Optional;

/**
 * 内存kv存储，所有连接共享同一个实例。
 */
public interface Store {
    /**
     * 插入或覆盖，后写入的值生效
     */
    void insert(String key, byte[] value);

    /**
     * @return 值的拷贝，key不存在返回empty
     */
    Optional<byte[]> get(String key);

    int size();
}
