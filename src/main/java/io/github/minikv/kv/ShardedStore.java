package io.github.minikv.kv;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;

/**
 * <p>
 * 分片的内存kv存储。key按hash(key) mod N固定属于一个分片，分片数量构造以后不再变化。
 * 每个分片有独立的锁，不同分片上的读写可以完全并行，同一分片上的读写串行执行。
 * </p>
 * <p>
 * 锁只在一次map操作期间持有，不会跨越网络读写，所以连接任务中途退出不会破坏存储。
 * 值在写入和读出时都会拷贝，调用方拿不到内部数组的引用。
 * </p>
 */
public class ShardedStore implements Store {
    private static final HashFunction HASH = Hashing.murmur3_32_fixed();

    private final List<Shard> shards;

    public static ShardedStore create(int shardCount) {
        Preconditions.checkArgument(shardCount > 0, "shard count must be positive: %s", shardCount);
        return new ShardedStore(shardCount);
    }

    private ShardedStore(int shardCount) {
        List<Shard> list = new ArrayList<>(shardCount);
        for (int i = 0; i < shardCount; i++) {
            list.add(new Shard());
        }
        this.shards = Collections.unmodifiableList(list);
    }

    @Override
    public void insert(@NonNull String key, @NonNull byte[] value) {
        shardFor(key).put(key, value.clone());
    }

    @Override
    public Optional<byte[]> get(@NonNull String key) {
        return Optional.ofNullable(shardFor(key).get(key));
    }

    /**
     * 依次获取每个分片的锁计数，不是一致性快照。
     */
    @Override
    public int size() {
        int size = 0;
        for (Shard shard : shards) {
            size += shard.size();
        }
        return size;
    }

    int shardIndex(String key) {
        return Math.floorMod(HASH.hashString(key, StandardCharsets.UTF_8).asInt(), shards.size());
    }

    Shard shardFor(String key) {
        return shards.get(shardIndex(key));
    }

    static class Shard {
        @Getter(AccessLevel.PACKAGE)
        private final ReentrantLock       lock    = new ReentrantLock();
        private final Map<String, byte[]> entries = new HashMap<>();

        void put(String key, byte[] value) {
            lock.lock();
            try {
                entries.put(key, value);
            } finally {
                lock.unlock();
            }
        }

        byte[] get(String key) {
            lock.lock();
            try {
                byte[] value = entries.get(key);
                return value == null ? null : value.clone();
            } finally {
                lock.unlock();
            }
        }

        int size() {
            lock.lock();
            try {
                return entries.size();
            } finally {
                lock.unlock();
            }
        }
    }
}
