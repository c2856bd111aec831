package cn.bafuka.timecache.dataplane.impl;

import cn.bafuka.timecache.dataplane.DistributedCache;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.SerializationUtils;

import java.util.concurrent.TimeUnit;

/**
 * 进程内分布式缓存实现
 * 基于 Caffeine，用于单实例部署和测试
 *
 * 值以序列化副本保存，每次读取得到新的实例，与 Redis 的语义一致：
 * 不同会话之间不会共享同一个可变对象
 */
@Slf4j
public class CaffeineDistributedCache implements DistributedCache {

    /**
     * 默认最大容量
     */
    public static final long DEFAULT_MAXIMUM_SIZE = 100000;

    private final Cache<String, StoredValue> cache;

    public CaffeineDistributedCache() {
        this(DEFAULT_MAXIMUM_SIZE, Ticker.systemTicker());
    }

    public CaffeineDistributedCache(long maximumSize, Ticker ticker) {
        log.info("构建进程内共享缓存，配置: maximumSize={}", maximumSize);
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .recordStats()
                .build();
    }

    @Override
    public Object get(String key) {
        if (key == null) {
            return null;
        }

        StoredValue stored = cache.getIfPresent(key);
        if (stored == null) {
            log.debug("共享缓存未命中: key={}", key);
            return null;
        }

        try {
            return SerializationUtils.deserialize(stored.bytes);
        } catch (RuntimeException e) {
            log.warn("共享缓存数据无法解析，按未命中处理: key={}", key, e);
            return null;
        }
    }

    @Override
    public void set(String key, Object value, long ttlSeconds) {
        if (key == null || value == null) {
            return;
        }

        try {
            cache.put(key, new StoredValue(SerializationUtils.serialize(value), ttlSeconds));
            log.debug("共享缓存写入: key={}, ttl={}s", key, ttlSeconds);
        } catch (RuntimeException e) {
            log.error("共享缓存写入失败: key={}", key, e);
        }
    }

    @Override
    public void delete(String key) {
        if (key == null) {
            return;
        }
        cache.invalidate(key);
        log.debug("共享缓存删除: key={}", key);
    }

    /**
     * 直接写入原始字节（用于模拟其他版本写入的数据）
     *
     * @param key   缓存键
     * @param bytes 原始字节
     */
    void putRaw(String key, byte[] bytes) {
        cache.put(key, new StoredValue(bytes, 0));
    }

    public String getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return String.format(
                "Shared Cache Stats: hitRate=%.2f%%, hitCount=%d, missCount=%d, evictionCount=%d",
                stats.hitRate() * 100,
                stats.hitCount(),
                stats.missCount(),
                stats.evictionCount()
        );
    }

    private static final class StoredValue {
        private final byte[] bytes;
        private final long ttlSeconds;

        private StoredValue(byte[] bytes, long ttlSeconds) {
            this.bytes = bytes;
            this.ttlSeconds = ttlSeconds;
        }
    }

    /**
     * 按条目 TTL 过期，TTL 小于等于 0 表示不过期
     */
    private static final class PerEntryExpiry implements Expiry<String, StoredValue> {

        @Override
        public long expireAfterCreate(String key, StoredValue value, long currentTime) {
            return value.ttlSeconds > 0 ? TimeUnit.SECONDS.toNanos(value.ttlSeconds) : Long.MAX_VALUE;
        }

        @Override
        public long expireAfterUpdate(String key, StoredValue value, long currentTime, long currentDuration) {
            return expireAfterCreate(key, value, currentTime);
        }

        @Override
        public long expireAfterRead(String key, StoredValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
