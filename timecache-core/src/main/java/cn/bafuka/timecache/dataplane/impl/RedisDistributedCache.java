package cn.bafuka.timecache.dataplane.impl;

import cn.bafuka.timecache.dataplane.DistributedCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.util.concurrent.TimeUnit;

/**
 * 分布式缓存实现
 * 基于 Spring Data Redis，读写异常只记录日志，按未命中处理
 */
@Slf4j
public class RedisDistributedCache implements DistributedCache {

    /**
     * Redis 模板
     */
    private final RedisTemplate<String, Object> redisTemplate;

    /**
     * Redis 键前缀
     */
    private final String keyPrefix;

    public RedisDistributedCache(RedisTemplate<String, Object> redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    @Override
    public Object get(String key) {
        if (key == null) {
            return null;
        }

        try {
            Object value = redisTemplate.opsForValue().get(getRedisKey(key));
            log.debug("Redis 读取: key={}, hit={}", key, value != null);
            return value;
        } catch (Exception e) {
            // 反序列化失败（例如旧版本写入的数据）同样按未命中处理
            log.error("从 Redis 获取数据失败: key={}", key, e);
            return null;
        }
    }

    @Override
    public void set(String key, Object value, long ttlSeconds) {
        if (key == null || value == null) {
            return;
        }

        try {
            String redisKey = getRedisKey(key);
            if (ttlSeconds > 0) {
                redisTemplate.opsForValue().set(redisKey, value, ttlSeconds, TimeUnit.SECONDS);
            } else {
                redisTemplate.opsForValue().set(redisKey, value);
            }
            log.debug("Redis 写入: key={}, ttl={}s", key, ttlSeconds);
        } catch (Exception e) {
            log.error("写入 Redis 失败: key={}", key, e);
        }
    }

    @Override
    public void delete(String key) {
        if (key == null) {
            return;
        }

        try {
            redisTemplate.delete(getRedisKey(key));
            log.debug("Redis 删除: key={}", key);
        } catch (Exception e) {
            log.error("从 Redis 删除失败: key={}", key, e);
        }
    }

    /**
     * 获取 Redis 键名
     *
     * @param key 缓存键
     * @return Redis 键
     */
    public String getRedisKey(String key) {
        return keyPrefix + key;
    }
}
