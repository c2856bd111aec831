package cn.bafuka.timecache.limiter.impl;

import cn.bafuka.timecache.config.TimeCacheProperties;
import cn.bafuka.timecache.decay.RateLimiter;
import cn.bafuka.timecache.limiter.KeyedRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import java.util.concurrent.TimeUnit;

/**
 * 分布式键级限流器
 * 限流器状态保存在 Redis 中，读-改-写在 Redisson 分布式锁内完成，
 * 多个实例不会同时通过最后一份额度
 */
@Slf4j
public class RedissonKeyedRateLimiter implements KeyedRateLimiter {

    /**
     * Redisson 客户端
     */
    private final RedissonClient redissonClient;

    private final TimeCacheProperties.LimiterConfig config;

    public RedissonKeyedRateLimiter(RedissonClient redissonClient, TimeCacheProperties.LimiterConfig config) {
        this.redissonClient = redissonClient;
        this.config = config;
    }

    @Override
    public boolean isExceeded(String key, double nowSeconds, double cost) {
        String bucketKey = getBucketKey(key);
        RLock lock = redissonClient.getLock(getLockKey(key));

        try {
            boolean locked = lock.tryLock(config.getLockWaitTimeMs(), config.getLockLeaseTimeMs(), TimeUnit.MILLISECONDS);
            if (!locked) {
                // 拿不到锁时按超限处理
                log.warn("限流器获取锁超时，按超限处理: key={}", key);
                return true;
            }

            try {
                RBucket<RateLimiter> bucket = redissonClient.getBucket(bucketKey);
                RateLimiter limiter = bucket.get();
                if (limiter == null) {
                    limiter = new RateLimiter(config.getThreshold(), config.getHalfLifeSeconds());
                }

                boolean exceeded = limiter.isExceeded(nowSeconds, cost);
                if (exceeded) {
                    log.info("限流触发: key={}, rate={}, threshold={}",
                            key, limiter.currentValue(nowSeconds), config.getThreshold());
                } else {
                    bucket.set(limiter, config.getTtlSeconds(), TimeUnit.SECONDS);
                }
                return exceeded;

            } finally {
                lock.unlock();
            }

        } catch (InterruptedException e) {
            log.error("限流判定被中断: key={}", key, e);
            Thread.currentThread().interrupt();
            return true;

        } catch (Exception e) {
            log.error("限流判定异常，按超限处理: key={}", key, e);
            return true;
        }
    }

    @Override
    public double currentRate(String key, double nowSeconds) {
        try {
            RBucket<RateLimiter> bucket = redissonClient.getBucket(getBucketKey(key));
            RateLimiter limiter = bucket.get();
            return limiter == null ? 0.0 : limiter.currentValue(nowSeconds);
        } catch (Exception e) {
            log.error("读取限流器失败: key={}", key, e);
            return 0.0;
        }
    }

    public String getBucketKey(String key) {
        return config.getKeyPrefix() + key;
    }

    /**
     * 获取分布式锁的键
     *
     * @param key 限流键
     * @return 锁键
     */
    private String getLockKey(String key) {
        return "lock:" + getBucketKey(key);
    }
}
