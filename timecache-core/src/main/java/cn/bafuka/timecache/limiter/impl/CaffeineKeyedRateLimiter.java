package cn.bafuka.timecache.limiter.impl;

import cn.bafuka.timecache.config.TimeCacheProperties;
import cn.bafuka.timecache.decay.RateLimiter;
import cn.bafuka.timecache.limiter.KeyedRateLimiter;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;

/**
 * 进程内键级限流器
 * 基于 Caffeine 保存每个键的限流器，长时间未访问的键自动过期
 */
@Slf4j
public class CaffeineKeyedRateLimiter implements KeyedRateLimiter {

    private final TimeCacheProperties.LimiterConfig config;

    /**
     * Key: 限流键
     * Value: 限流器（自身同步，保证同一键串行判定）
     */
    private final Cache<String, RateLimiter> limiters;

    public CaffeineKeyedRateLimiter(TimeCacheProperties.LimiterConfig config) {
        this.config = config;
        log.info("构建进程内限流器，配置: threshold={}, halfLifeSeconds={}, ttlSeconds={}",
                config.getThreshold(), config.getHalfLifeSeconds(), config.getTtlSeconds());
        this.limiters = Caffeine.newBuilder()
                .expireAfterAccess(config.getTtlSeconds(), TimeUnit.SECONDS)
                .maximumSize(100000)
                .build();
    }

    @Override
    public boolean isExceeded(String key, double nowSeconds, double cost) {
        RateLimiter limiter = limiters.get(key, k -> new RateLimiter(config.getThreshold(), config.getHalfLifeSeconds()));
        boolean exceeded = limiter.isExceeded(nowSeconds, cost);
        if (exceeded) {
            log.info("限流触发: key={}, rate={}, threshold={}",
                    key, limiter.currentValue(nowSeconds), config.getThreshold());
        }
        return exceeded;
    }

    @Override
    public double currentRate(String key, double nowSeconds) {
        RateLimiter limiter = limiters.getIfPresent(key);
        return limiter == null ? 0.0 : limiter.currentValue(nowSeconds);
    }
}
