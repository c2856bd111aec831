package cn.bafuka.timecache.autoconfigure;

import cn.bafuka.timecache.config.TimeCacheProperties;
import cn.bafuka.timecache.limiter.KeyedRateLimiter;
import cn.bafuka.timecache.limiter.impl.RedissonKeyedRateLimiter;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 键级限流器（存在 RedissonClient 时生效）
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnClass(RedissonClient.class)
@ConditionalOnBean(RedissonClient.class)
class RedissonLimiterConfiguration {

    @Bean
    @ConditionalOnMissingBean(KeyedRateLimiter.class)
    public RedissonKeyedRateLimiter redissonKeyedRateLimiter(RedissonClient redissonClient,
                                                             TimeCacheProperties properties) {
        return new RedissonKeyedRateLimiter(redissonClient, properties.getLimiter());
    }
}
