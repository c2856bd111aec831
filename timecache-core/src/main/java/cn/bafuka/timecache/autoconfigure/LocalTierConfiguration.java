package cn.bafuka.timecache.autoconfigure;

import cn.bafuka.timecache.config.TimeCacheProperties;
import cn.bafuka.timecache.dataplane.DistributedCache;
import cn.bafuka.timecache.dataplane.impl.CaffeineDistributedCache;
import cn.bafuka.timecache.limiter.KeyedRateLimiter;
import cn.bafuka.timecache.limiter.impl.CaffeineKeyedRateLimiter;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 进程内后备实现（未配置 Redis / Redisson 时生效）
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
class LocalTierConfiguration {

    @Bean
    @ConditionalOnMissingBean(DistributedCache.class)
    public CaffeineDistributedCache caffeineDistributedCache(TimeCacheProperties properties) {
        log.warn("未配置 Redis，使用进程内共享缓存，多实例部署时各实例缓存互不可见");
        return new CaffeineDistributedCache(properties.getDistributed().getMaximumSize(), Ticker.systemTicker());
    }

    @Bean
    @ConditionalOnMissingBean(KeyedRateLimiter.class)
    public CaffeineKeyedRateLimiter caffeineKeyedRateLimiter(TimeCacheProperties properties) {
        return new CaffeineKeyedRateLimiter(properties.getLimiter());
    }
}
