package cn.bafuka.timecache.autoconfigure;

import cn.bafuka.timecache.config.TimeCacheProperties;
import cn.bafuka.timecache.core.UserActionLedger;
import cn.bafuka.timecache.dataplane.DistributedCache;
import cn.bafuka.timecache.dataplane.impl.DistributedUserActionLedger;
import cn.bafuka.timecache.score.ScoreEngine;
import cn.bafuka.timecache.tier.TierCacheManagerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * TimeCache 自动配置类
 * 分布式缓存优先使用 Redis，键级限流器优先使用 Redisson，缺失时退回 Caffeine 进程内实现
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(TimeCacheProperties.class)
@ConditionalOnProperty(prefix = "timecache", name = "enabled", havingValue = "true", matchIfMissing = true)
@AutoConfigureAfter(name = {
        "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration",
        "org.redisson.spring.starter.RedissonAutoConfiguration"
})
@Import({
        RedisTierConfiguration.class,
        RedissonLimiterConfiguration.class,
        LocalTierConfiguration.class
})
public class TimeCacheAutoConfiguration {

    public TimeCacheAutoConfiguration() {
        log.info("TimeCache auto-configuration initializing...");
    }

    /**
     * 用户动作台账
     */
    @Bean
    @ConditionalOnMissingBean
    public UserActionLedger userActionLedger(DistributedCache distributedCache, TimeCacheProperties properties) {
        return new DistributedUserActionLedger(distributedCache, properties.getLedger().getTtlSeconds());
    }

    /**
     * 计分引擎
     */
    @Bean
    @ConditionalOnMissingBean
    public ScoreEngine scoreEngine(UserActionLedger userActionLedger) {
        return new ScoreEngine(userActionLedger);
    }

    /**
     * 多级缓存管理器工厂
     */
    @Bean
    @ConditionalOnMissingBean
    public TierCacheManagerFactory tierCacheManagerFactory(DistributedCache distributedCache,
                                                           TimeCacheProperties properties) {
        log.info("TimeCache 部署版本: {}, 共享缓存: {}",
                properties.getDeploymentVersion(), distributedCache.getClass().getSimpleName());
        return new TierCacheManagerFactory(
                distributedCache,
                properties.getDeploymentVersion(),
                properties.getDistributed().getTtlSeconds()
        );
    }
}
