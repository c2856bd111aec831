package cn.bafuka.timecache.tier;

import cn.bafuka.timecache.core.CacheableEntity;
import cn.bafuka.timecache.dataplane.DistributedCache;
import cn.bafuka.timecache.dataplane.DurableStore;
import cn.bafuka.timecache.tier.impl.DefaultTierCacheManager;
import lombok.extern.slf4j.Slf4j;

/**
 * 多级缓存管理器工厂
 * 同一个分布式缓存和部署版本下，为每种实体类型创建管理器
 */
@Slf4j
public class TierCacheManagerFactory {

    private final DistributedCache distributedCache;

    private final String deploymentVersion;

    private final long distributedTtlSeconds;

    public TierCacheManagerFactory(DistributedCache distributedCache, String deploymentVersion, long distributedTtlSeconds) {
        this.distributedCache = distributedCache;
        this.deploymentVersion = deploymentVersion;
        this.distributedTtlSeconds = distributedTtlSeconds;
    }

    /**
     * 创建管理器
     *
     * @param type         实体类型
     * @param durableStore 该类型的持久化存储
     * @param <E>          实体类型
     * @return 管理器
     */
    public <E extends CacheableEntity> TierCacheManager<E> create(Class<E> type, DurableStore<E> durableStore) {
        log.info("创建多级缓存管理器: type={}, deploymentVersion={}, ttl={}s",
                type.getSimpleName(), deploymentVersion, distributedTtlSeconds);
        return new DefaultTierCacheManager<>(type, durableStore, distributedCache, deploymentVersion, distributedTtlSeconds);
    }

    public String getDeploymentVersion() {
        return deploymentVersion;
    }
}
