package cn.bafuka.timecache.tier.impl;

import cn.bafuka.timecache.core.CacheSession;
import cn.bafuka.timecache.core.CacheStats;
import cn.bafuka.timecache.core.CacheableEntity;
import cn.bafuka.timecache.core.EntryFlusher;
import cn.bafuka.timecache.core.EntryState;
import cn.bafuka.timecache.core.LocalTier;
import cn.bafuka.timecache.core.Migratable;
import cn.bafuka.timecache.dataplane.DistributedCache;
import cn.bafuka.timecache.dataplane.DurableStore;
import cn.bafuka.timecache.exception.CacheConflictException;
import cn.bafuka.timecache.tier.TierCacheManager;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * 多级缓存管理器默认实现
 * 请求级缓存 -> 分布式缓存 -> 持久化存储
 *
 * @param <E> 实体类型
 */
@Slf4j
public class DefaultTierCacheManager<E extends CacheableEntity> implements TierCacheManager<E>, EntryFlusher {

    /**
     * 实体类型
     */
    private final Class<E> type;

    /**
     * 持久化存储
     */
    private final DurableStore<E> durableStore;

    /**
     * 分布式缓存
     */
    private final DistributedCache distributedCache;

    /**
     * 部署版本，滚动升级后不会读到旧版本缓存的数据结构
     */
    private final String deploymentVersion;

    /**
     * 分布式缓存过期时间（秒）
     */
    private final long distributedTtlSeconds;

    private final AtomicLong localHits = new AtomicLong();
    private final AtomicLong distributedHits = new AtomicLong();
    private final AtomicLong durableLoads = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong flushes = new AtomicLong();
    private final AtomicLong throttledFlushes = new AtomicLong();
    private final AtomicLong flushFailures = new AtomicLong();

    public DefaultTierCacheManager(Class<E> type,
                                   DurableStore<E> durableStore,
                                   DistributedCache distributedCache,
                                   String deploymentVersion,
                                   long distributedTtlSeconds) {
        this.type = type;
        this.durableStore = durableStore;
        this.distributedCache = distributedCache;
        this.deploymentVersion = deploymentVersion;
        this.distributedTtlSeconds = distributedTtlSeconds;
    }

    @Override
    public E get(CacheSession session, String keyName) {
        E entity = fromCache(session, keyName);
        if (entity != null) {
            return entity;
        }

        // 回源持久化存储
        entity = durableStore.load(keyName);
        if (entity == null) {
            misses.incrementAndGet();
            log.debug("持久化存储未命中: key={}", cacheKey(keyName));
            return null;
        }

        durableLoads.incrementAndGet();
        log.debug("从持久化存储读取: key={}", cacheKey(keyName));
        // 保存时的快照可能带着写入前的脏状态
        entity.getEntryState().resetAfterDurableLoad();
        upgradeSchema(entity);
        ensureCached(session, entity);
        return entity;
    }

    @Override
    public E getOrCreate(CacheSession session, String keyName, Function<String, E> factory) {
        E entity = get(session, keyName);
        if (entity != null) {
            return entity;
        }

        entity = factory.apply(keyName);
        log.info("创建实体: key={}", cacheKey(keyName));
        put(session, entity);
        return entity;
    }

    @Override
    public String put(CacheSession session, E entity) {
        String key = durableStore.save(entity);
        flushes.incrementAndGet();
        log.debug("写入持久化存储: key={}", cacheKey(entity.getKeyName()));

        entity.getEntryState().markFlushed(session.nowSeconds());
        ensureCached(session, entity);
        return key;
    }

    @Override
    public void ensureCached(CacheSession session, E entity) {
        String cacheKey = cacheKey(entity.getKeyName());
        CacheableEntity cached = session.getLocalTier().get(cacheKey);

        if (cached == entity) {
            // 已在请求级缓存中，未写入共享缓存时补写，供其他实例使用
            if (!entity.getEntryState().isPresentInDistributedTier()) {
                writeToCache(session, cacheKey, entity);
            }
            return;
        }

        if (cached != null && !cached.getEntryState().isClean()) {
            throw new CacheConflictException(cacheKey);
        }

        writeToCache(session, cacheKey, entity);
    }

    @Override
    public void markDirty(CacheSession session, E entity, boolean critical) {
        entity.getEntryState().markDirty(critical);
        ensureCached(session, entity);
    }

    @Override
    public void deferredFlush(CacheSession session, E entity) {
        EntryState state = entity.getEntryState();
        if (state.isClean()) {
            return;
        }

        // 冲突属于编程错误，不在此处吞掉
        ensureCached(session, entity);

        double now = session.nowSeconds();
        boolean charged = false;
        try {
            if (state.shouldFlush(now)) {
                charged = true;
                put(session, entity);
            } else {
                throttledFlushes.incrementAndGet();
                log.debug("写入限流，延后落库: key={}, state={}", cacheKey(entity.getKeyName()), state.getState());
            }
        } catch (RuntimeException e) {
            // 内存中的数据仍然正确，保持脏状态等待下一次写回
            flushFailures.incrementAndGet();
            if (charged) {
                state.refundFlush(now);
            }
            log.warn("延迟写回失败: key={}, state={}, error={}",
                    cacheKey(entity.getKeyName()), state.getState(), e.getMessage(), e);
        }
    }

    @Override
    public void flushDeferred(CacheSession session, CacheableEntity entity) {
        deferredFlush(session, type.cast(entity));
    }

    @Override
    public boolean isCached(CacheSession session, E entity) {
        return session.getLocalTier().get(cacheKey(entity.getKeyName())) == entity;
    }

    @Override
    public void flushAndEvict(CacheSession session, E entity) {
        put(session, entity);

        String cacheKey = cacheKey(entity.getKeyName());
        session.getLocalTier().remove(cacheKey);
        distributedCache.delete(cacheKey);
        entity.getEntryState().setPresentInDistributedTier(false);
        log.info("落库并移出缓存: key={}", cacheKey);
    }

    @Override
    public String cacheKey(String keyName) {
        return type.getSimpleName() + "~" + keyName + "~Cache~" + deploymentVersion;
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.builder()
                .localHitCount(localHits.get())
                .distributedHitCount(distributedHits.get())
                .durableLoadCount(durableLoads.get())
                .missCount(misses.get())
                .flushCount(flushes.get())
                .throttledFlushCount(throttledFlushes.get())
                .flushFailureCount(flushFailures.get())
                .build();
    }

    /**
     * 从请求级缓存或分布式缓存读取
     *
     * @param session 当前会话
     * @param keyName 键名
     * @return 实体，未命中返回 null
     */
    private E fromCache(CacheSession session, String keyName) {
        String cacheKey = cacheKey(keyName);
        LocalTier localTier = session.getLocalTier();

        CacheableEntity local = localTier.get(cacheKey);
        if (local != null) {
            localHits.incrementAndGet();
            log.debug("请求级缓存命中: key={}", cacheKey);
            return type.cast(local);
        }

        Object shared = distributedCache.get(cacheKey);
        if (shared == null) {
            return null;
        }
        if (!type.isInstance(shared)) {
            log.warn("共享缓存数据类型不匹配，按未命中处理: key={}, actual={}",
                    cacheKey, shared.getClass().getName());
            return null;
        }

        E entity = type.cast(shared);
        // 不继承其他实例/请求的脏状态
        entity.getEntryState().resetAfterSharedRead();
        localTier.put(cacheKey, entity, this);
        distributedHits.incrementAndGet();
        log.debug("分布式缓存命中: key={}", cacheKey);
        return entity;
    }

    /**
     * 无条件写入请求级缓存和分布式缓存
     */
    private void writeToCache(CacheSession session, String cacheKey, E entity) {
        session.getLocalTier().put(cacheKey, entity, this);
        distributedCache.set(cacheKey, entity, distributedTtlSeconds);
        entity.getEntryState().setPresentInDistributedTier(true);
        log.debug("写入缓存: key={}", cacheKey);
    }

    /**
     * 从持久化存储读出后，逐级升级到当前模式版本并写回
     */
    private void upgradeSchema(E entity) {
        if (!(entity instanceof Migratable)) {
            return;
        }

        Migratable migratable = (Migratable) entity;
        int oldVersion = migratable.getSchemaVersion();
        if (oldVersion >= migratable.currentSchemaVersion()) {
            return;
        }

        while (migratable.getSchemaVersion() < migratable.currentSchemaVersion()) {
            int next = migratable.getSchemaVersion() + 1;
            migratable.migrate(next);
            migratable.setSchemaVersion(next);
        }

        durableStore.save(entity);
        log.info("升级模式版本: type={}, key={}, {} -> {}",
                type.getSimpleName(), entity.getKeyName(), oldVersion, migratable.getSchemaVersion());
    }
}
