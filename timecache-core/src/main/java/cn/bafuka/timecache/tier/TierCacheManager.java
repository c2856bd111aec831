package cn.bafuka.timecache.tier;

import cn.bafuka.timecache.core.CacheSession;
import cn.bafuka.timecache.core.CacheStats;
import cn.bafuka.timecache.core.CacheableEntity;

import java.util.function.Function;

/**
 * 多级缓存管理器
 * 依次查询请求级缓存、分布式缓存和持久化存储，负责写穿透和限流写回
 *
 * @param <E> 实体类型
 */
public interface TierCacheManager<E extends CacheableEntity> {

    /**
     * 按键名获取实体
     * 同一会话内多次获取返回同一个对象
     *
     * @param session 当前会话
     * @param keyName 键名
     * @return 实体，不存在返回 null
     */
    E get(CacheSession session, String keyName);

    /**
     * 获取实体，全部未命中时用 factory 创建并立即写入持久化存储
     *
     * @param session 当前会话
     * @param keyName 键名
     * @param factory 创建函数
     * @return 实体
     */
    E getOrCreate(CacheSession session, String keyName, Function<String, E> factory);

    /**
     * 写穿透：同步写入持久化存储，状态重置为 CLEAN，再写入缓存
     *
     * @param session 当前会话
     * @param entity  实体
     * @return 实体键名
     */
    String put(CacheSession session, E entity);

    /**
     * 确保实体在请求级缓存和分布式缓存中
     *
     * @param session 当前会话
     * @param entity  实体
     * @throws cn.bafuka.timecache.exception.CacheConflictException 请求级缓存中的另一个对象有未落库修改
     */
    void ensureCached(CacheSession session, E entity);

    /**
     * 标记为脏数据并确保缓存
     *
     * @param session  当前会话
     * @param entity   实体
     * @param critical true 表示下次落库机会必须写入
     */
    void markDirty(CacheSession session, E entity, boolean critical);

    /**
     * 延迟写回：脏数据在限流放行时落库，落库失败只记录日志
     *
     * @param session 当前会话
     * @param entity  实体
     */
    void deferredFlush(CacheSession session, E entity);

    /**
     * 请求级缓存中是否就是这个对象
     *
     * @param session 当前会话
     * @param entity  实体
     * @return true 表示已缓存
     */
    boolean isCached(CacheSession session, E entity);

    /**
     * 落库后从请求级缓存和分布式缓存中移除
     *
     * @param session 当前会话
     * @param entity  实体
     */
    void flushAndEvict(CacheSession session, E entity);

    /**
     * 缓存键：类型名~键名~Cache~部署版本
     *
     * @param keyName 键名
     * @return 缓存键
     */
    String cacheKey(String keyName);

    CacheStats getStats();
}
