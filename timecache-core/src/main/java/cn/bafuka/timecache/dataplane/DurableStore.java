package cn.bafuka.timecache.dataplane;

import cn.bafuka.timecache.core.CacheableEntity;

import java.util.List;

/**
 * 持久化存储接口（权威数据源）
 * 只做单实体读写，不提供跨实体事务
 *
 * @param <E> 实体类型
 */
public interface DurableStore<E extends CacheableEntity> {

    /**
     * 按键名加载实体
     *
     * @param keyName 键名
     * @return 实体，不存在返回 null
     */
    E load(String keyName);

    /**
     * 保存实体（插入或覆盖）
     *
     * @param entity 实体
     * @return 实体键名
     */
    String save(E entity);

    /**
     * 条件查询
     *
     * @param query 查询条件
     * @return 实体列表（不经过缓存，可能不是缓存中的实例）
     */
    List<E> queryByFilter(EntityQuery<E> query);
}
