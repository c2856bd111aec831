package cn.bafuka.timecache.dataplane;

/**
 * 分布式缓存接口（所有会话、所有进程共享）
 * 写入为“最后写入者胜出”，本层不加锁
 */
public interface DistributedCache {

    /**
     * 读取
     *
     * @param key 缓存键
     * @return 缓存值，不存在或无法解析返回 null
     */
    Object get(String key);

    /**
     * 写入
     *
     * @param key        缓存键
     * @param value      缓存值
     * @param ttlSeconds 过期时间（秒），小于等于 0 表示不过期
     */
    void set(String key, Object value, long ttlSeconds);

    /**
     * 删除
     *
     * @param key 缓存键
     */
    void delete(String key);
}
