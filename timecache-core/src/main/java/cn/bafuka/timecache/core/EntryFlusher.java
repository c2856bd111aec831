package cn.bafuka.timecache.core;

/**
 * 会话结束时负责写回请求级缓存条目的组件
 * 每个条目登记到请求级缓存时都会带上它的写回者
 */
public interface EntryFlusher {

    /**
     * 延迟写回（受限流约束）
     *
     * @param session 当前会话
     * @param entity  实体
     */
    void flushDeferred(CacheSession session, CacheableEntity entity);
}
