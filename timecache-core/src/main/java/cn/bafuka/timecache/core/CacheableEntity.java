package cn.bafuka.timecache.core;

import java.io.Serializable;

/**
 * 可缓存实体契约
 *
 * 实体必须使用字符串键名作为唯一标识，不支持数据库自增 ID。
 * 实体会被序列化写入分布式缓存，{@link EntryState} 随之一起序列化，
 * 从共享缓存读出后由缓存管理器重置为 CLEAN。
 */
public interface CacheableEntity extends Serializable {

    /**
     * 实体键名（同类型内唯一）
     *
     * @return 键名
     */
    String getKeyName();

    /**
     * 条目状态跟踪器，不能返回 null
     *
     * @return 状态跟踪器
     */
    EntryState getEntryState();
}
