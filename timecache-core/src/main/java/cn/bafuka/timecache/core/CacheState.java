package cn.bafuka.timecache.core;

/**
 * 缓存条目状态
 * 按声明顺序递增：CLEAN < DIRTY < CRITICAL
 */
public enum CacheState {

    /**
     * 与持久化存储一致（或本次会话尚未修改）
     */
    CLEAN,

    /**
     * 本地已修改，受写入限流约束，择机落库
     */
    DIRTY,

    /**
     * 本地已修改，下一次落库机会必须写入
     */
    CRITICAL;

    /**
     * 是否比另一个状态更高
     *
     * @param other 另一个状态
     * @return true 表示更高
     */
    public boolean isHigherThan(CacheState other) {
        return compareTo(other) > 0;
    }
}
