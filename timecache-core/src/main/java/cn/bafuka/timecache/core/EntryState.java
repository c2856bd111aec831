package cn.bafuka.timecache.core;

import cn.bafuka.timecache.decay.RateLimiter;

import java.io.Serializable;

/**
 * 条目状态跟踪器
 * 决定实体是否、何时需要写回持久化存储
 *
 * 状态只会升级 CLEAN -> DIRTY -> CRITICAL，只有成功落库才会重置为 CLEAN
 */
public class EntryState implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 默认写入阈值（峰值约每两秒一次）
     */
    public static final double DEFAULT_WRITE_THRESHOLD = 30;

    /**
     * 默认写入限流半衰期（秒）
     */
    public static final double DEFAULT_WRITE_HALF_LIFE_SECONDS = 60;

    private CacheState state = CacheState.CLEAN;

    /**
     * 是否已写入分布式缓存
     */
    private boolean presentInDistributedTier;

    /**
     * 最近一次落库时间（秒），0 表示本实例未落库过
     */
    private double lastFlushTime;

    /**
     * 落库限流器，随实体一起进入共享缓存，跨请求生效
     */
    private final RateLimiter writeRate;

    public EntryState() {
        this(new RateLimiter(DEFAULT_WRITE_THRESHOLD, DEFAULT_WRITE_HALF_LIFE_SECONDS));
    }

    public EntryState(RateLimiter writeRate) {
        this.writeRate = writeRate;
    }

    /**
     * 标记为脏数据
     *
     * @param critical true 表示下次落库机会必须写入
     */
    public void markDirty(boolean critical) {
        CacheState target = critical ? CacheState.CRITICAL : CacheState.DIRTY;
        if (target.isHigherThan(state)) {
            state = target;
        }
        // 本地副本已变更，需要重新发布到共享缓存
        presentInDistributedTier = false;
    }

    /**
     * 是否应该落库
     * CRITICAL 总是落库；DIRTY 仅在写入限流放行时落库；CLEAN 从不落库
     *
     * @param now 当前时间（秒）
     * @return true 表示应该落库
     */
    public boolean shouldFlush(double now) {
        switch (state) {
            case CRITICAL:
                return true;
            case DIRTY:
                return !writeRate.isExceeded(now);
            default:
                return false;
        }
    }

    /**
     * 退还 {@link #shouldFlush(double)} 为 DIRTY 条目扣除的写入额度（落库失败时调用）
     *
     * @param now 扣除额度时使用的时间（秒）
     */
    public void refundFlush(double now) {
        if (state == CacheState.DIRTY) {
            writeRate.refund(now, 1.0);
        }
    }

    /**
     * 落库成功
     *
     * @param now 当前时间（秒）
     */
    public void markFlushed(double now) {
        state = CacheState.CLEAN;
        lastFlushTime = now;
    }

    /**
     * 从共享缓存读出后重置：共享副本不会被认为是脏的
     */
    public void resetAfterSharedRead() {
        state = CacheState.CLEAN;
        presentInDistributedTier = true;
    }

    /**
     * 从持久化存储读出后重置：与持久化存储一致，但尚未写入共享缓存
     */
    public void resetAfterDurableLoad() {
        state = CacheState.CLEAN;
        presentInDistributedTier = false;
    }

    public boolean isClean() {
        return state == CacheState.CLEAN;
    }

    public CacheState getState() {
        return state;
    }

    public boolean isPresentInDistributedTier() {
        return presentInDistributedTier;
    }

    public void setPresentInDistributedTier(boolean presentInDistributedTier) {
        this.presentInDistributedTier = presentInDistributedTier;
    }

    public double getLastFlushTime() {
        return lastFlushTime;
    }

    public RateLimiter getWriteRate() {
        return writeRate;
    }

    @Override
    public String toString() {
        return "EntryState{state=" + state
                + ", presentInDistributedTier=" + presentInDistributedTier
                + ", lastFlushTime=" + lastFlushTime + '}';
    }
}
