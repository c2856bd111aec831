package cn.bafuka.timecache.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 多级缓存统计信息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private long localHitCount;
    private long distributedHitCount;
    private long durableLoadCount;
    private long missCount;
    private long flushCount;
    private long throttledFlushCount;
    private long flushFailureCount;

    /**
     * 缓存命中率（请求级 + 分布式）
     *
     * @return 命中率（0.0 ~ 1.0）
     */
    public double hitRate() {
        long hits = localHitCount + distributedHitCount;
        long requestCount = hits + durableLoadCount + missCount;
        return requestCount == 0 ? 1.0 : (double) hits / requestCount;
    }
}
