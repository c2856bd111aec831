package cn.bafuka.timecache.dataplane.impl;

import cn.bafuka.timecache.core.UserActionLedger;
import cn.bafuka.timecache.dataplane.DistributedCache;
import lombok.extern.slf4j.Slf4j;

/**
 * 基于分布式缓存的用户动作台账
 * 先读后写，不加锁：极少数并发重复请求可能都通过，可以接受
 */
@Slf4j
public class DistributedUserActionLedger implements UserActionLedger {

    private static final String KEY_PREFIX = "once~";

    private final DistributedCache distributedCache;

    /**
     * 标记保留时间（秒）
     */
    private final long ttlSeconds;

    public DistributedUserActionLedger(DistributedCache distributedCache, long ttlSeconds) {
        this.distributedCache = distributedCache;
        this.ttlSeconds = ttlSeconds;
    }

    @Override
    public boolean firstTime(String userId, String action) {
        if (userId == null || action == null) {
            return false;
        }

        String key = KEY_PREFIX + userId + "~" + action;
        if (distributedCache.get(key) != null) {
            return false;
        }

        distributedCache.set(key, Boolean.TRUE, ttlSeconds);
        log.debug("记录用户动作: userId={}, action={}", userId, action);
        return true;
    }
}
