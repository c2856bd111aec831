package cn.bafuka.timecache.core;

import cn.bafuka.timecache.score.ScoreClock;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Objects;

/**
 * 缓存会话（请求上下文）
 * 显式传入每一次缓存调用，持有请求级缓存层、当前时间和当前用户
 *
 * 用法：
 * <pre>
 * try (CacheSession session = CacheSession.builder().sessionId(id).userId(user).now(now).build()) {
 *     Post post = manager.get(session, "42");
 *     ...
 * } // 关闭时写回所有脏条目
 * </pre>
 */
@Slf4j
public class CacheSession implements AutoCloseable {

    /**
     * 会话 ID
     */
    private final String sessionId;

    /**
     * 当前用户 ID，匿名请求为 null
     */
    private final String userId;

    /**
     * 请求时间（整个请求内固定）
     */
    private final Instant now;

    /**
     * 请求级缓存层
     */
    private final LocalTier localTier = new LocalTier();

    private boolean closed;

    private CacheSession(String sessionId, String userId, Instant now) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.now = Objects.requireNonNull(now, "now");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 当前时间（秒），用于写入限流
     *
     * @return 自 Unix 纪元以来的秒数
     */
    public double nowSeconds() {
        return now.toEpochMilli() / 1000.0;
    }

    /**
     * 当前时间（小时），用于时间分数
     *
     * @return 自 2000-01-01 以来的小时数
     */
    public double nowHours() {
        return ScoreClock.hoursSinceEpoch(now);
    }

    /**
     * 会话结束：对请求级缓存中的所有实体执行延迟写回
     * 这是批量限流写入发生的唯一位置
     */
    public void flush() {
        log.debug("会话结束写回: sessionId={}, entries={}", sessionId, localTier.size());
        localTier.flushAll(this);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        flush();
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUserId() {
        return userId;
    }

    public Instant getNow() {
        return now;
    }

    public LocalTier getLocalTier() {
        return localTier;
    }

    public static class Builder {
        private String sessionId;
        private String userId;
        private Instant now;

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder now(Instant now) {
            this.now = now;
            return this;
        }

        public CacheSession build() {
            return new CacheSession(sessionId, userId, now == null ? Instant.now() : now);
        }
    }
}
