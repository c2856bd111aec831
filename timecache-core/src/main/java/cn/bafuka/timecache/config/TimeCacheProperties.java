package cn.bafuka.timecache.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * TimeCache 配置属性
 * 从 application.yml 读取配置
 */
@Data
@ConfigurationProperties(prefix = "timecache")
public class TimeCacheProperties {

    /**
     * 是否启用 TimeCache
     */
    private boolean enabled = true;

    /**
     * 部署版本，作为缓存键的一部分
     */
    private String deploymentVersion = "1";

    /**
     * 分布式缓存配置
     */
    private DistributedConfig distributed = new DistributedConfig();

    /**
     * 键级限流器配置
     */
    private LimiterConfig limiter = new LimiterConfig();

    /**
     * 用户动作台账配置
     */
    private LedgerConfig ledger = new LedgerConfig();

    /**
     * 分布式缓存配置
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DistributedConfig {
        /**
         * Redis 键前缀
         */
        @Builder.Default
        private String keyPrefix = "timecache:";

        /**
         * 过期时间（秒），小于等于 0 表示不过期
         */
        @Builder.Default
        private long ttlSeconds = 3600;

        /**
         * 进程内共享缓存最大容量（未配置 Redis 时使用）
         */
        @Builder.Default
        private long maximumSize = 100000;
    }

    /**
     * 键级限流器配置
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LimiterConfig {
        /**
         * 限流阈值
         */
        @Builder.Default
        private double threshold = 10;

        /**
         * 衰减半衰期（秒）
         */
        @Builder.Default
        private double halfLifeSeconds = 60;

        /**
         * 限流器状态保留时间（秒）
         */
        @Builder.Default
        private long ttlSeconds = 300;

        /**
         * Redis 键前缀
         */
        @Builder.Default
        private String keyPrefix = "timecache:rate:";

        /**
         * 分布式锁等待时间（毫秒）
         */
        @Builder.Default
        private long lockWaitTimeMs = 3000;

        /**
         * 分布式锁租约时间（毫秒）
         */
        @Builder.Default
        private long lockLeaseTimeMs = 5000;
    }

    /**
     * 用户动作台账配置
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LedgerConfig {
        /**
         * 标记保留时间（秒），默认 30 天
         */
        @Builder.Default
        private long ttlSeconds = 30L * 24 * 3600;
    }
}
