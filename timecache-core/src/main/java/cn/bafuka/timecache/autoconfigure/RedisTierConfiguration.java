package cn.bafuka.timecache.autoconfigure;

import cn.bafuka.timecache.config.TimeCacheProperties;
import cn.bafuka.timecache.dataplane.DistributedCache;
import cn.bafuka.timecache.dataplane.impl.RedisDistributedCache;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;

/**
 * Redis 分布式缓存（存在 RedisConnectionFactory 时生效）
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnClass(RedisTemplate.class)
@ConditionalOnBean(RedisConnectionFactory.class)
class RedisTierConfiguration {

    @Bean
    @ConditionalOnMissingBean(DistributedCache.class)
    public RedisDistributedCache redisDistributedCache(RedisConnectionFactory connectionFactory,
                                                       TimeCacheProperties properties) {
        // 实体按 JDK 序列化写入，版本不兼容的数据读取失败后按未命中处理
        RedisTemplate<String, Object> redisTemplate = new RedisTemplate<>();
        redisTemplate.setConnectionFactory(connectionFactory);
        redisTemplate.setKeySerializer(RedisSerializer.string());
        redisTemplate.setValueSerializer(RedisSerializer.java());
        redisTemplate.afterPropertiesSet();
        return new RedisDistributedCache(redisTemplate, properties.getDistributed().getKeyPrefix());
    }
}
