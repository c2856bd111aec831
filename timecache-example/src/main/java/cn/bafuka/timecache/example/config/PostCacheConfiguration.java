package cn.bafuka.timecache.example.config;

import cn.bafuka.timecache.example.entity.Post;
import cn.bafuka.timecache.example.store.MybatisPostStore;
import cn.bafuka.timecache.tier.TierCacheManager;
import cn.bafuka.timecache.tier.TierCacheManagerFactory;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 帖子缓存配置
 */
@Configuration
public class PostCacheConfiguration {

    @Bean
    public TierCacheManager<Post> postCacheManager(TierCacheManagerFactory factory, MybatisPostStore postStore) {
        return factory.create(Post.class, postStore);
    }

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient(@Value("${spring.redis.host:localhost}") String host,
                                         @Value("${spring.redis.port:6379}") int port) {
        Config config = new Config();
        config.useSingleServer().setAddress("redis://" + host + ":" + port);
        return Redisson.create(config);
    }
}
