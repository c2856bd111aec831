package cn.bafuka.timecache.tier;

import cn.bafuka.timecache.core.CacheSession;
import cn.bafuka.timecache.dataplane.impl.CaffeineDistributedCache;
import cn.bafuka.timecache.dataplane.impl.InMemoryDurableStore;
import cn.bafuka.timecache.fixture.Article;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * TierCacheManagerFactory 单元测试
 */
public class TierCacheManagerFactoryTest {

    /**
     * 同一工厂创建的管理器共享分布式缓存
     */
    @Test
    public void testCreate_SharesDistributedCache() {
        CaffeineDistributedCache sharedCache = new CaffeineDistributedCache();
        InMemoryDurableStore<Article> store = new InMemoryDurableStore<>(Article.class);
        TierCacheManagerFactory factory = new TierCacheManagerFactory(sharedCache, "v9", 60);
        store.save(new Article("1"));

        TierCacheManager<Article> first = factory.create(Article.class, store);
        TierCacheManager<Article> second = factory.create(Article.class, store);
        first.get(CacheSession.builder().sessionId("s1").build(), "1");
        second.get(CacheSession.builder().sessionId("s2").build(), "1");

        assertEquals("v9", factory.getDeploymentVersion());
        assertEquals("Article~1~Cache~v9", first.cacheKey("1"));
        assertNotNull(sharedCache.get("Article~1~Cache~v9"));
        assertEquals(1, second.getStats().getDistributedHitCount());
    }
}
