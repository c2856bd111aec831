package cn.bafuka.timecache.dataplane.impl;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.Assert.*;

/**
 * CaffeineDistributedCache 单元测试
 */
public class CaffeineDistributedCacheTest {

    private final AtomicLong nanos = new AtomicLong();

    private CaffeineDistributedCache cache;

    @Before
    public void setUp() {
        Ticker ticker = nanos::get;
        cache = new CaffeineDistributedCache(1000, ticker);
    }

    private void advanceSeconds(long seconds) {
        nanos.addAndGet(TimeUnit.SECONDS.toNanos(seconds));
    }

    @Test
    public void testSetAndGet() {
        cache.set("k", "value", 60);

        assertEquals("value", cache.get("k"));
        assertNull(cache.get("missing"));
        assertNull(cache.get(null));
    }

    /**
     * 每次读取返回新的副本
     */
    @Test
    public void testGet_ReturnsCopies() {
        List<String> value = new ArrayList<>();
        value.add("a");
        cache.set("k", value, 60);
        value.add("b");

        @SuppressWarnings("unchecked")
        List<String> first = (List<String>) cache.get("k");
        @SuppressWarnings("unchecked")
        List<String> second = (List<String>) cache.get("k");

        assertEquals(1, first.size());
        assertNotSame(first, second);
        first.add("c");
        assertEquals(1, second.size());
    }

    /**
     * 按条目 TTL 过期
     */
    @Test
    public void testTtl() {
        cache.set("short", "v", 10);
        cache.set("forever", "v", 0);

        advanceSeconds(9);
        assertNotNull(cache.get("short"));

        advanceSeconds(2);
        assertNull(cache.get("short"));

        advanceSeconds(365L * 24 * 3600);
        assertNotNull(cache.get("forever"));
    }

    /**
     * 无法解析的数据按未命中处理
     */
    @Test
    public void testGet_UnreadableBytesIsMiss() {
        cache.putRaw("k", new byte[]{1, 2, 3, 4});

        assertNull(cache.get("k"));
    }

    @Test
    public void testDelete() {
        cache.set("k", "v", 60);
        cache.delete("k");
        cache.delete(null);

        assertNull(cache.get("k"));
    }

    @Test
    public void testSet_IgnoresNull() {
        cache.set("k", null, 60);
        cache.set(null, "v", 60);

        assertNull(cache.get("k"));
        assertTrue(cache.getStats().startsWith("Shared Cache Stats"));
    }
}
