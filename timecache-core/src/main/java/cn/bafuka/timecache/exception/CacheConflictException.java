package cn.bafuka.timecache.exception;

/**
 * 缓存冲突异常
 * 试图用另一个对象替换请求级缓存中已被修改（未落库）的实体时抛出，
 * 静默替换会丢失本地修改，属于编程错误
 */
public class CacheConflictException extends TimeCacheException {

    /**
     * 缓存键
     */
    private final String cacheKey;

    public CacheConflictException(String cacheKey) {
        super("Replacing modified entity in request cache: " + cacheKey);
        this.cacheKey = cacheKey;
    }

    public String getCacheKey() {
        return cacheKey;
    }
}
