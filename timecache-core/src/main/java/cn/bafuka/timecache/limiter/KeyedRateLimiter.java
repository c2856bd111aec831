package cn.bafuka.timecache.limiter;

/**
 * 键级限流器
 * 同一个键上的判定是串行的，不会出现两个请求同时通过最后一份额度
 */
public interface KeyedRateLimiter {

    /**
     * 判断并在未超限时提交负载
     *
     * @param key        限流键
     * @param nowSeconds 当前时间（秒）
     * @param cost       本次负载
     * @return true 表示超限
     */
    boolean isExceeded(String key, double nowSeconds, double cost);

    /**
     * 当前累计值
     *
     * @param key        限流键
     * @param nowSeconds 当前时间（秒）
     * @return 累计值，未知键返回 0
     */
    double currentRate(String key, double nowSeconds);
}
