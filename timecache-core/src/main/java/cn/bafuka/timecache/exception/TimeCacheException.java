package cn.bafuka.timecache.exception;

/**
 * TimeCache 异常基类
 */
public class TimeCacheException extends RuntimeException {

    public TimeCacheException(String message) {
        super(message);
    }

    public TimeCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
