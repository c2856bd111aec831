package cn.bafuka.timecache.decay;

import lombok.extern.slf4j.Slf4j;

import java.io.Serializable;

/**
 * 基于指数衰减的限流器
 * 在没有新负载时，累计值每 halfLife 秒衰减一半
 *
 * 只在未超限时提交负载，因此无论调用多频繁，衰减到阈值以下后最小负载的请求总能通过
 */
@Slf4j
public class RateLimiter implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 阈值
     */
    private final double threshold;

    /**
     * 累加器
     */
    private final DecayAccumulator accumulator;

    public RateLimiter(double threshold, double halfLifeSeconds) {
        this.threshold = threshold;
        this.accumulator = new DecayAccumulator(halfLifeSeconds);
    }

    /**
     * 判断加上 cost 后是否超过阈值，未超过时提交 cost
     *
     * @param now  当前时间（秒）
     * @param cost 本次负载
     * @return true 表示超限（负载未提交）
     */
    public synchronized boolean isExceeded(double now, double cost) {
        // 时间倒退时按超限处理，避免记账错误
        if (now < accumulator.getLastTime()) {
            log.debug("限流器时间倒退，按超限处理: now={}, lastTime={}", now, accumulator.getLastTime());
            return true;
        }

        double projected = accumulator.peek(now) + cost;
        if (projected > threshold) {
            return true;
        }

        accumulator.advance(now, cost);
        return false;
    }

    public boolean isExceeded(double now) {
        return isExceeded(now, 1.0);
    }

    /**
     * 退还已提交的负载，累计值不会低于 0
     *
     * @param now  提交负载时的时间（秒）
     * @param cost 退还的负载
     */
    public synchronized void refund(double now, double cost) {
        if (now < accumulator.getLastTime()) {
            return;
        }
        double current = accumulator.peek(now);
        accumulator.advance(now, -Math.min(cost, current));
    }

    /**
     * 当前累计值（只读）
     *
     * @param now 当前时间（秒）
     * @return 累计值
     */
    public synchronized double currentValue(double now) {
        return accumulator.peek(now);
    }

    public double getThreshold() {
        return threshold;
    }

    public double getHalfLifeSeconds() {
        return accumulator.getHalfLife();
    }

    public synchronized double getLastTime() {
        return accumulator.getLastTime();
    }
}
