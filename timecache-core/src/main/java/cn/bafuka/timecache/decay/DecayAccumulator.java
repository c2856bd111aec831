package cn.bafuka.timecache.decay;

import java.io.Serializable;

/**
 * 指数衰减累加器
 * 数值每经过一个半衰期衰减一半，是限流器和时间分数共用的数学原语
 *
 * 时间单位是抽象的，由调用方决定（限流器使用秒，时间分数使用小时）
 */
public class DecayAccumulator implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 半衰期
     */
    private final double halfLife;

    /**
     * 单位时间衰减系数：0.5^(1/halfLife)
     */
    private final double decayFactor;

    /**
     * 当前值（在 lastTime 时刻有效）
     */
    private double value;

    /**
     * 最近一次推进的时间
     */
    private double lastTime;

    public DecayAccumulator(double halfLife) {
        this(halfLife, 0.0, 0.0);
    }

    public DecayAccumulator(double halfLife, double value, double lastTime) {
        if (!(halfLife > 0)) {
            throw new IllegalArgumentException("halfLife must be > 0, got " + halfLife);
        }
        this.halfLife = halfLife;
        this.decayFactor = Math.pow(0.5, 1.0 / halfLife);
        this.value = value;
        this.lastTime = lastTime;
    }

    /**
     * 推进到 now 并累加 increment
     * now 不晚于 lastTime 时不回退时间，而是按 decayFactor^(lastTime-now) 折减增量
     *
     * @param now       当前时间
     * @param increment 增量
     * @return 推进后的值
     */
    public double advance(double now, double increment) {
        if (now > lastTime) {
            value = value * Math.pow(decayFactor, now - lastTime) + increment;
            lastTime = now;
        } else {
            value += increment * Math.pow(decayFactor, lastTime - now);
        }
        return value;
    }

    /**
     * 只读查询，与 {@link #advance(double, double)} 计算相同但不修改状态
     *
     * @param now       查询时间
     * @param increment 假设的增量
     * @return 查询时刻的值
     */
    public double peek(double now, double increment) {
        if (now > lastTime) {
            return value * Math.pow(decayFactor, now - lastTime) + increment;
        }
        return value + increment * Math.pow(decayFactor, lastTime - now);
    }

    public double peek(double now) {
        return peek(now, 0.0);
    }

    public double getHalfLife() {
        return halfLife;
    }

    public double getDecayFactor() {
        return decayFactor;
    }

    public double getValue() {
        return value;
    }

    public double getLastTime() {
        return lastTime;
    }

    @Override
    public String toString() {
        return "DecayAccumulator{halfLife=" + halfLife + ", value=" + value + ", lastTime=" + lastTime + '}';
    }
}
