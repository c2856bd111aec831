package cn.bafuka.timecache.score;

import cn.bafuka.timecache.decay.DecayAccumulator;

/**
 * 单个半衰期上的临时计分器
 * 从寄存器还原线性值，推进后再换算回对数域
 */
class TimeScore {

    private final double halfLife;

    private final DecayAccumulator accumulator;

    private double score;

    private double logScore;

    TimeScore(double halfLife, ScoreRegister register) {
        this.halfLife = halfLife;
        double lastTime = register.getLastTime();
        double seed = Math.pow(2.0, register.getLogScore() - lastTime / halfLife);
        this.accumulator = new DecayAccumulator(halfLife, seed, lastTime);
        this.score = seed;
        this.logScore = register.getLogScore();
    }

    /**
     * 在 time 时刻累加 value 并重新锚定对数分数
     *
     * @param value 事件权重
     * @param time  事件时间（小时）
     */
    void increment(double value, double time) {
        score = accumulator.advance(time, value);
        logScore = toLog(score, accumulator.getLastTime());
        if (Double.isNaN(logScore)) {
            // 下溢：分数归零，对数分数置 0 使其排在同类最后；时间仍推进到当前
            score = 0.0;
            logScore = 0.0;
        }
    }

    /**
     * 只读投影
     *
     * @param time 查询时间（小时）
     * @return 线性分数
     */
    double peek(double time) {
        double value = accumulator.peek(time);
        return value > 0.0 && Double.isFinite(value) ? value : 0.0;
    }

    ScoreRegister toRegister() {
        return new ScoreRegister(logScore, accumulator.getLastTime());
    }

    double getScore() {
        return score;
    }

    double getLogScore() {
        return logScore;
    }

    private double toLog(double value, double lastTime) {
        if (!(value > 0.0) || !Double.isFinite(value)) {
            return Double.NaN;
        }
        double log = Math.log(value) / Math.log(2.0) + lastTime / halfLife;
        return Double.isFinite(log) ? log : Double.NaN;
    }
}
