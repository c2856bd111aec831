package cn.bafuka.timecache.decay;

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * DecayAccumulator 单元测试
 */
public class DecayAccumulatorTest {

    private static final double DELTA = 1e-9;

    /**
     * 经过一个半衰期后数值减半
     */
    @Test
    public void testAdvance_HalvesAfterOneHalfLife() {
        DecayAccumulator accumulator = new DecayAccumulator(10);
        accumulator.advance(0, 8);

        assertEquals(4.0, accumulator.advance(10, 0), DELTA);
        assertEquals(10.0, accumulator.getLastTime(), DELTA);
        assertEquals(5.0, accumulator.advance(20, 3), DELTA);
    }

    /**
     * peek 不修改状态，并且与 advance 计算结果一致
     */
    @Test
    public void testPeek_DoesNotMutate() {
        DecayAccumulator accumulator = new DecayAccumulator(60);
        accumulator.advance(0, 100);

        double first = accumulator.peek(60, 2);
        double second = accumulator.peek(60, 2);

        assertEquals(52.0, first, DELTA);
        assertEquals(first, second, DELTA);
        assertEquals(100.0, accumulator.getValue(), DELTA);
        assertEquals(0.0, accumulator.getLastTime(), DELTA);
        assertEquals(first, accumulator.advance(60, 2), DELTA);
    }

    /**
     * 倒填时间的事件：时间不回退，增量按 decayFactor^(lastTime-now) 折算
     * 该行为会放大晚到的事件，这里固定下来以防排序语义被无意改变
     */
    @Test
    public void testAdvance_BackdatedEventScalesIncrement() {
        DecayAccumulator accumulator = new DecayAccumulator(10);
        accumulator.advance(20, 4);

        double value = accumulator.advance(10, 4);

        assertEquals(4.0 + 4.0 * 0.5, value, DELTA);
        assertEquals(20.0, accumulator.getLastTime(), DELTA);
    }

    /**
     * 同一时刻的多次累加不衰减
     */
    @Test
    public void testAdvance_SameTimeAccumulates() {
        DecayAccumulator accumulator = new DecayAccumulator(24);
        accumulator.advance(5, 1);
        accumulator.advance(5, 1);

        assertEquals(2.0, accumulator.getValue(), DELTA);
    }

    @Test
    public void testDecayFactor() {
        DecayAccumulator accumulator = new DecayAccumulator(2);
        assertEquals(Math.sqrt(0.5), accumulator.getDecayFactor(), DELTA);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConstructor_RejectsZeroHalfLife() {
        new DecayAccumulator(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConstructor_RejectsNaNHalfLife() {
        new DecayAccumulator(Double.NaN);
    }
}
