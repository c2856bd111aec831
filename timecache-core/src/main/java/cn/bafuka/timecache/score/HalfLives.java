package cn.bafuka.timecache.score;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 常用半衰期（小时）
 */
public final class HalfLives {

    public static final double DAY = 24;
    public static final double WEEK = 7 * DAY;
    public static final double YEAR = 365 * DAY + 6;
    public static final double MONTH = YEAR / 12;

    public static final List<Double> DEFAULTS =
            Collections.unmodifiableList(Arrays.asList(DAY, WEEK, MONTH, YEAR));

    private HalfLives() {
    }

    /**
     * 半衰期名称，非常用半衰期直接使用数值
     *
     * @param halfLife 半衰期（小时）
     * @return day / week / month / year 或数值字符串
     */
    public static String name(double halfLife) {
        if (halfLife == DAY) {
            return "day";
        }
        if (halfLife == WEEK) {
            return "week";
        }
        if (halfLife == MONTH) {
            return "month";
        }
        if (halfLife == YEAR) {
            return "year";
        }
        return halfLife == Math.rint(halfLife) ? String.valueOf((long) halfLife) : String.valueOf(halfLife);
    }

    /**
     * 分数字段名，例如 score_day
     *
     * @param halfLife 半衰期（小时）
     * @return 字段名
     */
    public static String property(double halfLife) {
        return "score_" + name(halfLife);
    }
}
