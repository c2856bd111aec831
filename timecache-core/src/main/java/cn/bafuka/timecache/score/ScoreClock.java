package cn.bafuka.timecache.score;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * 分数时间轴：自 2000-01-01T00:00Z 以来的小时数
 */
public final class ScoreClock {

    public static final Instant EPOCH = LocalDateTime.of(2000, 1, 1, 0, 0).toInstant(ZoneOffset.UTC);

    private static final double MILLIS_PER_HOUR = 60 * 60 * 1000.0;

    private ScoreClock() {
    }

    public static double hoursSinceEpoch(Instant instant) {
        return Duration.between(EPOCH, instant).toMillis() / MILLIS_PER_HOUR;
    }

    public static Instant instantFromHours(double hours) {
        return EPOCH.plusMillis(Math.round(hours * MILLIS_PER_HOUR));
    }
}
