package org.checkout.util;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * 业务时间工具
 * - 统一按 UTC 生成，与时钟所在时区无关，夏令时回拨时时间戳仍单调
 * - 截断到毫秒，保证应用写入的时间与数据库中保存的时间可以精确比较
 */
public final class TimeUtil {

    private TimeUtil() {
    }

    public static LocalDateTime now(Clock clock) {
        return LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
    }
}
